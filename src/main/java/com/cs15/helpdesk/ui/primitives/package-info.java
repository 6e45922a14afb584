/**
 * Small, reusable Swing primitives used by the sidebar and pages:
 *
 * <ul>
 *   <li>{@code FlatButton}: rounded, borderless button with a rollover fill</li>
 *   <li>{@code IconButton}: navigation button whose label can be hidden</li>
 *   <li>{@code StatBox}: colored tile with a caption and a value</li>
 *   <li>{@code Theme}: palette, font sizes and spacing</li>
 * </ul>
 *
 * <p>These classes contain no navigation logic and are safe to reuse from any panel.</p>
 */
package com.cs15.helpdesk.ui.primitives;
