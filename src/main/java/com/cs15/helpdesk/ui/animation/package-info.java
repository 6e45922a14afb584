/**
 * Timer-driven property animation for Swing components.
 *
 * <p>{@link com.cs15.helpdesk.ui.animation.WidthAnimator} interpolates a width over time with an
 * {@link com.cs15.helpdesk.ui.animation.Easing} curve and delivers frames on the EDT.</p>
 */
package com.cs15.helpdesk.ui.animation;
