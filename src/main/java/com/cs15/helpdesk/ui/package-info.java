/**
 * Swing UI for the helpdesk window.
 *
 * <p>{@link com.cs15.helpdesk.ui.HelpdeskPanel} is the frame's content. It places the collapsible
 * {@link com.cs15.helpdesk.ui.Sidebar} next to the {@link com.cs15.helpdesk.ui.PageStack} and
 * connects each sidebar button to one {@link com.cs15.helpdesk.ui.Page}. Pages are built once at
 * startup and only shown or hidden afterwards.</p>
 *
 * <p>All UI construction and mutation occur on the EDT; the sidebar animation runs on a Swing
 * timer, never on a worker thread.</p>
 */
package com.cs15.helpdesk.ui;
