/**
 * Root package for the Helpdesk Ticketing System desktop shell.
 *
 * <p>Hosts the entry point ({@link com.cs15.helpdesk.HelpdeskApp}) that loads UI settings and opens
 * the {@link com.cs15.helpdesk.ui.MainWindow} on the EDT. Classes here are light adapters; UI
 * composition lives in subpackages.</p>
 */
package com.cs15.helpdesk;
