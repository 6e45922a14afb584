package com.cs15.helpdesk.ui;

import java.util.Locale;

/**
 * The three fixed destinations of the sidebar, in display order.
 */
public enum Page {
    HOME("Home", "FileView.computerIcon"),
    DOCUMENTS("Documents", "FileView.fileIcon"),
    SETTINGS("Settings", "FileChooser.detailsViewIcon");

    private final String label;
    private final String iconKey;

    Page(String label, String iconKey) {
        this.label = label;
        this.iconKey = iconKey;
    }

    /** Sidebar button label. */
    public String label() {
        return label;
    }

    /** {@link javax.swing.UIManager} key of the look-and-feel icon shown on the button. */
    public String iconKey() {
        return iconKey;
    }

    /** Stable component name of the sidebar button, e.g. {@code nav.home}. */
    public String navName() {
        return "nav." + key();
    }

    /** Stable component name (and card name) of the page, e.g. {@code page.home}. */
    public String pageName() {
        return "page." + key();
    }

    private String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
