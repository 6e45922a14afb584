package com.cs15.helpdesk.utils.config;

/**
 * Typed window and sidebar settings.
 * Immutable records; compact constructors validate ranges so panels never see bad geometry.
 */
public record UiSettings(Window window, SidebarGeometry sidebar) {

    public static final String DEFAULT_TITLE = "Helpdesk Ticketing System";

    /** Dedicated runtime exception for unusable settings. */
    public static final class UiSettingsException extends RuntimeException {
        public UiSettingsException(String message) { super(message); }
        public UiSettingsException(String message, Throwable cause) { super(message, cause); }
    }

    /** Frame title and on-screen bounds. */
    public record Window(String title, int x, int y, int width, int height) {
        public Window {
            title = (title == null || title.isBlank()) ? DEFAULT_TITLE : title;
            requirePositive("window.width", width);
            requirePositive("window.height", height);
        }
    }

    /** Sidebar widths in pixels and the collapse/expand animation length in milliseconds. */
    public record SidebarGeometry(int expandedWidth, int collapsedWidth, int animationMillis) {
        public SidebarGeometry {
            requirePositive("sidebar.expandedWidth", expandedWidth);
            requirePositive("sidebar.collapsedWidth", collapsedWidth);
            if (collapsedWidth >= expandedWidth) {
                throw new UiSettingsException("sidebar.collapsedWidth (" + collapsedWidth
                        + ") must be smaller than sidebar.expandedWidth (" + expandedWidth + ")");
            }
            if (animationMillis < 0) {
                throw new UiSettingsException("sidebar.animationMillis must not be negative: " + animationMillis);
            }
        }
    }

    public UiSettings {
        window  = window  == null ? defaultWindow()  : window;
        sidebar = sidebar == null ? defaultSidebar() : sidebar;
    }

    /** Built-in settings used when no resource overrides them. */
    public static UiSettings defaults() {
        return new UiSettings(defaultWindow(), defaultSidebar());
    }

    static Window defaultWindow() {
        return new Window(DEFAULT_TITLE, 100, 100, 900, 600);
    }

    static SidebarGeometry defaultSidebar() {
        return new SidebarGeometry(200, 60, 300);
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new UiSettingsException(key + " must be positive: " + value);
        }
    }
}
