package com.cs15.helpdesk;

import javax.swing.SwingUtilities;

import com.cs15.helpdesk.ui.MainWindow;
import com.cs15.helpdesk.utils.Logger;
import com.cs15.helpdesk.utils.Version;
import com.cs15.helpdesk.utils.config.UiSettings;
import com.cs15.helpdesk.utils.config.UiSettingsJson;

public final class HelpdeskApp {

    private HelpdeskApp() {}

    /**
     * Starts the desktop application.
     *
     * <p>Loads the bundled UI settings, then builds and shows {@link MainWindow} on the EDT.
     * The JVM exits when the window is closed.</p>
     *
     * @param args ignored
     */
    public static void main(String[] args) {
        SwingUtilities.invokeLater(HelpdeskApp::start);
    }

    static void start() {
        String version = Version.find().orElse("dev");

        try {
            UiSettings settings = UiSettingsJson.loadBundled();

            MainWindow window = new MainWindow(settings);
            window.setVisible(true);

            Logger.logInfo("Helpdesk Ticketing System v" + version + " started.");
        } catch (RuntimeException e) {
            Logger.logError("Helpdesk Ticketing System v" + version + " failed to start: " + e.getMessage(), e);
        }
    }
}
