package com.cs15.helpdesk.ui;

import java.io.Serial;
import java.util.Objects;

import javax.swing.JFrame;
import javax.swing.WindowConstants;

import com.cs15.helpdesk.utils.config.UiSettings;

/** Application frame; all content lives in {@link HelpdeskPanel}. */
public class MainWindow extends JFrame {

    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Creates the (not yet visible) frame.
     *
     * <p>Caller must invoke on the EDT. Throws {@link java.awt.HeadlessException} without a display.</p>
     *
     * @param settings window bounds, title and sidebar geometry
     */
    public MainWindow(UiSettings settings) {
        Objects.requireNonNull(settings, "settings");
        UiSettings.Window w = settings.window();

        setTitle(w.title());
        setDefaultCloseOperation(WindowConstants.EXIT_ON_CLOSE);
        setBounds(w.x(), w.y(), w.width(), w.height());

        setContentPane(new HelpdeskPanel(settings));
    }
}
