package com.cs15.helpdesk.ui;

import java.awt.GridBagLayout;
import java.io.Serial;

import javax.swing.JLabel;
import javax.swing.JPanel;

import com.cs15.helpdesk.ui.primitives.Theme;

/** Informational page with a single centered message. */
public class PlaceholderPage extends JPanel {

    @Serial
    private static final long serialVersionUID = 1L;

    public static final String DOCUMENTS_TEXT = "📄 Welcome to Documents Page";
    public static final String SETTINGS_TEXT  = "⚙️ You are viewing Settings Page";

    private final JLabel message;

    /**
     * Creates the page.
     *
     * <p>Caller must invoke on the EDT.</p>
     *
     * @param text message shown in the middle of the page
     */
    public PlaceholderPage(String text) {
        super(new GridBagLayout()); // default constraints center the only child
        message = new JLabel(text);
        message.setName("placeholder.message");
        Theme.font(message, Theme.Fonts.PLACEHOLDER, false);
        add(message);
    }

    /** Text of the centered message. */
    public String message() {
        return message.getText();
    }
}
