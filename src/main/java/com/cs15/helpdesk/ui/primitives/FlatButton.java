package com.cs15.helpdesk.ui.primitives;

import java.awt.Color;
import java.awt.Cursor;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.io.Serial;
import java.util.Objects;

import javax.swing.BorderFactory;
import javax.swing.JButton;

/**
 * Borderless button with a rounded background that brightens on rollover.
 *
 * <p>The look and feel paints text and icon only; the background is painted here so that
 * translucent fills (such as the sidebar toggle hover) render the same on every platform.</p>
 */
public class FlatButton extends JButton {

    @Serial
    private static final long serialVersionUID = 1L;

    private final Color background;
    private final Color hoverBackground;
    private final int arc;

    /**
     * @param text            button label
     * @param background      fill when idle
     * @param hoverBackground fill while the pointer is over the button
     * @param arc             corner diameter in pixels ({@code 0} for square corners)
     */
    public FlatButton(String text, Color background, Color hoverBackground, int arc) {
        super(text);
        this.background = Objects.requireNonNull(background, "background");
        this.hoverBackground = Objects.requireNonNull(hoverBackground, "hoverBackground");
        this.arc = Math.max(0, arc);

        setContentAreaFilled(false);
        setBorderPainted(false);
        setFocusPainted(false);
        setOpaque(false);
        setRolloverEnabled(true);
        setForeground(Theme.Colors.ON_COLOR);
        setBorder(BorderFactory.createEmptyBorder(8, 8, 8, 8));
        setCursor(Cursor.getPredefinedCursor(Cursor.HAND_CURSOR));
    }

    /** Fill currently painted behind the label. */
    public Color currentBackground() {
        return getModel().isRollover() ? hoverBackground : background;
    }

    @Override
    protected void paintComponent(Graphics g) {
        Color fill = currentBackground();
        if (fill.getAlpha() > 0) {
            Graphics2D g2 = (Graphics2D) g.create();
            g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2.setColor(fill);
            g2.fillRoundRect(0, 0, getWidth(), getHeight(), arc, arc);
            g2.dispose();
        }
        super.paintComponent(g);
    }
}
