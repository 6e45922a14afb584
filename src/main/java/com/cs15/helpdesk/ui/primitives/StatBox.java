package com.cs15.helpdesk.ui.primitives;

import java.awt.Color;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.io.Serial;
import java.util.Objects;

import javax.swing.JLabel;
import javax.swing.JPanel;

import net.miginfocom.swing.MigLayout;

/**
 * Rounded, colored tile showing a caption above a large value.
 *
 * <p>EDT: used as a standard Swing component.</p>
 */
public final class StatBox extends JPanel {

    @Serial
    private static final long serialVersionUID = 1L;

    private final Color fill;
    private final JLabel captionLabel;
    private final JLabel valueLabel;

    /**
     * @param caption tile caption, e.g. "Open Tickets"
     * @param value   number displayed under the caption
     * @param fill    tile background
     */
    public StatBox(String caption, int value, Color fill) {
        super(new MigLayout("insets 20, wrap 1, gapy 4", "[grow, fill]"));
        this.fill = Objects.requireNonNull(fill, "fill");
        setOpaque(false);

        captionLabel = new JLabel(caption);
        captionLabel.setForeground(Theme.Colors.ON_COLOR);
        Theme.font(captionLabel, Theme.Fonts.SMALL, false);

        valueLabel = new JLabel(String.valueOf(value));
        valueLabel.setForeground(Theme.Colors.ON_COLOR);
        Theme.font(valueLabel, Theme.Fonts.STAT_VALUE, true);

        add(captionLabel);
        add(valueLabel);
    }

    public String caption() {
        return captionLabel.getText();
    }

    public String valueText() {
        return valueLabel.getText();
    }

    public Color fill() {
        return fill;
    }

    @Override
    protected void paintComponent(Graphics g) {
        Graphics2D g2 = (Graphics2D) g.create();
        g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g2.setColor(fill);
        int arc = 2 * Theme.Sizes.STAT_RADIUS;
        g2.fillRoundRect(0, 0, getWidth(), getHeight(), arc, arc);
        g2.dispose();
        super.paintComponent(g);
    }
}
