package com.cs15.helpdesk.ui.primitives;

import java.awt.Dimension;
import java.io.Serial;

import javax.swing.Icon;
import javax.swing.SwingConstants;

/**
 * Sidebar navigation button: icon plus a label that can be hidden when the sidebar collapses.
 *
 * <p>The full label is kept as the tooltip, so a collapsed button still identifies itself.</p>
 */
public final class IconButton extends FlatButton {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String fullText;

    /**
     * @param icon look-and-feel icon (nullable; some headless look and feels supply none)
     * @param text label shown while the sidebar is expanded
     */
    public IconButton(Icon icon, String text) {
        super(text, Theme.Colors.NAV_BG, Theme.Colors.NAV_BG_HOVER, 2 * Theme.Sizes.CORNER_RADIUS);
        this.fullText = text == null ? "" : text;
        setIcon(icon);
        setIconTextGap(8);
        setHorizontalAlignment(SwingConstants.LEFT);
        setToolTipText(fullText);
        Theme.font(this, Theme.Fonts.BODY, false);
        setMinimumSize(new Dimension(0, Theme.Sizes.NAV_MIN_HEIGHT));
    }

    /** Label shown while expanded. */
    public String fullText() {
        return fullText;
    }

    /**
     * Shows the full label or clears it, leaving only the icon.
     *
     * @param showText {@code true} while the sidebar is expanded
     */
    public void updateTextVisibility(boolean showText) {
        setText(showText ? fullText : "");
    }

    @Override
    public Dimension getPreferredSize() {
        Dimension d = super.getPreferredSize();
        return new Dimension(d.width, Math.max(d.height, Theme.Sizes.NAV_MIN_HEIGHT));
    }
}
