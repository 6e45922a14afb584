package com.cs15.helpdesk.ui.primitives;

import java.awt.Color;
import java.awt.Font;

import javax.swing.JComponent;
import javax.swing.UIManager;

/**
 * Palette, font sizes and spacing shared by the sidebar and the pages.
 */
public final class Theme {

    private Theme() {}

    public static final class Colors {
        public static final Color SIDEBAR_BG        = new Color(0x5D_3F_D3);
        public static final Color NAV_BG            = new Color(0x7A_5F_D2);
        public static final Color NAV_BG_HOVER      = new Color(0x92_76_E6);
        public static final Color TOGGLE_BG_HOVER   = new Color(255, 255, 255, 26);
        public static final Color TRANSPARENT       = new Color(0, 0, 0, 0);
        public static final Color PRIMARY           = SIDEBAR_BG;
        public static final Color PRIMARY_HOVER     = NAV_BG;
        public static final Color ON_COLOR          = Color.WHITE;
        public static final Color MUTED_TEXT        = Color.GRAY;

        public static final Color STAT_OPEN         = new Color(0xFF_8C_42);
        public static final Color STAT_RESOLVED     = new Color(0x4C_AF_50);
        public static final Color STAT_PENDING      = new Color(0xFF_C1_07);

        private Colors() {}
    }

    public static final class Sizes {
        public static final int NAV_MIN_HEIGHT    = 40;
        public static final int TOGGLE_HEIGHT     = 40;
        public static final int CORNER_RADIUS     = 8;
        public static final int STAT_RADIUS       = 10;
        public static final int SIDEBAR_SPACING   = 15;

        private Sizes() {}
    }

    public static final class Fonts {
        public static final float TITLE      = 28f;
        public static final float PLACEHOLDER = 24f;
        public static final float TOGGLE     = 24f;
        public static final float STAT_VALUE = 24f;
        public static final float HEADING    = 18f;
        public static final float BODY       = 16f;
        public static final float SMALL      = 14f;

        private Fonts() {}
    }

    /**
     * Base font for the current look and feel, falling back to the logical dialog font.
     */
    public static Font baseFont() {
        Font f = UIManager.getFont("Label.font");
        return f != null ? f : new Font(Font.DIALOG, Font.PLAIN, 12);
    }

    /**
     * Applies a point size (and optional bold weight) to a component's font.
     *
     * @param c    target component
     * @param size point size
     * @param bold whether to use {@link Font#BOLD}
     */
    public static void font(JComponent c, float size, boolean bold) {
        Font base = c.getFont() != null ? c.getFont() : baseFont();
        c.setFont(base.deriveFont(bold ? Font.BOLD : Font.PLAIN, size));
    }
}
