package com.cs15.helpdesk.ui;

import java.awt.Dimension;
import java.io.Serial;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import javax.swing.BorderFactory;
import javax.swing.JButton;
import javax.swing.JPanel;
import javax.swing.SwingConstants;
import javax.swing.UIManager;

import com.cs15.helpdesk.ui.animation.Easing;
import com.cs15.helpdesk.ui.animation.WidthAnimator;
import com.cs15.helpdesk.ui.primitives.FlatButton;
import com.cs15.helpdesk.ui.primitives.IconButton;
import com.cs15.helpdesk.ui.primitives.Theme;
import com.cs15.helpdesk.utils.Logger;
import com.cs15.helpdesk.utils.config.UiSettings;

import net.miginfocom.swing.MigLayout;

/**
 * Collapsible navigation column: a ☰ toggle followed by one {@link IconButton} per {@link Page}.
 *
 * <p><strong>Responsibilities:</strong> own the expanded/collapsed flag, animate the column width
 * between the configured widths, and hide or show button labels for the new state. Navigation
 * itself is wired by the owner through {@link #navButton(Page)}.</p>
 *
 * <p><strong>Threading:</strong> create and use on the EDT. Width frames arrive via a Swing
 * timer, so the EDT is never blocked.</p>
 */
public final class Sidebar extends JPanel {

    @Serial
    private static final long serialVersionUID = 1L;

    static final String TOGGLE_GLYPH = "☰";

    private final UiSettings.SidebarGeometry geometry;
    private final transient WidthAnimator animator;
    private final JButton toggleButton;
    private final Map<Page, IconButton> navButtons;

    private boolean expanded = true;
    private int shownWidth;

    /**
     * Builds an expanded sidebar.
     *
     * @param geometry expanded/collapsed widths and animation length
     */
    public Sidebar(UiSettings.SidebarGeometry geometry) {
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.shownWidth = geometry.expandedWidth();
        this.animator = new WidthAnimator(this::applyWidth, geometry.animationMillis(), Easing.IN_OUT_CUBIC);

        setName("sidebar");
        setBackground(Theme.Colors.SIDEBAR_BG);
        setLayout(new MigLayout(
                "insets 20 10 20 10, wrap 1, gapy " + Theme.Sizes.SIDEBAR_SPACING + ", aligny top",
                "[grow, fill]"
        ));

        toggleButton = buildToggleButton();
        toggleButton.addActionListener(e -> toggle());
        add(toggleButton, "h " + Theme.Sizes.TOGGLE_HEIGHT + "!");

        EnumMap<Page, IconButton> buttons = new EnumMap<>(Page.class);
        for (Page page : Page.values()) {
            IconButton btn = new IconButton(UIManager.getIcon(page.iconKey()), page.label());
            btn.setName(page.navName());
            buttons.put(page, btn);
            add(btn, "hmin " + Theme.Sizes.NAV_MIN_HEIGHT);
        }
        this.navButtons = Collections.unmodifiableMap(buttons);
    }

    /**
     * Flips between expanded and collapsed.
     *
     * <p>The flag and the button labels change immediately; the width follows with an
     * ease-in-out animation starting from the width currently shown.</p>
     */
    public void toggle() {
        int start = shownWidth;
        int end = expanded ? geometry.collapsedWidth() : geometry.expandedWidth();

        animator.animate(start, end);

        for (IconButton btn : navButtons.values()) {
            btn.updateTextVisibility(!expanded);
        }
        expanded = !expanded;
        Logger.logDebug("Sidebar " + (expanded ? "expanding" : "collapsing") + ": " + start + "px -> " + end + "px");
    }

    /** True while the sidebar is (or is animating towards) its expanded form. */
    public boolean isExpanded() {
        return expanded;
    }

    /** Width currently laid out, in pixels. */
    public int currentWidth() {
        return shownWidth;
    }

    /** Width that matches the current flag once any animation completes. */
    public int targetWidth() {
        return expanded ? geometry.expandedWidth() : geometry.collapsedWidth();
    }

    /** True while a width animation is in progress. */
    public boolean isAnimating() {
        return animator.isRunning();
    }

    /** Completes a running animation at once. */
    public void finishAnimation() {
        animator.finish();
    }

    /** The ☰ button. */
    public JButton toggleButton() {
        return toggleButton;
    }

    /**
     * Navigation button for {@code page}.
     *
     * @param page destination
     * @return the button created for that page
     */
    public IconButton navButton(Page page) {
        return navButtons.get(Objects.requireNonNull(page, "page"));
    }

    /** Navigation buttons in {@link Page} order. */
    public List<IconButton> navButtons() {
        return new ArrayList<>(navButtons.values());
    }

    @Override
    public Dimension getPreferredSize() {
        return new Dimension(shownWidth, super.getPreferredSize().height);
    }

    @Override
    public Dimension getMinimumSize() {
        return new Dimension(shownWidth, super.getMinimumSize().height);
    }

    @Override
    public Dimension getMaximumSize() {
        return new Dimension(shownWidth, super.getMaximumSize().height);
    }

    private void applyWidth(int newWidth) {
        if (newWidth == shownWidth) {
            return;
        }
        shownWidth = newWidth;
        revalidate();
        repaint();
    }

    private static JButton buildToggleButton() {
        FlatButton btn = new FlatButton(TOGGLE_GLYPH, Theme.Colors.TRANSPARENT, Theme.Colors.TOGGLE_BG_HOVER, 0);
        btn.setName("sidebar.toggle");
        btn.setToolTipText("Collapse or expand the sidebar");
        btn.setHorizontalAlignment(SwingConstants.LEFT);
        btn.setBorder(BorderFactory.createEmptyBorder(0, 5, 0, 0));
        Theme.font(btn, Theme.Fonts.TOGGLE, false);
        return btn;
    }
}
