package com.cs15.helpdesk.ui;

import java.awt.BorderLayout;
import java.io.Serial;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import javax.swing.JComponent;
import javax.swing.JPanel;
import javax.swing.ToolTipManager;

import com.cs15.helpdesk.utils.config.UiSettings;

/**
 * Top-level content of the helpdesk window.
 * <p>
 * Hosts the collapsible {@link Sidebar} on the left and the {@link PageStack} in the remaining
 * space, and wires each sidebar button to its page.</p>
 */
public class HelpdeskPanel extends JPanel {

    @Serial
    private static final long serialVersionUID = 1L;

    private final Sidebar sidebar;
    private final PageStack stack;

    /**
     * Constructs the window content with all pages built up front.
     * <p>
     * Caller must invoke on the EDT. Never creates a frame, so it is safe to build headless.</p>
     *
     * @param settings sidebar geometry source
     */
    public HelpdeskPanel(UiSettings settings) {
        Objects.requireNonNull(settings, "settings");
        setLayout(new BorderLayout());

        ToolTipManager.sharedInstance().setDismissDelay(10_000);

        sidebar = new Sidebar(settings.sidebar());
        stack = new PageStack(buildPages());

        for (Page page : Page.values()) {
            sidebar.navButton(page).addActionListener(e -> stack.show(page));
        }

        add(sidebar, BorderLayout.WEST);
        add(stack, BorderLayout.CENTER);
    }

    public Sidebar sidebar() {
        return sidebar;
    }

    public PageStack stack() {
        return stack;
    }

    private static Map<Page, JComponent> buildPages() {
        Map<Page, JComponent> pages = new EnumMap<>(Page.class);
        pages.put(Page.HOME,      new HomePage());
        pages.put(Page.DOCUMENTS, new PlaceholderPage(PlaceholderPage.DOCUMENTS_TEXT));
        pages.put(Page.SETTINGS,  new PlaceholderPage(PlaceholderPage.SETTINGS_TEXT));
        return pages;
    }
}
