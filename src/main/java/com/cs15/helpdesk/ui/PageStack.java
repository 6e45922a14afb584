package com.cs15.helpdesk.ui;

import java.awt.CardLayout;
import java.io.Serial;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import javax.swing.JComponent;
import javax.swing.JPanel;

import com.cs15.helpdesk.utils.Logger;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Content area that shows exactly one of the pre-built pages at a time.
 *
 * <p>Pages are handed in once and never recreated; switching only flips which card is visible.
 * The first page in {@link Page} order is shown initially.</p>
 *
 * <p><strong>Threading:</strong> create and use on the EDT.</p>
 */
public final class PageStack extends JPanel {

    @Serial
    private static final long serialVersionUID = 1L;

    private final CardLayout cards = new CardLayout();
    private final Map<Page, JComponent> pages;
    private Page current;

    /**
     * @param pages one component per {@link Page}; all three are required
     * @throws IllegalArgumentException when a page is missing
     */
    public PageStack(Map<Page, ? extends JComponent> pages) {
        Objects.requireNonNull(pages, "pages");
        setLayout(cards);
        setName("content.stack");

        EnumMap<Page, JComponent> copy = new EnumMap<>(Page.class);
        for (Page page : Page.values()) {
            JComponent view = pages.get(page);
            if (view == null) {
                throw new IllegalArgumentException("No component supplied for page " + page);
            }
            view.setName(page.pageName());
            copy.put(page, view);
            add(view, page.pageName());
        }
        this.pages = Collections.unmodifiableMap(copy);
        this.current = Page.values()[0];
    }

    /**
     * Makes {@code page} the visible page. Showing the current page again is harmless.
     *
     * @param page page to reveal
     */
    public void show(Page page) {
        Objects.requireNonNull(page, "page");
        cards.show(this, page.pageName());
        if (current != page) {
            Logger.logDebug("Showing page " + page.label() + " (was " + current.label() + ")");
        }
        current = page;
    }

    /** Page most recently shown. */
    public Page currentPage() {
        return current;
    }

    /**
     * Returns the pre-built component for {@code page}.
     *
     * @param page page to look up
     * @return the same instance on every call
     */
    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Pages are live Swing components owned by this stack")
    public JComponent pageComponent(Page page) {
        return pages.get(Objects.requireNonNull(page, "page"));
    }

    /** Pages whose component is currently visible; a single element in normal operation. */
    public List<Page> visiblePages() {
        List<Page> out = new ArrayList<>(1);
        for (Map.Entry<Page, JComponent> e : pages.entrySet()) {
            if (e.getValue().isVisible()) out.add(e.getKey());
        }
        return out;
    }
}
