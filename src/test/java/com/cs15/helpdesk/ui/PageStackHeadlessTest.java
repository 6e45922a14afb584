package com.cs15.helpdesk.ui;

import static com.cs15.helpdesk.testutils.SwingLookup.onEdt;
import static com.cs15.helpdesk.testutils.SwingLookup.runEdt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.EnumMap;
import java.util.Map;

import javax.swing.JComponent;
import javax.swing.JPanel;

import org.junit.jupiter.api.Test;

class PageStackHeadlessTest {

    @Test
    void rejects_missing_page() {
        Map<Page, JComponent> pages = new EnumMap<>(Page.class);
        pages.put(Page.HOME, new JPanel());
        pages.put(Page.DOCUMENTS, new JPanel());

        assertThatThrownBy(() -> new PageStack(pages))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("SETTINGS");
    }

    @Test
    void names_cards_after_pages_and_shows_first_page() throws Exception {
        PageStack stack = onEdt(() -> new PageStack(plainPages()));

        for (Page page : Page.values()) {
            assertThat(stack.pageComponent(page).getName()).isEqualTo(page.pageName());
        }
        assertThat(stack.currentPage()).isEqualTo(Page.HOME);
        assertThat(stack.visiblePages()).containsExactly(Page.HOME);
    }

    @Test
    void showing_current_page_again_keeps_single_visible_page() throws Exception {
        PageStack stack = onEdt(() -> new PageStack(plainPages()));

        runEdt(() -> {
            stack.show(Page.SETTINGS);
            stack.show(Page.SETTINGS);
        });

        assertThat(stack.currentPage()).isEqualTo(Page.SETTINGS);
        assertThat(stack.visiblePages()).containsExactly(Page.SETTINGS);
    }

    private static Map<Page, JComponent> plainPages() {
        Map<Page, JComponent> pages = new EnumMap<>(Page.class);
        for (Page page : Page.values()) {
            pages.put(page, new JPanel());
        }
        return pages;
    }
}
