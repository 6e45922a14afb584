package com.cs15.helpdesk.ui;

import static com.cs15.helpdesk.testutils.SwingLookup.findByName;
import static com.cs15.helpdesk.testutils.SwingLookup.onEdt;
import static com.cs15.helpdesk.testutils.SwingLookup.runEdt;
import static org.assertj.core.api.Assertions.assertThat;

import java.awt.BorderLayout;
import java.util.List;

import javax.swing.JButton;
import javax.swing.JComponent;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.cs15.helpdesk.ui.primitives.IconButton;
import com.cs15.helpdesk.utils.config.UiSettings;

/**
 * Headless tests for {@link HelpdeskPanel}: sidebar buttons switch pages, exactly one page is
 * visible, and collapsing the sidebar leaves the visible page alone.
 */
class HelpdeskPanelNavigationHeadlessTest {

    private HelpdeskPanel panel;

    @BeforeEach
    void build() throws Exception {
        panel = onEdt(() -> new HelpdeskPanel(UiSettings.defaults()));
        runEdt(() -> {
            panel.setSize(900, 600);
            panel.doLayout();
        });
    }

    @Test
    void sidebar_is_west_and_stack_is_center() {
        BorderLayout layout = (BorderLayout) panel.getLayout();
        assertThat(layout.getLayoutComponent(BorderLayout.WEST)).isSameAs(panel.sidebar());
        assertThat(layout.getLayoutComponent(BorderLayout.CENTER)).isSameAs(panel.stack());
    }

    @Test
    void home_is_visible_at_startup() {
        assertThat(panel.stack().currentPage()).isEqualTo(Page.HOME);
        assertThat(panel.stack().visiblePages()).containsExactly(Page.HOME);
    }

    @Test
    void each_button_shows_its_page_regardless_of_prior_page() throws Exception {
        List<Page> sequence = List.of(
                Page.DOCUMENTS, Page.SETTINGS, Page.HOME, Page.SETTINGS,
                Page.SETTINGS, Page.DOCUMENTS, Page.HOME, Page.HOME);

        for (Page target : sequence) {
            IconButton btn = findByName(panel, target.navName(), IconButton.class);
            runEdt(btn::doClick);

            assertThat(panel.stack().currentPage()).as("after clicking %s", target).isEqualTo(target);
            assertThat(panel.stack().visiblePages()).as("after clicking %s", target).containsExactly(target);
        }
    }

    @Test
    void pages_are_built_once_and_reused() throws Exception {
        JComponent documentsBefore = panel.stack().pageComponent(Page.DOCUMENTS);

        runEdt(() -> {
            panel.sidebar().navButton(Page.DOCUMENTS).doClick();
            panel.sidebar().navButton(Page.HOME).doClick();
            panel.sidebar().navButton(Page.DOCUMENTS).doClick();
        });

        assertThat(panel.stack().pageComponent(Page.DOCUMENTS)).isSameAs(documentsBefore);
        assertThat(panel.stack().getComponentCount()).isEqualTo(Page.values().length);
    }

    @Test
    void placeholder_pages_carry_their_messages() {
        PlaceholderPage documents = findByName(panel, Page.DOCUMENTS.pageName(), PlaceholderPage.class);
        PlaceholderPage settings = findByName(panel, Page.SETTINGS.pageName(), PlaceholderPage.class);

        assertThat(documents.message()).isEqualTo("📄 Welcome to Documents Page");
        assertThat(settings.message()).isEqualTo("⚙️ You are viewing Settings Page");
    }

    @Test
    void toggling_sidebar_does_not_change_visible_page() throws Exception {
        JButton toggle = findByName(panel, "sidebar.toggle", JButton.class);

        runEdt(() -> panel.sidebar().navButton(Page.SETTINGS).doClick());
        runEdt(() -> {
            toggle.doClick();
            panel.sidebar().finishAnimation();
        });

        assertThat(panel.sidebar().isExpanded()).isFalse();
        assertThat(panel.stack().currentPage()).isEqualTo(Page.SETTINGS);
        assertThat(panel.stack().visiblePages()).containsExactly(Page.SETTINGS);

        runEdt(() -> {
            toggle.doClick();
            panel.sidebar().finishAnimation();
        });

        assertThat(panel.sidebar().isExpanded()).isTrue();
        assertThat(panel.stack().visiblePages()).containsExactly(Page.SETTINGS);
    }

    @Test
    void navigation_works_while_collapsed() throws Exception {
        runEdt(() -> {
            panel.sidebar().toggle();
            panel.sidebar().navButton(Page.DOCUMENTS).doClick();
        });

        assertThat(panel.sidebar().isExpanded()).isFalse();
        assertThat(panel.stack().visiblePages()).containsExactly(Page.DOCUMENTS);
    }
}
