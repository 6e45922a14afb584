package com.cs15.helpdesk.ui;

import java.awt.Color;
import java.io.Serial;
import java.util.List;

import javax.swing.BorderFactory;
import javax.swing.JButton;
import javax.swing.JLabel;
import javax.swing.JPanel;

import com.cs15.helpdesk.ui.primitives.FlatButton;
import com.cs15.helpdesk.ui.primitives.StatBox;
import com.cs15.helpdesk.ui.primitives.Theme;
import com.cs15.helpdesk.utils.Logger;

import net.miginfocom.swing.MigLayout;

/**
 * Home dashboard: heading, ticket statistics, a New Ticket button, and the recent activity area.
 *
 * <p>All figures are fixed display values; nothing is loaded when the page is shown.</p>
 */
public class HomePage extends JPanel {

    @Serial
    private static final long serialVersionUID = 1L;

    public static final String TITLE    = "🎫 Helpdesk Ticketing System";
    public static final String SUBTITLE =
            "Welcome back! Manage complaints, track progress, and resolve issues efficiently.";
    public static final String NEW_TICKET      = "➕ New Ticket";
    public static final String RECENT_ACTIVITY = "📋 Recent Activity";
    public static final String NO_RECENT       = "No recent tickets.";

    public static final int OPEN_TICKETS = 8;
    public static final int RESOLVED     = 23;
    public static final int PENDING      = 5;

    /** One dashboard tile: component name suffix, caption, value and color. */
    record Stat(String key, String caption, int value, Color color) { }

    static final List<Stat> STATS = List.of(
            new Stat("open",     "Open Tickets", OPEN_TICKETS, Theme.Colors.STAT_OPEN),
            new Stat("resolved", "Resolved",     RESOLVED,     Theme.Colors.STAT_RESOLVED),
            new Stat("pending",  "Pending",      PENDING,      Theme.Colors.STAT_PENDING)
    );

    /**
     * Builds the dashboard.
     *
     * <p>Caller must invoke on the EDT.</p>
     */
    public HomePage() {
        setLayout(new MigLayout("insets 30, wrap 1, gapy 20", "[grow, fill]"));

        JLabel title = new JLabel(TITLE);
        title.setName("home.title");
        Theme.font(title, Theme.Fonts.TITLE, true);

        JLabel subtitle = new JLabel(SUBTITLE);
        subtitle.setName("home.subtitle");
        subtitle.setForeground(Theme.Colors.MUTED_TEXT);
        Theme.font(subtitle, Theme.Fonts.BODY, false);

        add(title);
        add(subtitle);
        add(buildStatsRow());
        add(buildNewTicketButton(), "w pref!, alignx left");

        JLabel recent = new JLabel(RECENT_ACTIVITY);
        recent.setName("home.recentHeading");
        Theme.font(recent, Theme.Fonts.HEADING, false);
        add(recent, "gaptop 20");

        JLabel placeholder = new JLabel(NO_RECENT);
        placeholder.setName("home.recentEmpty");
        placeholder.setForeground(Theme.Colors.MUTED_TEXT);
        Theme.font(placeholder, Theme.Fonts.SMALL, false);
        add(placeholder);
    }

    private static JPanel buildStatsRow() {
        JPanel row = new JPanel(new MigLayout("insets 0, gapx 20", "[grow, fill][grow, fill][grow, fill]"));
        row.setName("home.stats");
        row.setOpaque(false);
        for (Stat s : STATS) {
            StatBox box = new StatBox(s.caption(), s.value(), s.color());
            box.setName("home.stat." + s.key());
            row.add(box);
        }
        return row;
    }

    private static JButton buildNewTicketButton() {
        FlatButton btn = new FlatButton(NEW_TICKET, Theme.Colors.PRIMARY, Theme.Colors.PRIMARY_HOVER,
                2 * Theme.Sizes.CORNER_RADIUS);
        btn.setName("home.newTicket");
        btn.setBorder(BorderFactory.createEmptyBorder(12, 20, 12, 20));
        Theme.font(btn, Theme.Fonts.BODY, false);
        btn.addActionListener(e -> Logger.logInfo("New Ticket clicked; ticket creation is not available in this build."));
        return btn;
    }
}
