package com.cs15.helpdesk.utils;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;

class LoggerTest {

    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private ch.qos.logback.classic.Logger backend;

    @BeforeEach
    void attach() {
        backend = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.cs15.helpdesk");
        appender.setContext(backend.getLoggerContext());
        appender.start();
        backend.addAppender(appender);
    }

    @AfterEach
    void detach() {
        backend.detachAppender(appender);
        appender.stop();
    }

    @Test
    void levels_are_forwarded_to_backend() {
        Logger.logInfo("hello");
        Logger.logWarn("careful");
        Logger.logError("broken");

        assertThat(appender.list)
                .extracting(ILoggingEvent::getLevel, ILoggingEvent::getFormattedMessage)
                .containsExactly(
                        tuple(Level.INFO, "hello"),
                        tuple(Level.WARN, "careful"),
                        tuple(Level.ERROR, "broken"));
    }

    @Test
    void error_with_throwable_appends_summary_and_keeps_stack() {
        Logger.logError("start failed", new IllegalStateException("no display"));

        ILoggingEvent event = appender.list.get(0);
        assertThat(event.getFormattedMessage())
                .isEqualTo("start failed :: IllegalStateException: no display");
        assertThat(event.getThrowableProxy()).isNotNull();
        assertThat(event.getThrowableProxy().getClassName()).isEqualTo(IllegalStateException.class.getName());
    }

    @Test
    void null_messages_are_logged_as_empty() {
        Logger.logInfo(null);
        Logger.logError(null, null);

        assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage).containsExactly("", "");
    }
}
