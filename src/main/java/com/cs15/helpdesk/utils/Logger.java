package com.cs15.helpdesk.utils;

import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * - Static logging facade used by the application and its panels.
 * - Delegates to SLF4J so levels/appenders are configured in logback.xml.
 * - Messages are null-safe; throwables are handed to the backend for stack traces.
 */
public final class Logger {

    private static final String APP_LOGGER_NAME = "com.cs15.helpdesk";

    private static final org.slf4j.Logger LOG =
            LoggerFactory.getLogger(APP_LOGGER_NAME);

    /**
     * Utility holder; not instantiable.
     */
    private Logger() {}

    /**
     * Logs at INFO.
     * <p>
     * @param msg message to log
     */
    public static void logInfo(String msg)  { LOG.info(safe(msg)); }

    /**
     * Logs at WARN.
     * <p>
     * @param msg message to log
     */
    public static void logWarn(String msg)  { LOG.warn(safe(msg)); }

    /**
     * Logs at DEBUG when enabled.
     * <p>
     * @param msg message to log
     */
    public static void logDebug(String msg) { if (LOG.isDebugEnabled()) LOG.debug(safe(msg)); }

    /**
     * Logs at ERROR.
     * <p>
     * @param msg message to log
     */
    public static void logError(String msg) { LOG.error(safe(msg)); }

    /**
     * Logs at ERROR with a concise summary of the throwable appended to the message.
     * <p>
     * @param msg message to log
     * @param t   throwable (nullable)
     */
    public static void logError(String msg, Throwable t) {
        final String base = safe(msg);
        final String detail = (t != null ? " :: " + t.getClass().getSimpleName() + ": " + safe(t.getMessage()) : "");
        LOG.error(base + detail, t);           // stack trace handled by backend
    }

    /**
     * Null-safe string conversion.
     * <p>
     * @param s input string
     * @return non-null string
     */
    private static String safe(String s) { return Objects.toString(s, ""); }
}
