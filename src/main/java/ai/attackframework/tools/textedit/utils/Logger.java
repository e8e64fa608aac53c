package ai.attackframework.tools.textedit.utils;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.AppenderBase;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * - Delegates to SLF4J so levels/appenders are configurable.
 * - Exposes a listener bus consumed by the editor status line and tests.
 * - Contains a Logback appender (nested class) that forwards non-internal SLF4J events to the listener bus.
 */
public final class Logger {

    /**
     * Listener contract used by status views and tests.
     */
    public interface LogListener { void onLog(String level, String message); }

    private static final String INTERNAL_LOGGER_NAME = "ai.attackframework.tools.textedit";

    private static final org.slf4j.Logger LOG =
            LoggerFactory.getLogger(INTERNAL_LOGGER_NAME);

    private static final List<LogListener> LISTENERS = new CopyOnWriteArrayList<>();

    private Logger() {}

    /**
     * Registers a listener. Registering the same instance twice has no effect.
     *
     * @param listener listener to add (nullable ignored)
     */
    public static void registerListener(LogListener listener) {
        if (listener != null && !LISTENERS.contains(listener)) LISTENERS.add(listener);
    }

    /**
     * Unregisters a listener.
     *
     * @param listener listener to remove (nullable ignored)
     */
    public static void unregisterListener(LogListener listener) { LISTENERS.remove(listener); }

    // -------- Public API (mirrored to the listener bus) --------

    /** Logs at INFO and notifies listeners. */
    public static void logInfo(String msg)  {
        final String m = safe(msg);
        LOG.info(m);
        notifyListeners("INFO",  m);
    }

    /** Logs at WARN and notifies listeners. */
    public static void logWarn(String msg)  {
        final String m = safe(msg);
        LOG.warn(m);
        notifyListeners("WARN",  m);
    }

    /** Logs at DEBUG (when enabled) and notifies listeners. */
    public static void logDebug(String msg) {
        final String m = safe(msg);
        if (LOG.isDebugEnabled()) LOG.debug(m);
        notifyListeners("DEBUG", m);
    }

    /** Logs at ERROR and notifies listeners. */
    public static void logError(String msg) {
        final String m = safe(msg);
        LOG.error(m);
        notifyListeners("ERROR", m);
    }

    /**
     * Logs at ERROR with throwable; listeners receive a one-line summary.
     *
     * @param msg message to log
     * @param t   throwable (nullable)
     */
    public static void logError(String msg, Throwable t) {
        final String base = safe(msg);
        final String detail = (t != null ? " :: " + t.getClass().getSimpleName() + ": " + safe(t.getMessage()) : "");
        LOG.error(base, t);
        notifyListeners("ERROR", base + detail);
    }

    /**
     * Allows logging backends to forward events into the listener bus.
     *
     * @param level   level string
     * @param message message to emit
     */
    public static void emitToListeners(String level, String message) {
        notifyListeners(level, safe(message));
    }

    // -------- Internal-only API (no listener notification) --------

    /** Logs at INFO without notifying listeners. */
    public static void internalInfo(String msg)  { if (LOG.isInfoEnabled())  LOG.info(safe(msg)); }
    /** Logs at WARN without notifying listeners. */
    public static void internalWarn(String msg)  { if (LOG.isWarnEnabled())  LOG.warn(safe(msg)); }
    /** Logs at DEBUG without notifying listeners. */
    public static void internalDebug(String msg) { if (LOG.isDebugEnabled()) LOG.debug(safe(msg)); }
    /** Logs at TRACE without notifying listeners. */
    public static void internalTrace(String msg) { if (LOG.isTraceEnabled()) LOG.trace(safe(msg)); }

    // -------- Internals --------

    private static void notifyListeners(String level, String m) {
        for (LogListener l : LISTENERS) {
            try { l.onLog(level, m); }
            catch (RuntimeException ex) {
                if (LOG.isDebugEnabled()) LOG.debug("listener threw: {}", ex.toString());
            }
        }
    }

    private static String safe(String s) { return Objects.toString(s, ""); }

    // --------------------------------------------
    // Logback appender that feeds the listener bus
    // --------------------------------------------

    /**
     * Logback appender that forwards non-internal events to the listener bus.
     */
    public static final class UiAppender extends AppenderBase<ILoggingEvent> {
        @Override
        protected void append(ILoggingEvent event) {
            if (event == null) return;

            // Internal logger entries already reached listeners directly.
            if (INTERNAL_LOGGER_NAME.equals(event.getLoggerName())) return;

            String level = (event.getLevel() != null) ? event.getLevel().toString() : "INFO";
            String message = event.getFormattedMessage();
            if (message == null) message = "";

            IThrowableProxy tp = event.getThrowableProxy();
            if (tp != null) {
                String exClass = tp.getClassName();
                String exMsg = tp.getMessage();
                message = message + " :: " + (exClass != null ? exClass : "Exception")
                        + (exMsg != null ? (": " + exMsg) : "");
            }

            Logger.emitToListeners(level, message);
        }
    }
}
