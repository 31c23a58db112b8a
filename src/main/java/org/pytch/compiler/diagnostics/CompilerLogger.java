package org.pytch.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Front-end logger with integer verbosity levels on top of SLF4J.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE.
 * A message is written only if both the verbosity level and the SLF4J backend allow it.
 */
public final class CompilerLogger {

    /** Log level for errors. */
    public static final int ERROR = 0;
    /** Log level for warnings. */
    public static final int WARN  = 1;
    /** Log level for informational messages. */
    public static final int INFO  = 2;
    /** Log level for debug messages. */
    public static final int DEBUG = 3;
    /** Log level for trace messages. */
    public static final int TRACE = 4;
    private static volatile int level = INFO;

    private static final Logger logger = LoggerFactory.getLogger(CompilerLogger.class);

    private CompilerLogger() {}

    /**
     * Sets the logging verbosity level. Out-of-range values are clamped.
     * @param newLevel The new level to set.
     */
    public static void setLevel(int newLevel) { level = Math.max(ERROR, Math.min(TRACE, newLevel)); }

    /**
     * @return The current verbosity level.
     */
    public static int getLevel() { return level; }

    /**
     * Checks whether messages of the given level would be written, so callers can
     * skip building expensive messages.
     * @param messageLevel The level to check.
     * @return {@code true} if such messages reach the backend.
     */
    public static boolean isEnabled(int messageLevel) {
        if (messageLevel > level) return false;
        return switch (messageLevel) {
            case ERROR -> logger.isErrorEnabled();
            case WARN -> logger.isWarnEnabled();
            case INFO -> logger.isInfoEnabled();
            case DEBUG -> logger.isDebugEnabled();
            default -> logger.isTraceEnabled();
        };
    }

    /**
     * Logs a warning message.
     * @param format The SLF4J message format.
     * @param args The message arguments.
     */
    public static void warn(String format, Object... args) {
        if (level >= WARN) logger.warn(format, args);
    }

    /**
     * Logs a debug message.
     * @param format The SLF4J message format.
     * @param args The message arguments.
     */
    public static void debug(String format, Object... args) {
        if (level >= DEBUG) logger.debug(format, args);
    }

    /**
     * Logs a trace message.
     * @param format The SLF4J message format.
     * @param args The message arguments.
     */
    public static void trace(String format, Object... args) {
        if (level >= TRACE) logger.trace(format, args);
    }
}
