package org.pytch.junit.extensions.logging;

/**
 * Log levels that {@link LogWatchExtension} can fail on, allow or expect.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
