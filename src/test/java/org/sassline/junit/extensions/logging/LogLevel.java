package org.sassline.junit.extensions.logging;

/**
 * Log levels the logging annotations can refer to.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
