package org.sassline.compiler.api;

import java.util.Locale;

/**
 * CSS output style. The front end does not interpret it; it is carried on the AST root
 * for the evaluation stage.
 */
public enum Style {
    NESTED,
    EXPANDED,
    COMPACT,
    COMPRESSED;

    /**
     * Parses a configuration value such as {@code "nested"}.
     * @param value The configured value, case-insensitive.
     * @return The matching style.
     * @throws IllegalArgumentException if the value names no known style.
     */
    public static Style fromConfigValue(String value) {
        return Style.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
