package org.sassline.compiler.internal.i18n;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Internal i18n facade for syntax error messages.
 * Uses ResourceBundles with the base name "syntax_messages".
 */
public final class Messages {

    private static final String BUNDLE_BASE_NAME = "syntax_messages";
    private static volatile ResourceBundle bundle = loadBundle(Locale.getDefault());

    private Messages() {}

    /**
     * Sets the locale for the message bundle.
     * @param locale The new locale.
     */
    public static void setLocale(Locale locale) {
        bundle = loadBundle(locale);
    }

    /**
     * Gets a formatted message for the given key.
     * @param key The key of the message pattern.
     * @param args The arguments for the message format.
     * @return The formatted message, or "!key!" if the key is unknown.
     */
    public static String format(String key, Object... args) {
        String pattern;
        try {
            pattern = bundle.getString(key);
        } catch (MissingResourceException e) {
            return "!" + key + "!";
        }
        MessageFormat format = new MessageFormat(pattern, Locale.ROOT);
        return format.format(args);
    }

    private static ResourceBundle loadBundle(Locale locale) {
        try {
            return ResourceBundle.getBundle(BUNDLE_BASE_NAME, locale);
        } catch (MissingResourceException e) {
            // Fallback to the base bundle if the locale is not found.
            return ResourceBundle.getBundle(BUNDLE_BASE_NAME, Locale.ROOT);
        }
    }
}
