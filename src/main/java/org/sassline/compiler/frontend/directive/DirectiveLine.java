package org.sassline.compiler.frontend.directive;

import org.sassline.compiler.frontend.lexer.LogicalLine;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A directive line split into its keyword and value.
 *
 * @param keyword The text between {@code @} and the first whitespace; may be empty.
 * @param value The text after the whitespace following the keyword, or null if there is none.
 * @param valueColumn The column at which the value starts in the physical line.
 */
public record DirectiveLine(String keyword, String value, int valueColumn) {

    private static final Pattern DIRECTIVE = Pattern.compile("@(\\S*)(?:(\\s+)(.*))?", Pattern.DOTALL);

    /**
     * Splits a line starting with {@code @}.
     * @param line The directive line.
     * @return The split line.
     */
    public static DirectiveLine of(LogicalLine line) {
        Matcher m = DIRECTIVE.matcher(line.text());
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a directive line: " + line.text());
        }
        String keyword = m.group(1);
        String whitespace = m.group(2) != null ? m.group(2) : "";
        return new DirectiveLine(keyword, m.group(3), line.offset() + 1 + keyword.length() + whitespace.length());
    }

    public boolean hasValue() {
        return value != null && !value.isEmpty();
    }
}
