package org.sassline.compiler.frontend.parser.features.mixin;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits the parenthesized argument list of a mixin definition or include.
 */
final class MixinArguments {

    /**
     * One argument's trimmed text and the index at which it starts in the line's text.
     */
    record Slice(String text, int start) {}

    private MixinArguments() {}

    /**
     * Splits an argument list such as {@code (!a, !b = 2px)} on commas. Empty entries are kept.
     * @param argString The text following the mixin name.
     * @param start The index of {@code argString} in the line's text.
     * @return The arguments, empty list if there is no list, or empty if the list is not parenthesized.
     */
    static Optional<List<Slice>> split(String argString, int start) {
        String list = argString.strip();
        if (list.isEmpty()) {
            return Optional.of(List.of());
        }
        if (list.length() < 2 || list.charAt(0) != '(' || list.charAt(list.length() - 1) != ')') {
            return Optional.empty();
        }
        String inner = list.substring(1, list.length() - 1);
        if (inner.isEmpty()) {
            return Optional.of(List.of());
        }
        int position = start + leadingWhitespace(argString) + 1;
        List<Slice> slices = new ArrayList<>();
        for (String part : inner.split(",", -1)) {
            slices.add(new Slice(part.strip(), position + leadingWhitespace(part)));
            position += part.length() + 1;
        }
        return Optional.of(slices);
    }

    private static int leadingWhitespace(String text) {
        return text.length() - text.stripLeading().length();
    }
}
