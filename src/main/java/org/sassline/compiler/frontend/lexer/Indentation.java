package org.sassline.compiler.frontend.lexer;

/**
 * Describes indentation strings for error messages, e.g. {@code "2 spaces"} or {@code "1 tab was"}.
 */
public final class Indentation {

    private Indentation() {}

    /**
     * Describes an indentation string in words.
     * @param indentation The leading whitespace.
     * @param asSubject Whether the description is followed by a verb ("was"/"were").
     * @return The description.
     */
    public static String describe(String indentation, boolean asSubject) {
        String noun;
        if (indentation.indexOf('\t') < 0) {
            noun = "space";
        } else if (indentation.indexOf(' ') < 0) {
            noun = "tab";
        } else {
            return quote(indentation) + (asSubject ? " was" : "");
        }
        boolean singular = indentation.length() == 1;
        String verb = asSubject ? (singular ? " was" : " were") : "";
        return indentation.length() + " " + noun + (singular ? "" : "s") + verb;
    }

    private static String quote(String indentation) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : indentation.toCharArray()) {
            switch (c) {
                case '\t' -> sb.append("\\t");
                case '\f' -> sb.append("\\f");
                case '\u000B' -> sb.append("\\v");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
