package org.sassline.compiler.frontend.parser;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.api.SyntaxErrorCode;
import org.sassline.compiler.frontend.lexer.LogicalLine;

/**
 * Checks for constructs beneath which nothing may be nested.
 */
public final class Nesting {

    private Nesting() {}

    /**
     * Rejects a line that has nested lines. The error points at the first nested line.
     * @param line The line to check.
     * @param construct The construct's plural description, e.g. {@code "debug directives"}.
     * @throws SassSyntaxException if the line has children.
     */
    public static void requireNone(LogicalLine line, String construct) throws SassSyntaxException {
        if (line.hasChildren()) {
            throw new SassSyntaxException(SyntaxErrorCode.ILLEGAL_NESTING,
                    line.children().get(0).lineNumber(), construct);
        }
    }
}
