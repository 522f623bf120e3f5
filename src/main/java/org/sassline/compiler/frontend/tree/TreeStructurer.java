package org.sassline.compiler.frontend.tree;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.api.SyntaxErrorCode;
import org.sassline.compiler.frontend.lexer.LogicalLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Nests the flat line sequence produced by the {@link org.sassline.compiler.frontend.lexer.Tokenizer}
 * using depth comparisons only.
 */
public final class TreeStructurer {

    private TreeStructurer() {}

    /**
     * Builds the line tree.
     * @param lines The tokenized lines. Their children lists are filled in place.
     * @return The top-level lines.
     * @throws SassSyntaxException if a line is indented more than one level below its predecessor.
     */
    public static List<LogicalLine> structure(List<LogicalLine> lines) throws SassSyntaxException {
        return level(lines, 0).siblings();
    }

    private record Level(List<LogicalLine> siblings, int next) {}

    private static Level level(List<LogicalLine> lines, int start) throws SassSyntaxException {
        List<LogicalLine> siblings = new ArrayList<>();
        if (start >= lines.size()) {
            return new Level(siblings, start);
        }
        int base = lines.get(start).depth();
        int index = start;
        while (index < lines.size() && lines.get(index).depth() >= base) {
            LogicalLine line = lines.get(index);
            if (line.depth() == base) {
                siblings.add(line);
                index++;
                continue;
            }
            if (line.depth() > base + 1) {
                throw new SassSyntaxException(SyntaxErrorCode.INDENTATION_TOO_DEEP, line.lineNumber(),
                        String.valueOf(line.depth() - base));
            }
            Level nested = level(lines, index);
            siblings.get(siblings.size() - 1).attachChildren(nested.siblings());
            index = nested.next();
        }
        return new Level(siblings, index);
    }
}
