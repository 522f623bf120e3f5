package org.sassline.compiler.frontend.lexer;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.api.SyntaxErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The Tokenizer turns raw source text into a flat sequence of {@link LogicalLine}s.
 * It establishes the document's indentation unit from the first indented line and
 * measures every line's depth in multiples of that unit.
 * <p>
 * An instance is bound to one document; {@link #tokenize()} keeps no state between calls.
 */
public class Tokenizer {

    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");
    private static final Pattern LEADING_WHITESPACE = Pattern.compile("^\\s*");

    private final String source;
    private final String fileName;
    private final int startLine;

    /**
     * Creates a new Tokenizer for an in-memory document starting at line 1.
     * @param source The source code as a single string.
     */
    public Tokenizer(String source) {
        this(source, null, 1);
    }

    /**
     * Creates a new Tokenizer.
     * @param source The source code as a single string.
     * @param fileName The name of the file being parsed, for diagnostics. May be null.
     * @param startLine The line number of the first physical line.
     */
    public Tokenizer(String source, String fileName, int startLine) {
        this.source = source;
        this.fileName = fileName;
        this.startLine = startLine;
    }

    /**
     * Performs the tokenization of the entire source.
     * @return The non-blank lines in source order, each with empty children.
     * @throws SassSyntaxException if the indentation is illegal, mixed or inconsistent.
     */
    public List<LogicalLine> tokenize() throws SassSyntaxException {
        String[] physicalLines = LINE_BREAK.split(source, -1);
        List<LogicalLine> lines = new ArrayList<>();
        String unit = null;
        boolean first = true;
        for (int index = 0; index < physicalLines.length; index++) {
            String line = physicalLines[index];
            if (line.isBlank()) {
                continue;
            }
            int lineNumber = index + startLine;
            String indentation = leadingWhitespace(line);
            if (!indentation.isEmpty()) {
                if (unit == null) {
                    unit = indentation;
                }
                if (first) {
                    throw new SassSyntaxException(SyntaxErrorCode.INDENTATION_AT_DOCUMENT_START, lineNumber);
                }
                if (unit.indexOf(' ') >= 0 && unit.indexOf('\t') >= 0) {
                    throw new SassSyntaxException(SyntaxErrorCode.INDENTATION_MIXED, lineNumber);
                }
            }
            first = false;
            lines.add(new LogicalLine(line.strip(), depthOf(indentation, unit, lineNumber), lineNumber, indentation.length(), fileName));
        }
        return lines;
    }

    private static int depthOf(String indentation, String unit, int lineNumber) throws SassSyntaxException {
        if (unit == null || indentation.isEmpty()) {
            return 0;
        }
        int depth = indentation.length() / unit.length();
        if (!unit.repeat(depth).equals(indentation)) {
            throw new SassSyntaxException(SyntaxErrorCode.INDENTATION_INCONSISTENT, lineNumber,
                    Indentation.describe(indentation, true), Indentation.describe(unit, false));
        }
        return depth;
    }

    private static String leadingWhitespace(String line) {
        Matcher matcher = LEADING_WHITESPACE.matcher(line);
        return matcher.lookingAt() ? matcher.group() : "";
    }
}
