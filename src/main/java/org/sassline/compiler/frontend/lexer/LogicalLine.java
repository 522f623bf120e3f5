package org.sassline.compiler.frontend.lexer;

import org.sassline.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One non-blank source line, reduced to its trimmed text and measured depth.
 * Children are attached once by the {@link org.sassline.compiler.frontend.tree.TreeStructurer}.
 */
public final class LogicalLine {

    private final String text;
    private final int depth;
    private final int lineNumber;
    private final int offset;
    private final String fileName;
    private final List<LogicalLine> children = new ArrayList<>();

    /**
     * @param text The line's text with leading and trailing whitespace removed.
     * @param depth The number of indentation units in front of the text.
     * @param lineNumber The 1-based source line number.
     * @param offset The column at which the trimmed text starts in the physical line.
     * @param fileName The source file name, may be null.
     */
    public LogicalLine(String text, int depth, int lineNumber, int offset, String fileName) {
        this.text = text;
        this.depth = depth;
        this.lineNumber = lineNumber;
        this.offset = offset;
        this.fileName = fileName;
    }

    public String text() { return text; }
    public int depth() { return depth; }
    public int lineNumber() { return lineNumber; }
    public int offset() { return offset; }
    public String fileName() { return fileName; }

    /**
     * @return The location of the line's first non-blank character.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, lineNumber, offset);
    }

    /**
     * @return The nested lines, in source order. Unmodifiable.
     */
    public List<LogicalLine> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Attaches the lines nested directly beneath this one.
     * @param nested The child lines, in source order.
     */
    public void attachChildren(List<LogicalLine> nested) {
        children.addAll(nested);
    }

    @Override
    public String toString() {
        return lineNumber + ":" + depth + ":" + text;
    }
}
