package org.sassline.compiler.frontend.parser.ast;

import org.sassline.compiler.api.SourceInfo;

import java.util.List;

/**
 * A comment. Silent comments ({@code //}) are dropped from the output, loud ones
 * ({@code /*}) are emitted as CSS comments. Lines nested beneath a comment belong to
 * it verbatim and are never classified.
 */
public final class CommentNode extends AstNode {

    private final String text;
    private final boolean silent;
    private final List<String> bodyLines;

    public CommentNode(SourceInfo sourceInfo, String text, boolean silent, List<String> bodyLines) {
        super(sourceInfo);
        this.text = text;
        this.silent = silent;
        this.bodyLines = List.copyOf(bodyLines);
    }

    /**
     * @return The first line of the comment, including the comment characters.
     */
    public String text() { return text; }
    public boolean isSilent() { return silent; }

    /**
     * @return The trimmed text of all nested lines, in source order.
     */
    public List<String> bodyLines() { return bodyLines; }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
