package org.sassline.compiler.frontend.parser.ast;

import org.sassline.compiler.api.SourceInfo;

/**
 * A CSS at-rule the front end does not interpret, e.g. {@code @media print}.
 */
public final class DirectiveNode extends AstNode {

    private final String text;

    public DirectiveNode(SourceInfo sourceInfo, String text) {
        super(sourceInfo);
        this.text = text;
    }

    /**
     * @return The full directive line, including the {@code @}.
     */
    public String text() { return text; }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
