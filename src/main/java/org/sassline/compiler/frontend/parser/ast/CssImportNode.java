package org.sassline.compiler.frontend.parser.ast;

import org.sassline.compiler.api.SourceInfo;

/**
 * A plain CSS {@code @import} that is passed through to the output.
 */
public final class CssImportNode extends AstNode {

    private final String text;

    public CssImportNode(SourceInfo sourceInfo, String text) {
        super(sourceInfo);
        this.text = text;
    }

    /**
     * @return The directive text to emit, e.g. {@code @import url(foo.css)}.
     */
    public String text() { return text; }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
