package org.sassline.compiler.frontend.parser.ast;

import org.sassline.compiler.api.ParserOptions;
import org.sassline.compiler.api.SourceInfo;

/**
 * The document root. It carries the options bundle the document was parsed with,
 * for the evaluation stage.
 */
public final class RootNode extends AstNode {

    private final ParserOptions options;

    public RootNode(ParserOptions options) {
        super(new SourceInfo(options.filename(), options.line(), 0));
        this.options = options;
    }

    public ParserOptions options() {
        return options;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
