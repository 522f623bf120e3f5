package org.sassline.compiler.frontend.parser.ast;

import org.sassline.compiler.api.SourceInfo;
import org.sassline.compiler.frontend.script.ScriptExpression;

/**
 * A {@code @while} loop.
 */
public final class WhileNode extends AstNode {

    private final ScriptExpression condition;

    public WhileNode(SourceInfo sourceInfo, ScriptExpression condition) {
        super(sourceInfo);
        this.condition = condition;
    }

    public ScriptExpression condition() { return condition; }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
