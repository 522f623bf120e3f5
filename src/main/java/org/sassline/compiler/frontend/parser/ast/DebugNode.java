package org.sassline.compiler.frontend.parser.ast;

import org.sassline.compiler.api.SourceInfo;
import org.sassline.compiler.frontend.script.ScriptExpression;

/**
 * A {@code @debug expr} statement.
 */
public final class DebugNode extends AstNode {

    private final ScriptExpression expression;

    public DebugNode(SourceInfo sourceInfo, ScriptExpression expression) {
        super(sourceInfo);
        this.expression = expression;
    }

    public ScriptExpression expression() { return expression; }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
