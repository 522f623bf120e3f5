package org.sassline.compiler.frontend.parser.ast;

import org.sassline.compiler.api.SourceInfo;
import org.sassline.compiler.frontend.script.ScriptExpression;

/**
 * A variable binding, {@code !name = expr} or the guarded {@code !name ||= expr}.
 */
public final class VariableNode extends AstNode {

    private final String name;
    private final ScriptExpression expression;
    private final boolean guarded;

    public VariableNode(SourceInfo sourceInfo, String name, ScriptExpression expression, boolean guarded) {
        super(sourceInfo);
        this.name = name;
        this.expression = expression;
        this.guarded = guarded;
    }

    /**
     * @return The variable name without the sigil.
     */
    public String name() { return name; }
    public ScriptExpression expression() { return expression; }

    /**
     * @return true if the binding only applies when the variable is not yet bound.
     */
    public boolean isGuarded() { return guarded; }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
