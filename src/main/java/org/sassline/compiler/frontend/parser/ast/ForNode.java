package org.sassline.compiler.frontend.parser.ast;

import org.sassline.compiler.api.SourceInfo;
import org.sassline.compiler.frontend.script.ScriptExpression;

/**
 * A {@code @for !i from a to b} or {@code @for !i from a through b} loop.
 */
public final class ForNode extends AstNode {

    private final String variable;
    private final ScriptExpression from;
    private final ScriptExpression to;
    private final boolean inclusive;

    public ForNode(SourceInfo sourceInfo, String variable, ScriptExpression from, ScriptExpression to, boolean inclusive) {
        super(sourceInfo);
        this.variable = variable;
        this.from = from;
        this.to = to;
        this.inclusive = inclusive;
    }

    /**
     * @return The loop variable name without the sigil.
     */
    public String variable() { return variable; }
    public ScriptExpression from() { return from; }
    public ScriptExpression to() { return to; }

    /**
     * @return true for {@code through}, false for {@code to}.
     */
    public boolean isInclusive() { return inclusive; }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
