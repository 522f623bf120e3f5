package org.sassline.compiler.frontend.parser.ast;

import org.sassline.compiler.api.SourceInfo;
import org.sassline.compiler.frontend.script.ScriptExpression;

import java.util.Optional;

/**
 * One branch of an {@code @if} / {@code @else if} / {@code @else} chain.
 * <p>
 * The {@code @if} node is the head of the chain and is the only branch that appears among
 * its parent's children. Each following branch hangs off the previous one via
 * {@link #elseBranch()}. A plain {@code @else} has no condition.
 */
public final class IfNode extends AstNode {

    private final ScriptExpression condition;
    private IfNode elseBranch;

    public IfNode(SourceInfo sourceInfo, ScriptExpression condition) {
        super(sourceInfo);
        this.condition = condition;
    }

    /**
     * @return The branch condition, or null for a plain {@code @else}.
     */
    public ScriptExpression condition() { return condition; }

    public boolean isUnconditional() { return condition == null; }

    public Optional<IfNode> elseBranch() {
        return Optional.ofNullable(elseBranch);
    }

    /**
     * Appends a branch to the end of this chain.
     * @param branch The {@code @else} or {@code @else if} branch.
     */
    public void addElse(IfNode branch) {
        IfNode tail = this;
        while (tail.elseBranch != null) {
            tail = tail.elseBranch;
        }
        tail.elseBranch = branch;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
