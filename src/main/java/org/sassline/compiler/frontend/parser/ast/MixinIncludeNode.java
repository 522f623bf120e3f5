package org.sassline.compiler.frontend.parser.ast;

import org.sassline.compiler.api.SourceInfo;
import org.sassline.compiler.frontend.script.ScriptExpression;

import java.util.List;

/**
 * A mixin include, {@code +name(expr, expr)}.
 */
public final class MixinIncludeNode extends AstNode {

    private final String name;
    private final List<ScriptExpression> arguments;

    public MixinIncludeNode(SourceInfo sourceInfo, String name, List<ScriptExpression> arguments) {
        super(sourceInfo);
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    public String name() { return name; }
    public List<ScriptExpression> arguments() { return arguments; }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
