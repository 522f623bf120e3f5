package org.sassline.compiler.frontend.parser.ast;

import org.sassline.compiler.api.SourceInfo;

import java.util.List;

/**
 * A mixin definition, {@code =name(!a, !b = 1px)}. Only allowed at the document root.
 */
public final class MixinDefinitionNode extends AstNode {

    private final String name;
    private final List<MixinArgument> arguments;

    public MixinDefinitionNode(SourceInfo sourceInfo, String name, List<MixinArgument> arguments) {
        super(sourceInfo);
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    public String name() { return name; }
    public List<MixinArgument> arguments() { return arguments; }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
