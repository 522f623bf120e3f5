package org.sassline.compiler.frontend.parser.ast;

import org.sassline.compiler.api.SourceInfo;

/**
 * A CSS property, written either as {@code :name value} or as {@code name: value}.
 */
public final class AttributeNode extends AstNode {

    /**
     * The syntax an attribute was written in.
     */
    public enum Syntax {
        /** {@code :name value} or {@code :name= expr}. */
        OLD,
        /** {@code name: value} or {@code name= expr}. */
        NEW
    }

    private final String name;
    private final AttributeValue value;
    private final Syntax syntax;

    public AttributeNode(SourceInfo sourceInfo, String name, AttributeValue value, Syntax syntax) {
        super(sourceInfo);
        this.name = name;
        this.value = value;
        this.syntax = syntax;
    }

    public String name() { return name; }
    public AttributeValue value() { return value; }
    public Syntax syntax() { return syntax; }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
