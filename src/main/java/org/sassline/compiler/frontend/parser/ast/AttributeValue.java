package org.sassline.compiler.frontend.parser.ast;

import org.sassline.compiler.frontend.script.ScriptExpression;

/**
 * The value of an attribute: either literal CSS text or an expression to evaluate.
 */
public sealed interface AttributeValue permits AttributeValue.Literal, AttributeValue.Script {

    /**
     * A value copied to the output as written. May be empty for a namespace attribute
     * such as {@code :font} whose nested attributes carry the values.
     *
     * @param text The value text.
     */
    record Literal(String text) implements AttributeValue {}

    /**
     * A value assigned with {@code =}, to be evaluated.
     *
     * @param expression The parsed expression.
     */
    record Script(ScriptExpression expression) implements AttributeValue {}
}
