package org.sassline.compiler.frontend.parser.ast;

import org.sassline.compiler.frontend.script.ScriptExpression;

/**
 * A formal argument of a mixin definition.
 *
 * @param name         The argument name without the sigil.
 * @param defaultValue The default value expression, or null if the argument is required.
 */
public record MixinArgument(String name, ScriptExpression defaultValue) {

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
