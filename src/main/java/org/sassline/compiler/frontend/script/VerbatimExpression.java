package org.sassline.compiler.frontend.script;

import org.sassline.compiler.api.SourceInfo;

/**
 * An expression kept as its source text, produced by {@link VerbatimExpressionParser}.
 *
 * @param source The trimmed expression text.
 * @param sourceInfo Where the expression starts.
 */
public record VerbatimExpression(String source, SourceInfo sourceInfo) implements ScriptExpression {

    @Override
    public String toString() {
        return source;
    }
}
