package org.sassline.compiler.frontend.script;

import org.sassline.compiler.api.SourceInfo;

/**
 * An opaque, parsed expression of the stylesheet's expression language. The front end
 * never looks inside; it only hands expressions to the evaluation stage.
 */
public interface ScriptExpression {

    /**
     * @return The expression's source text.
     */
    String source();

    /**
     * @return Where the expression starts in the source.
     */
    SourceInfo sourceInfo();
}
