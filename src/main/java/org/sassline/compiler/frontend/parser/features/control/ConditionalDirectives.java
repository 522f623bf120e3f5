package org.sassline.compiler.frontend.parser.features.control;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.api.SyntaxErrorCode;
import org.sassline.compiler.frontend.directive.DirectiveLine;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.script.ScriptExpression;

final class ConditionalDirectives {

    private ConditionalDirectives() {}

    /**
     * Parses the expression a directive requires, e.g. the condition of {@code @if}.
     */
    static ScriptExpression requiredExpression(ParsingContext context, LogicalLine line, DirectiveLine directive)
            throws SassSyntaxException {
        if (!directive.hasValue()) {
            throw new SassSyntaxException(SyntaxErrorCode.MISSING_DIRECTIVE_EXPRESSION, line.lineNumber(), directive.keyword());
        }
        return context.parseScript(directive.value(), line, directive.valueColumn());
    }
}
