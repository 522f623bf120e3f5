package org.sassline.compiler.frontend.parser.features.debug;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.api.SyntaxErrorCode;
import org.sassline.compiler.frontend.directive.DirectiveLine;
import org.sassline.compiler.frontend.directive.IDirectiveHandler;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ClassificationResult;
import org.sassline.compiler.frontend.parser.Nesting;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.AstNode;
import org.sassline.compiler.frontend.parser.ast.DebugNode;

/**
 * Handles the <code>@debug &lt;expr&gt;</code> directive.
 */
public class DebugDirectiveHandler implements IDirectiveHandler {

    @Override
    public ClassificationResult parse(ParsingContext context, AstNode parent, LogicalLine line, DirectiveLine directive)
            throws SassSyntaxException {
        if (!directive.hasValue()) {
            throw new SassSyntaxException(SyntaxErrorCode.MISSING_DIRECTIVE_EXPRESSION, line.lineNumber(), directive.keyword());
        }
        Nesting.requireNone(line, "debug directives");
        return ClassificationResult.of(new DebugNode(line.sourceInfo(),
                context.parseScript(directive.value(), line, directive.valueColumn())));
    }
}
