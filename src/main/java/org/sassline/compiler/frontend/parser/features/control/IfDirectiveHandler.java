package org.sassline.compiler.frontend.parser.features.control;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.frontend.directive.DirectiveLine;
import org.sassline.compiler.frontend.directive.IDirectiveHandler;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ClassificationResult;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.AstNode;
import org.sassline.compiler.frontend.parser.ast.IfNode;

/**
 * Handles the <code>@if</code> directive, which starts a conditional chain.
 */
public class IfDirectiveHandler implements IDirectiveHandler {

    @Override
    public ClassificationResult parse(ParsingContext context, AstNode parent, LogicalLine line, DirectiveLine directive)
            throws SassSyntaxException {
        return ClassificationResult.of(new IfNode(line.sourceInfo(),
                ConditionalDirectives.requiredExpression(context, line, directive)));
    }
}
