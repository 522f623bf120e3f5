package org.sassline.compiler.frontend.directive;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ClassificationResult;
import org.sassline.compiler.frontend.parser.ILineHandler;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.AstNode;

/**
 * Handles lines starting with {@code @} by dispatching on the directive keyword.
 */
public class DirectiveLineHandler implements ILineHandler {

    @Override
    public ClassificationResult classify(ParsingContext context, AstNode parent, LogicalLine line, boolean root)
            throws SassSyntaxException {
        DirectiveLine directive = DirectiveLine.of(line);
        return context.getDirectiveRegistry().get(directive.keyword()).parse(context, parent, line, directive);
    }
}
