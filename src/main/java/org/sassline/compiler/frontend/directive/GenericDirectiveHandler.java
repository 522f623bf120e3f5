package org.sassline.compiler.frontend.directive;

import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ClassificationResult;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.AstNode;
import org.sassline.compiler.frontend.parser.ast.DirectiveNode;

/**
 * Keeps any directive without a dedicated handler as a plain CSS at-rule.
 */
public class GenericDirectiveHandler implements IDirectiveHandler {

    @Override
    public ClassificationResult parse(ParsingContext context, AstNode parent, LogicalLine line, DirectiveLine directive) {
        return ClassificationResult.of(new DirectiveNode(line.sourceInfo(), line.text()));
    }
}
