package org.sassline.compiler.frontend.parser.features.rule;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ClassificationResult;
import org.sassline.compiler.frontend.parser.ILineHandler;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.AstNode;
import org.sassline.compiler.frontend.parser.ast.AttributeNode;
import org.sassline.compiler.frontend.parser.ast.RuleNode;
import org.sassline.compiler.frontend.parser.features.attribute.AttributeParser;

/**
 * Handles lines without a special first character: a {@code name: value} or
 * {@code name= expr} attribute if the line has that shape, a rule otherwise.
 */
public class DefaultLineHandler implements ILineHandler {

    @Override
    public ClassificationResult classify(ParsingContext context, AstNode parent, LogicalLine line, boolean root)
            throws SassSyntaxException {
        if (AttributeParser.looksLikeAttribute(line.text())) {
            return ClassificationResult.of(AttributeParser.parse(context, line, AttributeNode.Syntax.NEW));
        }
        return ClassificationResult.of(new RuleNode(line.sourceInfo(), line.text()));
    }
}
