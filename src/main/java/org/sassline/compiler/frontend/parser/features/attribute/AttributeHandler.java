package org.sassline.compiler.frontend.parser.features.attribute;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ClassificationResult;
import org.sassline.compiler.frontend.parser.ILineHandler;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.AstNode;
import org.sassline.compiler.frontend.parser.ast.AttributeNode;
import org.sassline.compiler.frontend.parser.ast.RuleNode;

/**
 * Handles lines starting with {@code :}. They are colon-prefixed attributes, except for
 * {@code ::} pseudo-element selectors, which are rules.
 */
public class AttributeHandler implements ILineHandler {

    @Override
    public ClassificationResult classify(ParsingContext context, AstNode parent, LogicalLine line, boolean root)
            throws SassSyntaxException {
        if (line.text().startsWith("::")) {
            return ClassificationResult.of(new RuleNode(line.sourceInfo(), line.text()));
        }
        return ClassificationResult.of(AttributeParser.parse(context, line, AttributeNode.Syntax.OLD));
    }
}
