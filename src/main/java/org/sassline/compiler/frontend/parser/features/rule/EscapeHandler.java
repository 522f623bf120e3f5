package org.sassline.compiler.frontend.parser.features.rule;

import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ClassificationResult;
import org.sassline.compiler.frontend.parser.ILineHandler;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.AstNode;
import org.sassline.compiler.frontend.parser.ast.RuleNode;

/**
 * Handles lines starting with {@code \}: the rest of the line is a selector, whatever
 * character it starts with.
 */
public class EscapeHandler implements ILineHandler {

    @Override
    public ClassificationResult classify(ParsingContext context, AstNode parent, LogicalLine line, boolean root) {
        return ClassificationResult.of(new RuleNode(line.sourceInfo(), line.text().substring(1)));
    }
}
