package org.sassline.compiler.frontend.parser.features.comment;

import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ClassificationResult;
import org.sassline.compiler.frontend.parser.ILineHandler;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.AstNode;
import org.sassline.compiler.frontend.parser.ast.CommentNode;
import org.sassline.compiler.frontend.parser.ast.RuleNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles lines starting with {@code /}. {@code //} starts a silent comment and
 * {@code /*} a loud one; anything else is a rule.
 */
public class CommentHandler implements ILineHandler {

    private static final char SILENT = '/';
    private static final char LOUD = '*';

    @Override
    public ClassificationResult classify(ParsingContext context, AstNode parent, LogicalLine line, boolean root) {
        String text = line.text();
        char second = text.length() > 1 ? text.charAt(1) : 0;
        if (second != SILENT && second != LOUD) {
            return ClassificationResult.of(new RuleNode(line.sourceInfo(), text));
        }
        List<String> body = new ArrayList<>();
        collectBody(line.children(), body);
        return ClassificationResult.of(new CommentNode(line.sourceInfo(), text, second == SILENT, body));
    }

    private static void collectBody(List<LogicalLine> lines, List<String> body) {
        for (LogicalLine nested : lines) {
            body.add(nested.text());
            collectBody(nested.children(), body);
        }
    }
}
