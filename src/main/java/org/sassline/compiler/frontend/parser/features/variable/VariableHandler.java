package org.sassline.compiler.frontend.parser.features.variable;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.api.SyntaxErrorCode;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ClassificationResult;
import org.sassline.compiler.frontend.parser.ILineHandler;
import org.sassline.compiler.frontend.parser.Nesting;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.AstNode;
import org.sassline.compiler.frontend.parser.ast.VariableNode;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handles variable declarations, {@code !name = expr} and {@code !name ||= expr}.
 */
public class VariableHandler implements ILineHandler {

    private static final Pattern DECLARATION = Pattern.compile("!([a-zA-Z_]\\w*)\\s*((?:\\|\\|)?=)\\s*(.+)");
    private static final String GUARDED_ASSIGNMENT = "||=";

    @Override
    public ClassificationResult classify(ParsingContext context, AstNode parent, LogicalLine line, boolean root)
            throws SassSyntaxException {
        Nesting.requireNone(line, "variable declarations");
        Matcher m = DECLARATION.matcher(line.text());
        if (!m.lookingAt()) {
            throw new SassSyntaxException(SyntaxErrorCode.INVALID_VARIABLE_DECLARATION, line.lineNumber(), line.text());
        }
        return ClassificationResult.of(new VariableNode(
                line.sourceInfo(),
                m.group(1),
                context.parseScript(m.group(3), line, line.offset() + m.start(3)),
                GUARDED_ASSIGNMENT.equals(m.group(2))));
    }
}
