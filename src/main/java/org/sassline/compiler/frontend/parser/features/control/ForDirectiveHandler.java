package org.sassline.compiler.frontend.parser.features.control;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.api.SyntaxErrorCode;
import org.sassline.compiler.frontend.directive.DirectiveLine;
import org.sassline.compiler.frontend.directive.IDirectiveHandler;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ClassificationResult;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.AstNode;
import org.sassline.compiler.frontend.parser.ast.ForNode;
import org.sassline.compiler.frontend.script.ScriptSyntax;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handles the <code>@for</code> directive.
 * The syntax is <code>@for !var from &lt;expr&gt; to|through &lt;expr&gt;</code>;
 * {@code through} includes the end value, {@code to} excludes it.
 */
public class ForDirectiveHandler implements IDirectiveHandler {

    private static final Pattern FOR = Pattern.compile("(\\S+)\\s+from\\s+(.+)\\s+(to|through)\\s+(.+)");
    private static final Pattern FROM_CLAUSE = Pattern.compile("\\S+\\s+from\\s+.+");
    private static final String INCLUSIVE = "through";

    @Override
    public ClassificationResult parse(ParsingContext context, AstNode parent, LogicalLine line, DirectiveLine directive)
            throws SassSyntaxException {
        String text = directive.hasValue() ? directive.value() : "";
        Matcher m = FOR.matcher(text);
        if (!m.matches()) {
            throw new SassSyntaxException(SyntaxErrorCode.INVALID_FOR_DIRECTIVE, line.lineNumber(), text, expectedClause(text));
        }
        String variable = m.group(1);
        if (!ScriptSyntax.isValidVariable(variable)) {
            throw new SassSyntaxException(SyntaxErrorCode.INVALID_VARIABLE_NAME, line.lineNumber(), variable);
        }
        int column = directive.valueColumn();
        return ClassificationResult.of(new ForNode(
                line.sourceInfo(),
                variable.substring(1),
                context.parseScript(m.group(2), line, column + m.start(2)),
                context.parseScript(m.group(4), line, column + m.start(4)),
                INCLUSIVE.equals(m.group(3))));
    }

    private static String expectedClause(String text) {
        if (text.isEmpty()) {
            return "variable name";
        }
        if (!FROM_CLAUSE.matcher(text).lookingAt()) {
            return "'from <expr>'";
        }
        return "'to <expr>' or 'through <expr>'";
    }
}
