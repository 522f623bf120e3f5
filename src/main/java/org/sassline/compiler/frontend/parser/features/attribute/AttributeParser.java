package org.sassline.compiler.frontend.parser.features.attribute;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.api.SyntaxErrorCode;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.AttributeNode;
import org.sassline.compiler.frontend.parser.ast.AttributeValue;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds attribute nodes for both attribute syntaxes.
 */
public final class AttributeParser {

    private static final Pattern OLD_SYNTAX = Pattern.compile(":([^\\s=:\"]+)\\s*(=?)(?:\\s+|$)(.*)");
    private static final Pattern NEW_SYNTAX = Pattern.compile("([^\\s=:\"]+)(\\s*=|:)(?:\\s+|$)(.*)");

    /** Decides whether a line without a special first character is an attribute rather than a rule. */
    private static final Pattern NEW_SYNTAX_LOOKAHEAD = Pattern.compile("[^\\s:\"]+\\s*[=:](\\s|$)");

    private AttributeParser() {}

    /**
     * @param text A line's text.
     * @return true if the text has the shape of a {@code name: value} attribute.
     */
    public static boolean looksLikeAttribute(String text) {
        return NEW_SYNTAX_LOOKAHEAD.matcher(text).lookingAt();
    }

    /**
     * Parses an attribute line.
     * @param context The parsing services, used for expression values.
     * @param line The attribute's line.
     * @param syntax Which syntax the line is written in.
     * @return The attribute node.
     * @throws SassSyntaxException if the line is not a valid attribute or its expression is malformed.
     */
    public static AttributeNode parse(ParsingContext context, LogicalLine line, AttributeNode.Syntax syntax)
            throws SassSyntaxException {
        Pattern pattern = syntax == AttributeNode.Syntax.OLD ? OLD_SYNTAX : NEW_SYNTAX;
        Matcher m = pattern.matcher(line.text());
        if (!m.lookingAt()) {
            throw new SassSyntaxException(SyntaxErrorCode.INVALID_ATTRIBUTE, line.lineNumber(), line.text());
        }
        String name = m.group(1);
        String operator = m.group(2);
        String rawValue = m.group(3);

        AttributeValue value;
        if (operator.strip().startsWith("=")) {
            value = new AttributeValue.Script(context.parseScript(rawValue, line, line.offset() + m.start(3)));
        } else {
            value = new AttributeValue.Literal(rawValue);
        }
        return new AttributeNode(line.sourceInfo(), name, value, syntax);
    }
}
