package org.sassline.compiler.frontend.script;

import org.sassline.compiler.api.SourceInfo;

/**
 * The default {@link IExpressionParser}. It does not interpret the expression language;
 * it keeps the text verbatim after checking the structure every expression must have:
 * it is not blank, its parentheses balance and its string literals are terminated.
 */
public class VerbatimExpressionParser implements IExpressionParser {

    @Override
    public ScriptExpression parse(String text, int line, int column, String fileName) throws ExpressionSyntaxException {
        if (text == null || text.isBlank()) {
            throw new ExpressionSyntaxException("Expected expression, was end of text.", column);
        }
        int depth = 0;
        char quote = 0;
        int quoteStart = -1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
                quoteStart = i;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    throw new ExpressionSyntaxException("Unexpected \")\" in expression \"" + text + "\".", column + i);
                }
                depth--;
            }
        }
        if (quote != 0) {
            throw new ExpressionSyntaxException("Unterminated string in expression \"" + text + "\".", column + quoteStart);
        }
        if (depth > 0) {
            throw new ExpressionSyntaxException("Expected \")\" in expression \"" + text + "\".", column + text.length());
        }
        return new VerbatimExpression(text.strip(), new SourceInfo(fileName, line, column));
    }
}
