package org.sassline.compiler.frontend.script;

/**
 * The collaborator that parses expression-language text. Implementations must be
 * stateless or otherwise safe for concurrent use, since one instance is shared by
 * every parse of a {@link org.sassline.compiler.StylesheetParser}.
 */
public interface IExpressionParser {

    /**
     * Parses one expression.
     *
     * @param text The expression text.
     * @param line The 1-based source line the expression is on.
     * @param column The column at which {@code text} starts in the physical line.
     * @param fileName The source file name, may be null.
     * @return The parsed expression.
     * @throws ExpressionSyntaxException if the text is not a valid expression.
     */
    ScriptExpression parse(String text, int line, int column, String fileName) throws ExpressionSyntaxException;
}
