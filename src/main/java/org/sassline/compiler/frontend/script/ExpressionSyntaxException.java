package org.sassline.compiler.frontend.script;

/**
 * Thrown by an {@link IExpressionParser} for malformed expression text.
 */
public class ExpressionSyntaxException extends Exception {

    private final int column;

    /**
     * @param message The detail message.
     * @param column The column the problem was found at.
     */
    public ExpressionSyntaxException(String message, int column) {
        super(message);
        this.column = column;
    }

    public int getColumn() {
        return column;
    }
}
