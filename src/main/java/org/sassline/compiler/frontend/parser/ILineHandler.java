package org.sassline.compiler.frontend.parser;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ast.AstNode;

/**
 * Classifies a logical line selected by its first character and builds the matching node.
 * Handlers are stateless; everything about the line being classified is passed in.
 */
public interface ILineHandler {

    /**
     * Classifies one line.
     *
     * @param context The per-document parsing services.
     * @param parent The node the result will be appended to.
     * @param line The line to classify. Its children are appended by the caller unless
     *             the result is a comment or the handler consumed them itself.
     * @param root true if {@code parent} is the document root.
     * @return The classification result.
     * @throws SassSyntaxException if the line is malformed.
     */
    ClassificationResult classify(ParsingContext context, AstNode parent, LogicalLine line, boolean root)
            throws SassSyntaxException;
}
