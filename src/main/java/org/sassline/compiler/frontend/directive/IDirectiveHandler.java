package org.sassline.compiler.frontend.directive;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ClassificationResult;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.AstNode;

/**
 * The base interface for all directive handlers.
 * Each handler is responsible for processing a specific directive keyword (e.g., "import").
 */
public interface IDirectiveHandler {

    /**
     * Parses the directive and its value.
     *
     * @param context The per-document parsing services.
     * @param parent The node the result will be appended to.
     * @param line The directive's line.
     * @param directive The line split into keyword and value.
     * @return The classification result; {@link ClassificationResult#NOTHING} if the directive
     *         attached itself to an existing node.
     * @throws SassSyntaxException if the directive is malformed.
     */
    ClassificationResult parse(ParsingContext context, AstNode parent, LogicalLine line, DirectiveLine directive)
            throws SassSyntaxException;
}
