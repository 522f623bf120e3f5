package org.sassline.compiler.frontend.parser;

import org.sassline.compiler.api.ParserOptions;
import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.frontend.directive.DirectiveHandlerRegistry;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ast.AstNode;
import org.sassline.compiler.frontend.script.ScriptExpression;

import java.util.List;

/**
 * An interface that encapsulates the per-document state during classification.
 * It gives line and directive handlers access to the collaborators and to the
 * assembler without coupling them to the {@link Parser} itself.
 */
public interface ParsingContext {

    /**
     * Parses an expression with the configured expression parser.
     * @param text The expression text.
     * @param line The line the expression is on.
     * @param column The column at which {@code text} starts in the physical line.
     * @return The parsed expression.
     * @throws SassSyntaxException if the expression parser rejects the text.
     */
    ScriptExpression parseScript(String text, LogicalLine line, int column) throws SassSyntaxException;

    /**
     * Classifies lines and appends the resulting nodes to a parent, merging comma-continued
     * rules and checking placement.
     * @param parent The node to append to.
     * @param lines The lines nested beneath the parent.
     * @param root true if {@code parent} is the document root.
     * @throws SassSyntaxException if any line is malformed.
     */
    void appendChildren(AstNode parent, List<LogicalLine> lines, boolean root) throws SassSyntaxException;

    /**
     * Resolves one import name against the importing file's directory and the load paths.
     * @param name The name as written.
     * @param line The import's line, for error reporting.
     * @return The resolved path.
     * @throws SassSyntaxException if the import cannot be found.
     */
    String resolveImport(String name, LogicalLine line) throws SassSyntaxException;

    /**
     * @return The options the document is parsed with.
     */
    ParserOptions getOptions();

    /**
     * @return The registry of {@code @} directive handlers.
     */
    DirectiveHandlerRegistry getDirectiveRegistry();
}
