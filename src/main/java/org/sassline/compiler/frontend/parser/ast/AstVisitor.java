package org.sassline.compiler.frontend.parser.ast;

/**
 * A visitor over the closed set of AST node kinds.
 *
 * @param <T> The return type of the visit methods.
 */
public interface AstVisitor<T> {
    T visit(RootNode node);
    T visit(RuleNode node);
    T visit(AttributeNode node);
    T visit(CommentNode node);
    T visit(DirectiveNode node);
    T visit(VariableNode node);
    T visit(MixinDefinitionNode node);
    T visit(MixinIncludeNode node);
    T visit(IfNode node);
    T visit(WhileNode node);
    T visit(ForNode node);
    T visit(DebugNode node);
    T visit(FileImportNode node);
    T visit(CssImportNode node);
}
