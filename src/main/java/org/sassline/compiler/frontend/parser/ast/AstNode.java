package org.sassline.compiler.frontend.parser.ast;

import org.sassline.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The base class for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * The hierarchy is closed: every node kind is listed in the {@code permits} clause and
 * has a matching method in {@link AstVisitor}, so adding a kind breaks every visitor
 * at build time until it handles the new kind.
 * <p>
 * A node's fields are fixed at construction. Children are appended while the parent's
 * nested lines are classified; after that only rule merging and else chaining modify
 * the tree.
 */
public abstract sealed class AstNode
        permits RootNode, RuleNode, AttributeNode, CommentNode, DirectiveNode, VariableNode,
                MixinDefinitionNode, MixinIncludeNode, IfNode, WhileNode, ForNode, DebugNode,
                FileImportNode, CssImportNode {

    private final SourceInfo sourceInfo;
    private final List<AstNode> children = new ArrayList<>();

    protected AstNode(SourceInfo sourceInfo) {
        this.sourceInfo = sourceInfo;
    }

    public SourceInfo sourceInfo() {
        return sourceInfo;
    }

    /**
     * @return The 1-based source line this node was created from.
     */
    public int line() {
        return sourceInfo.lineNumber();
    }

    /**
     * @return The source file name, or null for in-memory sources.
     */
    public String fileName() {
        return sourceInfo.fileName();
    }

    /**
     * Returns the direct child nodes in source order.
     * @return An unmodifiable view of the children.
     */
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Appends a child node.
     * @param child The node to append.
     */
    public void addChild(AstNode child) {
        children.add(child);
    }

    /**
     * @return The most recently appended child, if any.
     */
    public Optional<AstNode> lastChild() {
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(children.size() - 1));
    }

    void replaceChildren(List<AstNode> newChildren) {
        children.clear();
        children.addAll(newChildren);
    }

    /**
     * Dispatches to the visitor method for this node's kind.
     * @param visitor The visitor.
     * @param <T> The visitor's result type.
     * @return The visitor's result.
     */
    public abstract <T> T accept(AstVisitor<T> visitor);
}
