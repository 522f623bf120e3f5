package org.sassline.compiler.frontend.parser;

import org.sassline.compiler.api.SyntaxErrorCode;
import org.sassline.compiler.frontend.parser.ast.*;

import java.util.Optional;

/**
 * Decides whether a node may be appended to a parent other than the document root.
 * Returns the error to raise, or empty if the node may be nested.
 */
class PlacementValidator implements AstVisitor<Optional<SyntaxErrorCode>> {

    @Override public Optional<SyntaxErrorCode> visit(MixinDefinitionNode node) { return Optional.of(SyntaxErrorCode.MIXIN_NOT_AT_ROOT); }
    @Override public Optional<SyntaxErrorCode> visit(FileImportNode node) { return Optional.of(SyntaxErrorCode.IMPORT_NOT_AT_ROOT); }
    @Override public Optional<SyntaxErrorCode> visit(CssImportNode node) { return Optional.of(SyntaxErrorCode.IMPORT_NOT_AT_ROOT); }

    @Override public Optional<SyntaxErrorCode> visit(RootNode node) { return Optional.empty(); }
    @Override public Optional<SyntaxErrorCode> visit(RuleNode node) { return Optional.empty(); }
    @Override public Optional<SyntaxErrorCode> visit(AttributeNode node) { return Optional.empty(); }
    @Override public Optional<SyntaxErrorCode> visit(CommentNode node) { return Optional.empty(); }
    @Override public Optional<SyntaxErrorCode> visit(DirectiveNode node) { return Optional.empty(); }
    @Override public Optional<SyntaxErrorCode> visit(VariableNode node) { return Optional.empty(); }
    @Override public Optional<SyntaxErrorCode> visit(MixinIncludeNode node) { return Optional.empty(); }
    @Override public Optional<SyntaxErrorCode> visit(IfNode node) { return Optional.empty(); }
    @Override public Optional<SyntaxErrorCode> visit(WhileNode node) { return Optional.empty(); }
    @Override public Optional<SyntaxErrorCode> visit(ForNode node) { return Optional.empty(); }
    @Override public Optional<SyntaxErrorCode> visit(DebugNode node) { return Optional.empty(); }
}
