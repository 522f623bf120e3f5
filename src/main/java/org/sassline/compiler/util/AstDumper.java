package org.sassline.compiler.util;

import org.sassline.compiler.frontend.parser.ast.*;
import org.sassline.compiler.frontend.script.ScriptExpression;

import java.util.stream.Collectors;

/**
 * Renders an AST as indented text, one node per line, two spaces per level.
 * Used for trace logging and in tests.
 */
public final class AstDumper implements AstVisitor<String> {

    private static final AstDumper INSTANCE = new AstDumper();

    private AstDumper() {}

    /**
     * Dumps a node and everything beneath it.
     * @param node The node to dump.
     * @return The dump, each line terminated by {@code \n}.
     */
    public static String dump(AstNode node) {
        StringBuilder sb = new StringBuilder();
        append(sb, node, 0);
        return sb.toString();
    }

    private static void append(StringBuilder sb, AstNode node, int level) {
        appendLine(sb, node, node.accept(INSTANCE), level);
        if (node instanceof IfNode ifNode) {
            IfNode branch = ifNode.elseBranch().orElse(null);
            while (branch != null) {
                String head = branch.isUnconditional() ? "else" : "else if " + expr(branch.condition());
                appendLine(sb, branch, head, level);
                branch = branch.elseBranch().orElse(null);
            }
        }
    }

    private static void appendLine(StringBuilder sb, AstNode node, String text, int level) {
        sb.append("  ".repeat(level)).append(text).append('\n');
        for (AstNode child : node.getChildren()) {
            append(sb, child, level + 1);
        }
    }

    private static String expr(ScriptExpression expression) {
        return "{" + expression.source() + "}";
    }

    @Override public String visit(RootNode node) { return "root"; }
    @Override public String visit(RuleNode node) { return "rule " + node.selector(); }

    @Override
    public String visit(AttributeNode node) {
        String value;
        if (node.value() instanceof AttributeValue.Script script) {
            value = expr(script.expression());
        } else {
            value = ((AttributeValue.Literal) node.value()).text();
        }
        return "attr(" + node.syntax().name().toLowerCase() + ") " + node.name() + " = " + value;
    }

    @Override
    public String visit(CommentNode node) {
        return (node.isSilent() ? "silent-comment " : "comment ") + node.text()
                + (node.bodyLines().isEmpty() ? "" : " +" + node.bodyLines().size());
    }

    @Override public String visit(DirectiveNode node) { return "directive " + node.text(); }

    @Override
    public String visit(VariableNode node) {
        return "var " + node.name() + (node.isGuarded() ? " ||= " : " = ") + expr(node.expression());
    }

    @Override
    public String visit(MixinDefinitionNode node) {
        return "mixin " + node.name() + node.arguments().stream()
                .map(a -> a.hasDefault() ? a.name() + " = " + expr(a.defaultValue()) : a.name())
                .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String visit(MixinIncludeNode node) {
        return "include " + node.name() + node.arguments().stream()
                .map(AstDumper::expr)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String visit(IfNode node) {
        return node.isUnconditional() ? "else" : "if " + expr(node.condition());
    }

    @Override public String visit(WhileNode node) { return "while " + expr(node.condition()); }

    @Override
    public String visit(ForNode node) {
        return "for " + node.variable() + " from " + expr(node.from())
                + (node.isInclusive() ? " through " : " to ") + expr(node.to());
    }

    @Override public String visit(DebugNode node) { return "debug " + expr(node.expression()); }
    @Override public String visit(FileImportNode node) { return "import " + node.path(); }
    @Override public String visit(CssImportNode node) { return "css-import " + node.text(); }
}
