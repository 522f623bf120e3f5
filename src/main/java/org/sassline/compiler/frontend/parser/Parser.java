package org.sassline.compiler.frontend.parser;

import org.sassline.compiler.api.ParserOptions;
import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.api.SyntaxErrorCode;
import org.sassline.compiler.frontend.directive.DirectiveHandlerRegistry;
import org.sassline.compiler.frontend.imports.IImportResolver;
import org.sassline.compiler.frontend.imports.ImportNotFoundException;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ast.AstNode;
import org.sassline.compiler.frontend.parser.ast.CommentNode;
import org.sassline.compiler.frontend.parser.ast.RootNode;
import org.sassline.compiler.frontend.parser.ast.RuleNode;
import org.sassline.compiler.frontend.script.ExpressionSyntaxException;
import org.sassline.compiler.frontend.script.IExpressionParser;
import org.sassline.compiler.frontend.script.ScriptExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The syntax classifier and tree assembler. It consumes the line tree produced by the
 * {@link org.sassline.compiler.frontend.tree.TreeStructurer} and produces the AST.
 * <p>
 * A parser holds the state of one document and is used for a single {@link #parse(List)}
 * call. The registries and collaborators it is given are shared and stateless.
 */
public class Parser implements ParsingContext {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);
    private static final PlacementValidator PLACEMENT = new PlacementValidator();

    private final IExpressionParser expressionParser;
    private final IImportResolver importResolver;
    private final ParserOptions options;
    private final LineHandlerRegistry lineHandlers;
    private final DirectiveHandlerRegistry directiveRegistry;

    /**
     * Constructs a new Parser.
     * @param expressionParser The collaborator for expression text.
     * @param importResolver The collaborator for import names.
     * @param options The options of the document being parsed.
     * @param lineHandlers The handlers keyed by a line's first character.
     * @param directiveRegistry The handlers keyed by directive keyword.
     */
    public Parser(IExpressionParser expressionParser, IImportResolver importResolver, ParserOptions options,
                  LineHandlerRegistry lineHandlers, DirectiveHandlerRegistry directiveRegistry) {
        this.expressionParser = expressionParser;
        this.importResolver = importResolver;
        this.options = options;
        this.lineHandlers = lineHandlers;
        this.directiveRegistry = directiveRegistry;
    }

    /**
     * Classifies every top-level line and builds the document.
     * @param topLevel The structured top-level lines.
     * @return The root node, carrying this parser's options.
     * @throws SassSyntaxException at the first malformed construct.
     */
    public RootNode parse(List<LogicalLine> topLevel) throws SassSyntaxException {
        RootNode root = new RootNode(options);
        appendChildren(root, topLevel, true);
        LOG.debug("Built {} top-level nodes", root.getChildren().size());
        return root;
    }

    @Override
    public void appendChildren(AstNode parent, List<LogicalLine> lines, boolean root) throws SassSyntaxException {
        RuleNode continued = null;
        for (LogicalLine line : lines) {
            ClassificationResult result = buildTree(parent, line, root);

            Optional<RuleNode> rule = singleRule(result);
            if (rule.isPresent() && rule.get().isContinued()) {
                RuleNode part = rule.get();
                if (!part.getChildren().isEmpty()) {
                    throw new SassSyntaxException(SyntaxErrorCode.RULE_ENDS_IN_COMMA, part.line());
                }
                if (continued == null) {
                    continued = part;
                } else {
                    continued.addSelectorsOf(part);
                }
                continue;
            }

            if (continued != null) {
                if (rule.isEmpty()) {
                    throw new SassSyntaxException(SyntaxErrorCode.RULE_ENDS_IN_COMMA, continued.line());
                }
                continued.closeWith(rule.get());
                result = ClassificationResult.of(continued);
                continued = null;
            }
            validateAndAppend(parent, result, line, root);
        }
        if (continued != null) {
            throw new SassSyntaxException(SyntaxErrorCode.RULE_ENDS_IN_COMMA, continued.line());
        }
    }

    private ClassificationResult buildTree(AstNode parent, LogicalLine line, boolean root) throws SassSyntaxException {
        ClassificationResult result = lineHandlers.get(line.text()).classify(this, parent, line, root);
        if (result instanceof ClassificationResult.Produced produced && !(produced.node() instanceof CommentNode)) {
            appendChildren(produced.node(), line.children(), false);
        }
        return result;
    }

    private static Optional<RuleNode> singleRule(ClassificationResult result) {
        if (result instanceof ClassificationResult.Produced produced && produced.node() instanceof RuleNode rule) {
            return Optional.of(rule);
        }
        return Optional.empty();
    }

    private void validateAndAppend(AstNode parent, ClassificationResult result, LogicalLine line, boolean root)
            throws SassSyntaxException {
        for (AstNode node : result.nodes()) {
            if (!root) {
                Optional<SyntaxErrorCode> misplaced = node.accept(PLACEMENT);
                if (misplaced.isPresent()) {
                    throw new SassSyntaxException(misplaced.get(), line.lineNumber());
                }
            }
            parent.addChild(node);
        }
    }

    @Override
    public ScriptExpression parseScript(String text, LogicalLine line, int column) throws SassSyntaxException {
        try {
            return expressionParser.parse(text, line.lineNumber(), column, line.fileName());
        } catch (ExpressionSyntaxException | RuntimeException e) {
            throw new SassSyntaxException(e, SyntaxErrorCode.EXPRESSION_SYNTAX, line.lineNumber(), describe(e));
        }
    }

    @Override
    public String resolveImport(String name, LogicalLine line) throws SassSyntaxException {
        try {
            return importResolver.resolve(name, searchDirectories());
        } catch (ImportNotFoundException | RuntimeException e) {
            throw new SassSyntaxException(e, SyntaxErrorCode.IMPORT_NOT_FOUND, line.lineNumber(), describe(e));
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private List<Path> searchDirectories() {
        List<Path> directories = new ArrayList<>();
        if (options.filename() != null) {
            try {
                Path parent = Path.of(options.filename()).toAbsolutePath().getParent();
                if (parent != null) {
                    directories.add(parent);
                }
            } catch (InvalidPathException e) {
                LOG.debug("Not searching the directory of '{}': {}", options.filename(), e.getMessage());
            }
        }
        directories.addAll(options.loadPaths());
        return directories;
    }

    @Override
    public ParserOptions getOptions() {
        return options;
    }

    @Override
    public DirectiveHandlerRegistry getDirectiveRegistry() {
        return directiveRegistry;
    }
}
