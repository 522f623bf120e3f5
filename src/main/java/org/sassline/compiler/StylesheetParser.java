package org.sassline.compiler;

import org.sassline.compiler.api.IStylesheetParser;
import org.sassline.compiler.api.ParserOptions;
import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.frontend.directive.DirectiveHandlerRegistry;
import org.sassline.compiler.frontend.imports.IImportResolver;
import org.sassline.compiler.frontend.imports.LoadPathImportResolver;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.lexer.Tokenizer;
import org.sassline.compiler.frontend.parser.LineHandlerRegistry;
import org.sassline.compiler.frontend.parser.Parser;
import org.sassline.compiler.frontend.parser.ast.RootNode;
import org.sassline.compiler.frontend.script.IExpressionParser;
import org.sassline.compiler.frontend.script.VerbatimExpressionParser;
import org.sassline.compiler.frontend.tree.TreeStructurer;
import org.sassline.compiler.util.AstDumper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main front end implementation. This class orchestrates the pipeline from source
 * text to a validated AST: tokenizing, structuring the lines by indentation, and
 * classifying them into nodes.
 * <p>
 * Instances hold no per-document state and may be shared between threads; every call
 * to {@link #parse(String, ParserOptions)} uses its own tokenizer and parser.
 */
public class StylesheetParser implements IStylesheetParser {

    private static final Logger LOG = LoggerFactory.getLogger(StylesheetParser.class);

    private final ParserOptions defaultOptions;
    private final IExpressionParser expressionParser;
    private final IImportResolver importResolver;
    private final LineHandlerRegistry lineHandlers;
    private final DirectiveHandlerRegistry directiveRegistry;

    /**
     * Creates a parser with the built-in defaults and collaborators.
     */
    public StylesheetParser() {
        this(ParserOptions.DEFAULT);
    }

    /**
     * Creates a parser with the built-in collaborators.
     * @param defaultOptions The options used by {@link #parse(String)} and {@link #parseFile(java.nio.file.Path)}.
     */
    public StylesheetParser(ParserOptions defaultOptions) {
        this(defaultOptions, new VerbatimExpressionParser(), new LoadPathImportResolver());
    }

    /**
     * Creates a parser with custom collaborators.
     * @param defaultOptions The options used by {@link #parse(String)} and {@link #parseFile(java.nio.file.Path)}.
     * @param expressionParser The parser for expression text.
     * @param importResolver The resolver for {@code @import} names.
     */
    public StylesheetParser(ParserOptions defaultOptions, IExpressionParser expressionParser, IImportResolver importResolver) {
        this.defaultOptions = defaultOptions;
        this.expressionParser = expressionParser;
        this.importResolver = importResolver;
        this.lineHandlers = LineHandlerRegistry.initialize();
        this.directiveRegistry = DirectiveHandlerRegistry.initialize();
    }

    @Override
    public RootNode parse(String source) throws SassSyntaxException {
        return parse(source, defaultOptions);
    }

    @Override
    public RootNode parse(String source, ParserOptions options) throws SassSyntaxException {
        String name = options.filename() != null ? options.filename() : "<memory>";
        LOG.debug("Parsing {} starting at line {}", name, options.line());
        try {
            // Phase 1: Tokenizing (indentation)
            List<LogicalLine> lines = new Tokenizer(source, options.filename(), options.line()).tokenize();

            // Phase 2: Structuring (line tree)
            List<LogicalLine> topLevel = TreeStructurer.structure(lines);
            LOG.debug("{}: {} lines, {} at top level", name, lines.size(), topLevel.size());

            // Phase 3: Classification and assembly
            Parser parser = new Parser(expressionParser, importResolver, options, lineHandlers, directiveRegistry);
            RootNode root = parser.parse(topLevel);
            if (LOG.isTraceEnabled()) {
                LOG.trace("AST of {}:\n{}", name, AstDumper.dump(root));
            }
            return root;
        } catch (SassSyntaxException e) {
            e.addMetadata(options.filename(), options.line());
            LOG.debug("Parse of {} failed: {}", name, e.describe());
            throw e;
        }
    }

    @Override
    public ParserOptions defaultOptions() {
        return defaultOptions;
    }
}
