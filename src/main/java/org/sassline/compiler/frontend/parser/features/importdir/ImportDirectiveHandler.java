package org.sassline.compiler.frontend.parser.features.importdir;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.api.SyntaxErrorCode;
import org.sassline.compiler.frontend.directive.DirectiveLine;
import org.sassline.compiler.frontend.directive.IDirectiveHandler;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ClassificationResult;
import org.sassline.compiler.frontend.parser.Nesting;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.AstNode;
import org.sassline.compiler.frontend.parser.ast.CssImportNode;
import org.sassline.compiler.frontend.parser.ast.FileImportNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Handles the <code>@import</code> directive.
 * <p>
 * {@code @import url(...)} and {@code @import "..."} are plain CSS and kept verbatim.
 * Any other value is a comma-separated list of stylesheet names, each resolved on its
 * own; a name that resolves to a {@code .css} file becomes a plain CSS import.
 */
public class ImportDirectiveHandler implements IDirectiveHandler {

    private static final Pattern ENTRY_SEPARATOR = Pattern.compile(",\\s*");
    private static final String CSS_EXTENSION = ".css";

    @Override
    public ClassificationResult parse(ParsingContext context, AstNode parent, LogicalLine line, DirectiveLine directive)
            throws SassSyntaxException {
        if (directive.hasValue() && isCssImport(directive.value())) {
            return ClassificationResult.of(new CssImportNode(line.sourceInfo(), line.text()));
        }
        Nesting.requireNone(line, "import directives");
        if (!directive.hasValue()) {
            throw new SassSyntaxException(SyntaxErrorCode.INVALID_IMPORT_DIRECTIVE, line.lineNumber());
        }

        List<AstNode> imports = new ArrayList<>();
        for (String name : ENTRY_SEPARATOR.split(directive.value())) {
            String resolved = context.resolveImport(name, line);
            if (resolved.endsWith(CSS_EXTENSION)) {
                imports.add(new CssImportNode(line.sourceInfo(), "@import url(" + resolved + ")"));
            } else {
                imports.add(new FileImportNode(line.sourceInfo(), resolved));
            }
        }
        return ClassificationResult.ofAll(imports);
    }

    private static boolean isCssImport(String value) {
        return value.startsWith("url(") || value.startsWith("\"");
    }
}
