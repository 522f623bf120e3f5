package org.sassline.compiler.frontend.parser.features.mixin;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.api.SyntaxErrorCode;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ClassificationResult;
import org.sassline.compiler.frontend.parser.ILineHandler;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.AstNode;
import org.sassline.compiler.frontend.parser.ast.MixinArgument;
import org.sassline.compiler.frontend.parser.ast.MixinDefinitionNode;
import org.sassline.compiler.frontend.script.ScriptExpression;
import org.sassline.compiler.frontend.script.ScriptSyntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handles mixin definitions, {@code =name} or {@code =name(!a, !b = default)}.
 * Whether the definition sits at the document root is checked when it is appended.
 */
public class MixinDefinitionHandler implements ILineHandler {

    private static final Pattern DEFINITION = Pattern.compile("=\\s*([^(]+)(.*)");
    private static final Pattern DEFAULT_SEPARATOR = Pattern.compile("\\s*=\\s*");

    @Override
    public ClassificationResult classify(ParsingContext context, AstNode parent, LogicalLine line, boolean root)
            throws SassSyntaxException {
        String text = line.text();
        Matcher m = DEFINITION.matcher(text);
        Optional<List<MixinArguments.Slice>> slices = m.matches()
                ? MixinArguments.split(m.group(2), m.start(2))
                : Optional.empty();
        if (slices.isEmpty() || m.group(1).isBlank()) {
            throw new SassSyntaxException(SyntaxErrorCode.INVALID_MIXIN, line.lineNumber(), text.substring(1));
        }

        List<MixinArgument> arguments = new ArrayList<>();
        boolean optionalSeen = false;
        for (MixinArguments.Slice slice : slices.get()) {
            String arg = slice.text();
            if (arg.isEmpty() || arg.equals(String.valueOf(ScriptSyntax.VARIABLE_CHAR))) {
                throw new SassSyntaxException(SyntaxErrorCode.EMPTY_MIXIN_ARGUMENT, line.lineNumber());
            }
            if (arg.charAt(0) != ScriptSyntax.VARIABLE_CHAR) {
                throw new SassSyntaxException(SyntaxErrorCode.MIXIN_ARGUMENT_NOT_VARIABLE, line.lineNumber(), arg);
            }

            String name = arg;
            String defaultText = null;
            int defaultStart = -1;
            Matcher separator = DEFAULT_SEPARATOR.matcher(arg);
            if (separator.find()) {
                name = arg.substring(0, separator.start());
                defaultText = arg.substring(separator.end());
                defaultStart = slice.start() + separator.end();
            }
            optionalSeen |= defaultText != null;

            if (!ScriptSyntax.isValidVariable(name)) {
                throw new SassSyntaxException(SyntaxErrorCode.INVALID_VARIABLE_NAME, line.lineNumber(), name);
            }
            if (optionalSeen && defaultText == null) {
                throw new SassSyntaxException(SyntaxErrorCode.REQUIRED_ARGUMENT_AFTER_OPTIONAL, line.lineNumber(), name);
            }
            ScriptExpression defaultValue = defaultText == null
                    ? null
                    : context.parseScript(defaultText, line, line.offset() + defaultStart);
            arguments.add(new MixinArgument(name.substring(1), defaultValue));
        }
        return ClassificationResult.of(new MixinDefinitionNode(line.sourceInfo(), m.group(1).strip(), arguments));
    }
}
