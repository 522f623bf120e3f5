package org.sassline.compiler.frontend.parser.features.mixin;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.api.SyntaxErrorCode;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ClassificationResult;
import org.sassline.compiler.frontend.parser.ILineHandler;
import org.sassline.compiler.frontend.parser.Nesting;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.AstNode;
import org.sassline.compiler.frontend.parser.ast.MixinIncludeNode;
import org.sassline.compiler.frontend.parser.ast.RuleNode;
import org.sassline.compiler.frontend.script.ScriptExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handles mixin includes, {@code +name} or {@code +name(expr, expr)}. A lone {@code +}
 * is a rule (the adjacent sibling combinator).
 */
public class MixinIncludeHandler implements ILineHandler {

    private static final Pattern INCLUDE = Pattern.compile("\\+\\s*([^(]+)(.*)");

    @Override
    public ClassificationResult classify(ParsingContext context, AstNode parent, LogicalLine line, boolean root)
            throws SassSyntaxException {
        String text = line.text();
        if (text.length() == 1) {
            return ClassificationResult.of(new RuleNode(line.sourceInfo(), text));
        }
        Nesting.requireNone(line, "mixin directives");

        Matcher m = INCLUDE.matcher(text);
        Optional<List<MixinArguments.Slice>> slices = m.matches()
                ? MixinArguments.split(m.group(2), m.start(2))
                : Optional.empty();
        if (slices.isEmpty() || m.group(1).isBlank()) {
            throw new SassSyntaxException(SyntaxErrorCode.INVALID_MIXIN_INCLUDE, line.lineNumber(), text);
        }
        for (MixinArguments.Slice slice : slices.get()) {
            if (slice.text().isEmpty()) {
                throw new SassSyntaxException(SyntaxErrorCode.EMPTY_MIXIN_ARGUMENT, line.lineNumber());
            }
        }

        List<ScriptExpression> arguments = new ArrayList<>();
        for (MixinArguments.Slice slice : slices.get()) {
            arguments.add(context.parseScript(slice.text(), line, line.offset() + slice.start()));
        }
        return ClassificationResult.of(new MixinIncludeNode(line.sourceInfo(), m.group(1).strip(), arguments));
    }
}
