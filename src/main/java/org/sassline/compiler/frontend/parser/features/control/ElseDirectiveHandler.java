package org.sassline.compiler.frontend.parser.features.control;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.api.SyntaxErrorCode;
import org.sassline.compiler.frontend.directive.DirectiveLine;
import org.sassline.compiler.frontend.directive.IDirectiveHandler;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ClassificationResult;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.AstNode;
import org.sassline.compiler.frontend.parser.ast.IfNode;
import org.sassline.compiler.frontend.script.ScriptExpression;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handles <code>@else</code> and <code>@else if &lt;expr&gt;</code>.
 * <p>
 * The branch does not become a child of its parent. It is attached to the end of the
 * else chain of the preceding {@code @if}, which must be the parent's last child.
 */
public class ElseDirectiveHandler implements IDirectiveHandler {

    private static final Pattern ELSE_IF = Pattern.compile("if\\s+(.+)", Pattern.DOTALL);

    @Override
    public ClassificationResult parse(ParsingContext context, AstNode parent, LogicalLine line, DirectiveLine directive)
            throws SassSyntaxException {
        Optional<AstNode> previous = parent.lastChild();
        if (previous.isEmpty() || !(previous.get() instanceof IfNode ifNode)) {
            throw new SassSyntaxException(SyntaxErrorCode.ELSE_WITHOUT_IF, line.lineNumber());
        }

        ScriptExpression condition = null;
        if (directive.hasValue()) {
            Matcher m = ELSE_IF.matcher(directive.value());
            if (!m.matches()) {
                throw new SassSyntaxException(SyntaxErrorCode.INVALID_ELSE_DIRECTIVE, line.lineNumber(), directive.value());
            }
            condition = context.parseScript(m.group(1), line, directive.valueColumn() + m.start(1));
        }

        IfNode branch = new IfNode(line.sourceInfo(), condition);
        context.appendChildren(branch, line.children(), false);
        ifNode.addElse(branch);
        return ClassificationResult.NOTHING;
    }
}
