package org.sassline.compiler.frontend.parser.features.control;

import org.sassline.compiler.api.ParserOptions;
import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.api.SourceInfo;
import org.sassline.compiler.api.SyntaxErrorCode;
import org.sassline.compiler.frontend.directive.DirectiveLine;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ClassificationResult;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.IfNode;
import org.sassline.compiler.frontend.parser.ast.RootNode;
import org.sassline.compiler.frontend.parser.ast.RuleNode;
import org.sassline.compiler.frontend.script.VerbatimExpression;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link ElseDirectiveHandler}, run against a mocked parsing context.
 */
public class ElseDirectiveHandlerTest {

    private final ElseDirectiveHandler handler = new ElseDirectiveHandler();
    private final ParsingContext context = mock(ParsingContext.class);

    private static LogicalLine line(String text) {
        return new LogicalLine(text, 0, 4, 0, null);
    }

    /**
     * Verifies that a plain else is attached to the end of the chain, gets its nested lines
     * classified beneath it, and produces nothing to append.
     */
    @Test
    @Tag("unit")
    void attachesBranchToChain() throws SassSyntaxException {
        // Arrange
        RootNode parent = new RootNode(ParserOptions.DEFAULT);
        IfNode head = new IfNode(new SourceInfo(null, 1, 0), new VerbatimExpression("!a", new SourceInfo(null, 1, 4)));
        IfNode elseIf = new IfNode(new SourceInfo(null, 3, 0), new VerbatimExpression("!b", new SourceInfo(null, 3, 9)));
        head.addElse(elseIf);
        parent.addChild(head);
        LogicalLine elseLine = line("@else");
        LogicalLine nested = new LogicalLine("a", 1, 5, 2, null);
        elseLine.attachChildren(List.of(nested));

        // Act
        ClassificationResult result = handler.parse(context, parent, elseLine, DirectiveLine.of(elseLine));

        // Assert
        assertThat(result).isSameAs(ClassificationResult.NOTHING);
        assertThat(result.nodes()).isEmpty();
        IfNode branch = elseIf.elseBranch().orElseThrow();
        assertThat(branch.isUnconditional()).isTrue();
        assertThat(branch.line()).isEqualTo(4);
        verify(context).appendChildren(branch, List.of(nested), false);
    }

    /**
     * Verifies that the previous sibling must be an if node.
     */
    @Test
    @Tag("unit")
    void requiresPrecedingIf() throws SassSyntaxException {
        // Arrange
        RootNode parent = new RootNode(ParserOptions.DEFAULT);
        parent.addChild(new RuleNode(new SourceInfo(null, 1, 0), "a"));
        LogicalLine elseLine = line("@else if !x");

        // Act
        SassSyntaxException e = catchThrowableOfType(
                () -> handler.parse(context, parent, elseLine, DirectiveLine.of(elseLine)), SassSyntaxException.class);

        // Assert
        assertThat(e.getCode()).isEqualTo(SyntaxErrorCode.ELSE_WITHOUT_IF);
        assertThat(e.getSassLine()).isEqualTo(4);
        verify(context, never()).appendChildren(any(), anyList(), anyBoolean());
    }

    /**
     * Verifies that an else as the first child fails as well.
     */
    @Test
    @Tag("unit")
    void rejectsElseAsFirstChild() {
        // Arrange
        RootNode parent = new RootNode(ParserOptions.DEFAULT);
        LogicalLine elseLine = line("@else");

        // Act
        SassSyntaxException e = catchThrowableOfType(
                () -> handler.parse(context, parent, elseLine, DirectiveLine.of(elseLine)), SassSyntaxException.class);

        // Assert
        assertThat(e.getCode()).isEqualTo(SyntaxErrorCode.ELSE_WITHOUT_IF);
    }

    /**
     * Verifies that the guard expression of an else-if is parsed.
     */
    @Test
    @Tag("unit")
    void parsesElseIfCondition() throws SassSyntaxException {
        // Arrange
        RootNode parent = new RootNode(ParserOptions.DEFAULT);
        IfNode head = new IfNode(new SourceInfo(null, 1, 0), new VerbatimExpression("!a", new SourceInfo(null, 1, 4)));
        parent.addChild(head);
        LogicalLine elseLine = line("@else if   !b");
        VerbatimExpression condition = new VerbatimExpression("!b", new SourceInfo(null, 4, 11));
        when(context.parseScript("!b", elseLine, 11)).thenReturn(condition);

        // Act
        handler.parse(context, parent, elseLine, DirectiveLine.of(elseLine));

        // Assert
        assertThat(head.elseBranch()).hasValueSatisfying(branch -> assertThat(branch.condition()).isSameAs(condition));
    }
}
