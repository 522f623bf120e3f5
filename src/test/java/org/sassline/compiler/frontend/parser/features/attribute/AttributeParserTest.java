package org.sassline.compiler.frontend.parser.features.attribute;

import org.sassline.compiler.api.SassSyntaxException;
import org.sassline.compiler.api.SyntaxErrorCode;
import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.sassline.compiler.frontend.parser.ParsingContext;
import org.sassline.compiler.frontend.parser.ast.AttributeNode;
import org.sassline.compiler.frontend.parser.ast.AttributeValue;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Contains unit tests for the {@link AttributeParser}, including the lookahead that
 * decides between attributes and rules.
 */
public class AttributeParserTest {

    private final ParsingContext context = mock(ParsingContext.class);

    private static LogicalLine line(String text) {
        return new LogicalLine(text, 1, 7, 2, "main.sass");
    }

    /**
     * Verifies which lines have the shape of a {@code name: value} attribute.
     */
    @Test
    @Tag("unit")
    void decidesBetweenAttributeAndRule() {
        assertThat(AttributeParser.looksLikeAttribute("color: red")).isTrue();
        assertThat(AttributeParser.looksLikeAttribute("color:")).isTrue();
        assertThat(AttributeParser.looksLikeAttribute("width = !w")).isTrue();
        assertThat(AttributeParser.looksLikeAttribute("width= !w")).isTrue();
        assertThat(AttributeParser.looksLikeAttribute("a:hover")).isFalse();
        assertThat(AttributeParser.looksLikeAttribute("a > b")).isFalse();
        assertThat(AttributeParser.looksLikeAttribute("a[href=\"x\"]")).isFalse();
        assertThat(AttributeParser.looksLikeAttribute("#main .item")).isFalse();
    }

    /**
     * Verifies a literal value in the colon-suffixed syntax.
     */
    @Test
    @Tag("unit")
    void parsesNewSyntaxLiteral() throws SassSyntaxException {
        // Act
        AttributeNode attribute = AttributeParser.parse(context, line("font-family: \"Helvetica\", sans-serif"), AttributeNode.Syntax.NEW);

        // Assert
        assertThat(attribute.name()).isEqualTo("font-family");
        assertThat(attribute.value()).isEqualTo(new AttributeValue.Literal("\"Helvetica\", sans-serif"));
        assertThat(attribute.line()).isEqualTo(7);
        assertThat(attribute.fileName()).isEqualTo("main.sass");
        verifyNoInteractions(context);
    }

    /**
     * Verifies that a colon-prefixed line that is not an attribute is rejected.
     */
    @Test
    @Tag("unit")
    void rejectsMalformedAttribute() {
        // Act
        SassSyntaxException e = catchThrowableOfType(
                () -> AttributeParser.parse(context, line(":"), AttributeNode.Syntax.OLD), SassSyntaxException.class);

        // Assert
        assertThat(e.getCode()).isEqualTo(SyntaxErrorCode.INVALID_ATTRIBUTE);
        assertThat(e.getSassLine()).isEqualTo(7);
        assertThat(e.getMessage()).isEqualTo("Invalid attribute: \":\".");
    }
}
