package org.sassline.compiler.frontend.directive;

import org.sassline.compiler.frontend.lexer.LogicalLine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for splitting directive lines into keyword and value.
 */
public class DirectiveLineTest {

    private static DirectiveLine split(String text, int offset) {
        return DirectiveLine.of(new LogicalLine(text, 0, 1, offset, null));
    }

    @Test
    @Tag("unit")
    void splitsKeywordAndValue() {
        // Act
        DirectiveLine directive = split("@import  foo, bar", 4);

        // Assert
        assertThat(directive.keyword()).isEqualTo("import");
        assertThat(directive.value()).isEqualTo("foo, bar");
        assertThat(directive.hasValue()).isTrue();
        assertThat(directive.valueColumn()).isEqualTo(13);
    }

    @Test
    @Tag("unit")
    void handlesKeywordWithoutValue() {
        // Act
        DirectiveLine directive = split("@else", 0);

        // Assert
        assertThat(directive.keyword()).isEqualTo("else");
        assertThat(directive.value()).isNull();
        assertThat(directive.hasValue()).isFalse();
    }

    @Test
    @Tag("unit")
    void handlesBareAt() {
        assertThat(split("@", 0).keyword()).isEmpty();
    }
}
