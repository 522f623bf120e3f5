package org.sassline.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class IndentationTest {

    @Test
    @Tag("unit")
    void describesSpacesAndTabs() {
        assertThat(Indentation.describe("  ", false)).isEqualTo("2 spaces");
        assertThat(Indentation.describe(" ", true)).isEqualTo("1 space was");
        assertThat(Indentation.describe("\t", true)).isEqualTo("1 tab was");
        assertThat(Indentation.describe("\t\t", true)).isEqualTo("2 tabs were");
    }

    @Test
    @Tag("unit")
    void quotesMixedWhitespace() {
        assertThat(Indentation.describe("\t ", false)).isEqualTo("\"\\t \"");
        assertThat(Indentation.describe("\t ", true)).isEqualTo("\"\\t \" was");
    }
}
