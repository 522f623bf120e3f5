package org.sassline.compiler.util;

import org.sassline.compiler.StylesheetParser;
import org.sassline.compiler.api.SassSyntaxException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class AstDumperTest {

    @Test
    @Tag("unit")
    void dumpsForLoopsAndElseIfChains() throws SassSyntaxException {
        // Act
        String dump = AstDumper.dump(new StylesheetParser().parse(
                "@for !i from 1 through 3\n  @if !i == 1\n    a\n  @else if !i == 2\n    b\n  @debug !i"));

        // Assert
        assertThat(dump).isEqualTo(String.join("\n",
                "root",
                "  for i from {1} through {3}",
                "    if {!i == 1}",
                "      rule a",
                "    else if {!i == 2}",
                "      rule b",
                "    debug {!i}",
                ""));
    }
}
