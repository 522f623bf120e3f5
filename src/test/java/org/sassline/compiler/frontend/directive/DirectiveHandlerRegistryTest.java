package org.sassline.compiler.frontend.directive;

import org.sassline.compiler.frontend.parser.features.control.ElseDirectiveHandler;
import org.sassline.compiler.frontend.parser.features.control.ForDirectiveHandler;
import org.sassline.compiler.frontend.parser.features.control.IfDirectiveHandler;
import org.sassline.compiler.frontend.parser.features.control.WhileDirectiveHandler;
import org.sassline.compiler.frontend.parser.features.debug.DebugDirectiveHandler;
import org.sassline.compiler.frontend.parser.features.importdir.ImportDirectiveHandler;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link DirectiveHandlerRegistry}.
 */
public class DirectiveHandlerRegistryTest {

    /**
     * Verifies that the built-in keywords are registered and that lookups are case-sensitive.
     */
    @Test
    @Tag("unit")
    void registersBuiltInKeywords() {
        // Arrange
        DirectiveHandlerRegistry registry = DirectiveHandlerRegistry.initialize();

        // Assert
        assertThat(registry.get("import")).isInstanceOf(ImportDirectiveHandler.class);
        assertThat(registry.get("for")).isInstanceOf(ForDirectiveHandler.class);
        assertThat(registry.get("if")).isInstanceOf(IfDirectiveHandler.class);
        assertThat(registry.get("else")).isInstanceOf(ElseDirectiveHandler.class);
        assertThat(registry.get("while")).isInstanceOf(WhileDirectiveHandler.class);
        assertThat(registry.get("debug")).isInstanceOf(DebugDirectiveHandler.class);
        assertThat(registry.get("IMPORT")).isInstanceOf(GenericDirectiveHandler.class);
        assertThat(registry.get("font-face")).isInstanceOf(GenericDirectiveHandler.class);
    }
}
