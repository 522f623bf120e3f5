package org.sassline.compiler.frontend.imports;

import org.sassline.junit.extensions.logging.ExpectLog;
import org.sassline.junit.extensions.logging.LogLevel;
import org.sassline.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains integration tests for the {@link LoadPathImportResolver} against a temporary directory tree.
 */
@ExtendWith(LogWatchExtension.class)
public class LoadPathImportResolverTest {

    private final LoadPathImportResolver resolver = new LoadPathImportResolver();

    @TempDir
    Path dir;

    private Path write(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.writeString(file, "a\n  b: c\n");
    }

    /**
     * Verifies that the partial form wins over the plain form in the same directory.
     */
    @Test
    @Tag("integration")
    void prefersPartial() throws IOException, ImportNotFoundException {
        // Arrange
        write(dir.resolve("base.sass"));
        Path partial = write(dir.resolve("_base.sass"));

        // Act
        String resolved = resolver.resolve("base", List.of(dir));

        // Assert
        assertThat(resolved).isEqualTo(partial.toAbsolutePath().normalize().toString());
    }

    /**
     * Verifies that directories are searched in order and nested names keep their directory.
     */
    @Test
    @Tag("integration")
    void searchesDirectoriesInOrder() throws IOException, ImportNotFoundException {
        // Arrange
        Path first = dir.resolve("first");
        Path second = dir.resolve("second");
        Files.createDirectories(first);
        Path expected = write(second.resolve("mixins/_grid.sass"));
        write(dir.resolve("third/mixins/grid.sass"));

        // Act
        String resolved = resolver.resolve("mixins/grid.sass", List.of(first, second, dir.resolve("third")));

        // Assert
        assertThat(resolved).isEqualTo(expected.toAbsolutePath().normalize().toString());
    }

    /**
     * Verifies that CSS names are never looked up.
     */
    @Test
    @Tag("unit")
    void returnsCssNamesUnchanged() throws ImportNotFoundException {
        assertThat(resolver.resolve("print.css", List.of(dir))).isEqualTo("print.css");
    }

    /**
     * Verifies the fallback to a plain CSS import, which is logged as a warning.
     */
    @Test
    @Tag("integration")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "No stylesheet found for import 'theme'.*")
    void fallsBackToCss() throws ImportNotFoundException {
        assertThat(resolver.resolve("theme", List.of(dir))).isEqualTo("theme.css");
    }

    /**
     * Verifies that an explicitly named stylesheet must exist.
     */
    @Test
    @Tag("integration")
    void failsForMissingExplicitStylesheet() {
        // Act
        ImportNotFoundException e = catchThrowableOfType(
                () -> resolver.resolve("missing.sass", List.of(dir)), ImportNotFoundException.class);

        // Assert
        assertThat(e.getMessage()).isEqualTo("File to import not found or unreadable: missing.sass.");
    }
}
