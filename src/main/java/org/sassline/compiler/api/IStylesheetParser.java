package org.sassline.compiler.api;

import org.sassline.compiler.frontend.parser.ast.RootNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public, clean interface for the stylesheet front end.
 */
public interface IStylesheetParser {

    /**
     * Parses a document with this parser's default options.
     *
     * @param source The raw source text.
     * @return The root of the validated AST.
     * @throws SassSyntaxException if any construct is malformed.
     */
    RootNode parse(String source) throws SassSyntaxException;

    /**
     * Parses a document with explicit options.
     *
     * @param source The raw source text.
     * @param options The options bundle, attached to the returned root.
     * @return The root of the validated AST.
     * @throws SassSyntaxException if any construct is malformed.
     */
    RootNode parse(String source, ParserOptions options) throws SassSyntaxException;

    /**
     * Returns the options used by {@link #parse(String)}.
     * @return The default options.
     */
    ParserOptions defaultOptions();

    /**
     * Parses a UTF-8 file. Its absolute path becomes the {@code filename} option, so
     * imports are also searched relative to the file's directory.
     *
     * @param path The file to parse.
     * @return The root of the validated AST.
     * @throws SassSyntaxException if any construct is malformed.
     * @throws IOException if the file cannot be read.
     */
    default RootNode parseFile(Path path) throws SassSyntaxException, IOException {
        String source = Files.readString(path, StandardCharsets.UTF_8);
        return parse(source, defaultOptions().withFilename(path.toAbsolutePath().normalize().toString()));
    }
}
