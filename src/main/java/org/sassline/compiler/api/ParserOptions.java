package org.sassline.compiler.api;

import com.typesafe.config.Config;

import java.nio.file.Path;
import java.util.List;

/**
 * The options bundle for one parse. Only {@code loadPaths}, {@code filename} and
 * {@code line} influence the front end; {@code style} and {@code precompiledLocation}
 * are forwarded to later stages on the AST root.
 *
 * @param style The CSS output style.
 * @param loadPaths Ordered import search directories.
 * @param precompiledLocation The directory for cached compiled output.
 * @param filename The file being parsed, or null for in-memory sources.
 * @param line The line number of the first source line (for embedded fragments). Must not be negative.
 */
public record ParserOptions(
        Style style,
        List<Path> loadPaths,
        Path precompiledLocation,
        String filename,
        int line
) {
    /** The built-in defaults, identical to those in {@code reference.conf}. */
    public static final ParserOptions DEFAULT = new ParserOptions(
            Style.NESTED,
            List.of(Path.of(".")),
            Path.of("./.sass-cache"),
            null,
            1);

    public ParserOptions {
        if (style == null) {
            throw new IllegalArgumentException("style must not be null");
        }
        if (line < 0) {
            throw new IllegalArgumentException("line must not be negative but was " + line);
        }
        loadPaths = List.copyOf(loadPaths);
    }

    /**
     * Maps a configuration subtree (normally the {@code sassline} path) onto options.
     * @param config The configuration holding {@code style}, {@code load-paths},
     *               {@code precompiled-location}, optionally {@code filename}, and {@code line}.
     * @return The options.
     */
    public static ParserOptions fromConfig(Config config) {
        List<Path> loadPaths = config.getStringList("load-paths").stream()
                .map(Path::of)
                .toList();
        String filename = config.hasPath("filename") ? config.getString("filename") : null;
        return new ParserOptions(
                Style.fromConfigValue(config.getString("style")),
                loadPaths,
                Path.of(config.getString("precompiled-location")),
                filename,
                config.getInt("line"));
    }

    public ParserOptions withFilename(String newFilename) {
        return new ParserOptions(style, loadPaths, precompiledLocation, newFilename, line);
    }

    public ParserOptions withLine(int newLine) {
        return new ParserOptions(style, loadPaths, precompiledLocation, filename, newLine);
    }

    public ParserOptions withLoadPaths(List<Path> newLoadPaths) {
        return new ParserOptions(style, newLoadPaths, precompiledLocation, filename, line);
    }
}
