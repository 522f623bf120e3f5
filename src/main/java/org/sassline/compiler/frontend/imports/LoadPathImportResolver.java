package org.sassline.compiler.frontend.imports;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Resolves imports against the file system.
 * <p>
 * A name ending in {@code .css} is returned unchanged. Otherwise {@code <name>.sass}
 * (or the name itself if it already ends in {@code .sass}) is searched in every
 * directory, trying the partial form {@code _<last segment>} before the plain form.
 * When nothing is found the import falls back to plain CSS ({@code <name>.css}),
 * unless the name explicitly asked for a {@code .sass} file.
 */
public class LoadPathImportResolver implements IImportResolver {

    private static final Logger LOG = LoggerFactory.getLogger(LoadPathImportResolver.class);
    private static final String SASS_EXTENSION = ".sass";
    private static final String CSS_EXTENSION = ".css";

    @Override
    public String resolve(String name, List<Path> searchDirectories) throws ImportNotFoundException {
        if (name.endsWith(CSS_EXTENSION)) {
            return name;
        }
        boolean explicitSass = name.endsWith(SASS_EXTENSION);
        String stem = explicitSass ? name.substring(0, name.length() - SASS_EXTENSION.length()) : name;

        Optional<Path> found = findFullPath(stem + SASS_EXTENSION, searchDirectories);
        if (found.isPresent()) {
            String resolved = found.get().toAbsolutePath().normalize().toString();
            LOG.debug("Resolved import '{}' to {}", name, resolved);
            return resolved;
        }
        if (!explicitSass) {
            LOG.warn("No stylesheet found for import '{}', importing it as plain CSS '{}{}'", name, name, CSS_EXTENSION);
            return name + CSS_EXTENSION;
        }
        throw new ImportNotFoundException("File to import not found or unreadable: " + name + ".");
    }

    private Optional<Path> findFullPath(String fileName, List<Path> searchDirectories) {
        int slash = fileName.lastIndexOf('/');
        String partialName = fileName.substring(0, slash + 1) + "_" + fileName.substring(slash + 1);
        for (Path directory : searchDirectories) {
            for (String candidateName : List.of(partialName, fileName)) {
                Optional<Path> candidate = readable(directory, candidateName);
                if (candidate.isPresent()) {
                    return candidate;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Path> readable(Path directory, String candidateName) {
        try {
            Path candidate = directory.resolve(candidateName);
            if (Files.isRegularFile(candidate) && Files.isReadable(candidate)) {
                return Optional.of(candidate);
            }
        } catch (InvalidPathException e) {
            LOG.debug("Skipping import candidate '{}' in {}: {}", candidateName, directory, e.getMessage());
        }
        return Optional.empty();
    }
}
