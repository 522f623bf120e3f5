package org.sassline.compiler.frontend.imports;

import java.nio.file.Path;
import java.util.List;

/**
 * The collaborator that maps the name in an {@code @import} to a file.
 */
public interface IImportResolver {

    /**
     * Resolves an import target.
     *
     * @param name The name as written in the import directive.
     * @param searchDirectories Directories to search, in order.
     * @return The path of the file to import. A path ending in {@code .css} is imported as plain CSS.
     * @throws ImportNotFoundException if no file can be found.
     */
    String resolve(String name, List<Path> searchDirectories) throws ImportNotFoundException;
}
