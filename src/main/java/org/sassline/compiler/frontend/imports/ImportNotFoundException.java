package org.sassline.compiler.frontend.imports;

/**
 * Thrown by an {@link IImportResolver} when an import target does not exist or cannot be read.
 */
public class ImportNotFoundException extends Exception {

    /**
     * @param message The detail message.
     */
    public ImportNotFoundException(String message) {
        super(message);
    }
}
