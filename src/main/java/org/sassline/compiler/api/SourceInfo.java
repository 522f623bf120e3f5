package org.sassline.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The file where the code is located, or null for in-memory sources.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 0-based column the construct starts at.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    @Override
    public String toString() {
        return (fileName != null ? fileName : "<memory>") + ":" + lineNumber + ":" + columnNumber;
    }
}
