package org.pytch.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The file where the code is located.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 * @param lineContent The content of the line, without its line terminator.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber, String lineContent) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
