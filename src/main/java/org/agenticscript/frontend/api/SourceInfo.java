package org.agenticscript.frontend.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public front-end API and free of implementation details.
 *
 * @param fileName The file where the code is located.
 * @param lineNumber The line number, starting at 1.
 * @param columnNumber The column number, starting at 1.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
