package org.asymptote.analyzer.api;

/**
 * A pure data class representing a position in the pseudocode source.
 * It is part of the public analyzer API and free of implementation details.
 *
 * @param fileName The logical name of the analyzed source.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    @Override
    public String toString() {
        return String.format("%s:%d:%d", fileName, lineNumber, columnNumber);
    }
}
