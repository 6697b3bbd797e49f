package org.pbrtscene.loader.api;

/**
 * A pure data class representing a position in a scene file.
 * It is part of the public loader API and free of implementation details.
 *
 * @param fileName The file where the token is located ({@code <memory>} for in-memory buffers).
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 * @param lineContent The content of the line, or an empty string if unknown.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber, String lineContent) {

    @Override
    public String toString() {
        if (lineContent == null || lineContent.isBlank()) {
            return String.format("%s:%d:%d", fileName, lineNumber, columnNumber);
        }
        return String.format("%s:%d:%d: '%s'", fileName, lineNumber, columnNumber, lineContent.strip());
    }
}
