package org.pbrtscene.loader.frontend.lexer;

import org.pbrtscene.loader.api.SceneErrorCode;
import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.api.SourceInfo;

import java.util.regex.Pattern;

/**
 * Represents a single token extracted from a scene file by the {@link Lexer}.
 * <p>
 * Besides the lexical classification, a token knows how to validate its own shape and
 * how to coerce its text into the scalar values used by parameters and directives.
 *
 * @param type The kind of the token.
 * @param text The exact text of the token from the source, quotes included.
 * @param line The line number where the token starts.
 * @param column The column number where the token starts.
 * @param fileName The logical file name of the buffer the token comes from.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column,
        String fileName
) {

    // Float.parseFloat also takes hex floats, type suffixes and NaN/Infinity.
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * Checks the basic well-formedness of the token: it is non-empty, a quoted token starts and
     * ends with a quote and has at least two characters, and an unquoted token has no spaces.
     *
     * @return true if the token passes the checks.
     */
    public boolean isValid() {
        if (text.isEmpty()) {
            return false;
        }

        boolean startsWithQuote = text.startsWith("\"");
        boolean endsWithQuote = text.endsWith("\"");

        if (startsWithQuote || endsWithQuote) {
            if (startsWithQuote != endsWithQuote) {
                return false;
            }
            if (text.length() < 2) {
                return false;
            }
        }

        return startsWithQuote || !text.contains(" ");
    }

    /**
     * @return true if the token begins with a double quote.
     */
    public boolean isQuoted() {
        return text.startsWith("\"");
    }

    public boolean isOpenBracket() {
        return type == TokenType.OPEN_BRACKET;
    }

    public boolean isCloseBracket() {
        return type == TokenType.CLOSE_BRACKET;
    }

    /**
     * Strips exactly the leading and trailing quote character.
     *
     * @return The content of the string.
     * @throws SceneLoadException with {@link SceneErrorCode#INVALID_STRING} if the token is not a quoted string.
     */
    public String unquote() throws SceneLoadException {
        if (text.length() < 2 || !text.startsWith("\"") || !text.endsWith("\"")) {
            throw new SceneLoadException(SceneErrorCode.INVALID_STRING,
                    "Expected a quoted string, but got '" + text + "'", sourceInfo());
        }
        return text.substring(1, text.length() - 1);
    }

    /**
     * Parses the token as a decimal float.
     *
     * @return The parsed value.
     * @throws SceneLoadException with {@link SceneErrorCode#INVALID_NUMBER} if the text is not a float.
     */
    public float parseFloat() throws SceneLoadException {
        if (!DECIMAL.matcher(text).matches()) {
            throw new SceneLoadException(SceneErrorCode.INVALID_NUMBER,
                    "Unable to parse float '" + text + "'", sourceInfo());
        }
        return Float.parseFloat(text);
    }

    /**
     * Parses the token as a decimal integer.
     *
     * @return The parsed value.
     * @throws SceneLoadException with {@link SceneErrorCode#INVALID_NUMBER} if the text is not an integer.
     */
    public int parseInt() throws SceneLoadException {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new SceneLoadException(SceneErrorCode.INVALID_NUMBER,
                    "Unable to parse integer '" + text + "'", sourceInfo(), e);
        }
    }

    /**
     * Parses the token as a boolean. Accepts {@code true} and {@code false}, bare or quoted.
     *
     * @return The parsed value.
     * @throws SceneLoadException with {@link SceneErrorCode#INVALID_BOOLEAN} for any other text.
     */
    public boolean parseBoolean() throws SceneLoadException {
        String value = isQuoted() && text.length() >= 2 && text.endsWith("\"")
                ? text.substring(1, text.length() - 1)
                : text;
        if ("true".equals(value)) {
            return true;
        }
        if ("false".equals(value)) {
            return false;
        }
        throw new SceneLoadException(SceneErrorCode.INVALID_BOOLEAN,
                "Unable to parse boolean '" + text + "'", sourceInfo());
    }

    /**
     * @return The position of this token, without line content.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, line, column, "");
    }
}
