package org.pbrtscene.loader.frontend.lexer;

/**
 * Defines the different kinds of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** The '[' character, opening a value list. */
    OPEN_BRACKET,
    /** The ']' character, closing a value list. */
    CLOSE_BRACKET,
    /** A double-quoted string, including its quotes. May be unterminated at end of input. */
    STRING,
    /** Any other run of characters: directive keywords and numeric or boolean literals. */
    WORD,
    /** A '#' comment running to the end of the line. */
    COMMENT
}
