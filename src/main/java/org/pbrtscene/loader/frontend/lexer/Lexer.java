package org.pbrtscene.loader.frontend.lexer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * The Lexer turns one text buffer into a lazy, finite sequence of tokens.
 * <p>
 * Rules: '[' and ']' are single-character tokens; lines end at "\n", "\r\n" or a lone "\r";
 * spaces, tabs, carriage returns and newlines separate tokens; a token starting with '"' runs to
 * the next '"' inclusive, or to the end of the input if unterminated (there are no escape
 * sequences); a token starting with '#' runs to the end of the line; any other token runs until
 * whitespace, a quote or a bracket.
 * <p>
 * The lexer has no semantic knowledge and never fails. Malformed tokens are detected later by
 * {@link Token#isValid()}.
 */
public class Lexer implements Iterator<Token> {

    private final String source;
    private final String logicalFileName;
    private boolean skipComments = false;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private Token next;

    /**
     * Creates a new Lexer for an in-memory buffer.
     * @param source The text to tokenize.
     */
    public Lexer(String source) {
        this(source, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The text to tokenize.
     * @param logicalFileName The name of the file being tokenized, for error reporting.
     */
    public Lexer(String source, String logicalFileName) {
        this.source = source;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Makes the lexer drop comment tokens instead of emitting them.
     * @return this lexer.
     */
    public Lexer skipComments() {
        this.skipComments = true;
        return this;
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = scanToken();
        }
        return next != null;
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more tokens in " + logicalFileName);
        }
        Token token = next;
        next = null;
        return token;
    }

    /**
     * Returns the next token without consuming it.
     * @return The next token, or null at the end of the input.
     */
    public Token peek() {
        return hasNext() ? next : null;
    }

    /**
     * Drains the remaining input into a list.
     * @return All remaining tokens in order.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        while (hasNext()) {
            tokens.add(next());
        }
        return tokens;
    }

    private Token scanToken() {
        while (!isAtEnd()) {
            int start = current;
            int startLine = line;
            int startColumn = column;
            char c = advance();
            switch (c) {
                case ' ', '\t', '\r', '\n':
                    continue;
                case '[':
                    return token(TokenType.OPEN_BRACKET, start, startLine, startColumn);
                case ']':
                    return token(TokenType.CLOSE_BRACKET, start, startLine, startColumn);
                case '"':
                    while (!isAtEnd() && peekChar() != '"') advance();
                    // The closing quote, if any.
                    if (!isAtEnd()) advance();
                    return token(TokenType.STRING, start, startLine, startColumn);
                case '#':
                    while (!isAtEnd() && peekChar() != '\n' && peekChar() != '\r') advance();
                    if (skipComments) {
                        continue;
                    }
                    return token(TokenType.COMMENT, start, startLine, startColumn);
                default:
                    while (!isAtEnd() && !isDelimiter(peekChar())) advance();
                    return token(TokenType.WORD, start, startLine, startColumn);
            }
        }
        return null;
    }

    private Token token(TokenType type, int start, int startLine, int startColumn) {
        return new Token(type, source.substring(start, current), startLine, startColumn, logicalFileName);
    }

    private char advance() {
        char c = source.charAt(current++);
        // A lone '\r' ends a line as well; in "\r\n" the '\n' does.
        if (c == '\n' || (c == '\r' && (isAtEnd() || peekChar() != '\n'))) {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peekChar() {
        return source.charAt(current);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private static boolean isDelimiter(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '"' || c == '[' || c == ']';
    }
}
