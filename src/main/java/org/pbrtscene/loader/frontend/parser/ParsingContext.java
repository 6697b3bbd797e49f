package org.pbrtscene.loader.frontend.parser;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.lexer.Token;
import org.pbrtscene.loader.frontend.lexer.TokenType;
import org.pbrtscene.loader.frontend.param.Param;
import org.pbrtscene.loader.frontend.param.ParamList;

/**
 * An interface that encapsulates the token stream during parsing.
 * It gives directive handlers access to the stream and the shared argument readers
 * without coupling them to {@link DirectiveParser}.
 */
public interface ParsingContext {

    /**
     * Returns the next token without consuming it.
     * @return The next token, or null at the end of the stream.
     */
    Token peek();

    /**
     * Consumes the next token, which must exist.
     * @return The consumed token.
     * @throws SceneLoadException if the stream is exhausted or the token is malformed.
     */
    Token advance() throws SceneLoadException;

    /**
     * Consumes the next token if it is of the expected type, otherwise fails.
     * @param type The expected token type.
     * @param errorMessage The message to report if the type does not match.
     * @return The consumed token.
     * @throws SceneLoadException if the token is missing or of another type.
     */
    Token consume(TokenType type, String errorMessage) throws SceneLoadException;

    /**
     * Reads the next token as a float.
     * @return The parsed float.
     * @throws SceneLoadException if the token is missing or not a number.
     */
    float readFloat() throws SceneLoadException;

    /**
     * Reads the next token as a quoted string and strips its quotes.
     * @return The string content.
     * @throws SceneLoadException if the token is missing or not a quoted string.
     */
    String readString() throws SceneLoadException;

    /**
     * Reads one {@code "type name" value} or {@code "type name" [ values ]} parameter.
     * @return The parsed parameter.
     * @throws SceneLoadException if the parameter is malformed.
     */
    Param readParam() throws SceneLoadException;

    /**
     * Reads parameters greedily for as long as the next token begins with a quote.
     * @return The parsed list, possibly empty.
     * @throws SceneLoadException if a parameter is malformed or a name appears twice.
     */
    ParamList readParamList() throws SceneLoadException;
}
