package org.pbrtscene.loader.frontend.parser;

import org.pbrtscene.loader.api.SceneErrorCode;
import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.api.SourceInfo;
import org.pbrtscene.loader.frontend.directive.Directive;
import org.pbrtscene.loader.frontend.directive.DirectiveHandlerRegistry;
import org.pbrtscene.loader.frontend.directive.IDirectiveHandler;
import org.pbrtscene.loader.frontend.lexer.Lexer;
import org.pbrtscene.loader.frontend.lexer.Token;
import org.pbrtscene.loader.frontend.lexer.TokenType;
import org.pbrtscene.loader.frontend.param.Param;
import org.pbrtscene.loader.frontend.param.ParamList;

import java.util.Optional;

/**
 * The directive parser for one text buffer. It pulls tokens lazily from a {@link Lexer}
 * (with comments skipped), recognizes the leading keyword of each statement, and lets the
 * registered {@link IDirectiveHandler} consume exactly the arguments of that directive.
 * <p>
 * One instance is one "parser frame": the loader keeps a stack of them, one per open file.
 */
public class DirectiveParser implements ParsingContext {

    private final Lexer lexer;
    private final DirectiveHandlerRegistry directiveRegistry;
    private final String fileName;
    private Token previous;
    private Token lastKeyword;

    /**
     * Constructs a parser over an in-memory buffer with the full directive vocabulary.
     * @param source The text to parse.
     */
    public DirectiveParser(String source) {
        this(source, "<memory>", DirectiveHandlerRegistry.initialize());
    }

    /**
     * Constructs a new parser.
     * @param source The text to parse.
     * @param fileName The logical file name of the text, for error reporting.
     * @param directiveRegistry The keyword dispatch table.
     */
    public DirectiveParser(String source, String fileName, DirectiveHandlerRegistry directiveRegistry) {
        this.lexer = new Lexer(source, fileName).skipComments();
        this.directiveRegistry = directiveRegistry;
        this.fileName = fileName;
    }

    /**
     * Parses the next directive.
     *
     * @return The directive, or empty once this buffer is exhausted.
     * @throws SceneLoadException if the next statement is not a well-formed directive.
     */
    public Optional<Directive> parseNext() throws SceneLoadException {
        if (!lexer.hasNext()) {
            return Optional.empty();
        }

        Token keyword = advance();
        lastKeyword = keyword;
        IDirectiveHandler handler = keyword.type() == TokenType.WORD
                ? directiveRegistry.get(keyword.text()).orElse(null)
                : null;
        if (handler == null) {
            throw new SceneLoadException(SceneErrorCode.UNKNOWN_DIRECTIVE,
                    "Unknown directive '" + keyword.text() + "'", keyword.sourceInfo());
        }
        return Optional.of(handler.parse(this));
    }

    /**
     * @return The keyword token of the most recently parsed directive, or null before the first one.
     */
    public Token lastKeyword() {
        return lastKeyword;
    }

    /**
     * @return The logical file name of the buffer this frame parses.
     */
    public String fileName() {
        return fileName;
    }

    @Override
    public Token peek() {
        return lexer.peek();
    }

    @Override
    public Token advance() throws SceneLoadException {
        if (!lexer.hasNext()) {
            SourceInfo where = previous != null ? previous.sourceInfo() : new SourceInfo(fileName, 1, 1, "");
            throw new SceneLoadException(SceneErrorCode.UNEXPECTED_END_OF_STREAM,
                    "Token expected, got end of stream", where);
        }
        Token token = lexer.next();
        previous = token;
        if (!token.isValid()) {
            SceneErrorCode code = token.isQuoted() ? SceneErrorCode.INVALID_STRING : SceneErrorCode.INVALID_TOKEN;
            throw new SceneLoadException(code, "Malformed token '" + token.text() + "'", token.sourceInfo());
        }
        return token;
    }

    @Override
    public Token consume(TokenType type, String errorMessage) throws SceneLoadException {
        Token token = advance();
        if (token.type() != type) {
            throw new SceneLoadException(SceneErrorCode.UNEXPECTED_TOKEN,
                    errorMessage + ", but got '" + token.text() + "'", token.sourceInfo());
        }
        return token;
    }

    @Override
    public float readFloat() throws SceneLoadException {
        return advance().parseFloat();
    }

    @Override
    public String readString() throws SceneLoadException {
        return advance().unquote();
    }

    /**
     * Valid inputs:
     * <pre>
     * "integer indices" [ 0 1 2 0 2 3 ]
     * "float scale" [ 10 ]
     * "float iso" 150
     * </pre>
     */
    @Override
    public Param readParam() throws SceneLoadException {
        Token header = advance();
        Param param = Param.fromHeader(header.unquote(), header.sourceInfo());

        // Either [ or a single value.
        Token value = advance();
        if (value.isOpenBracket()) {
            while (true) {
                Token element = advance();
                if (element.isCloseBracket()) {
                    break;
                }
                // A directive before the closing bracket means the list was never closed.
                if (element.isOpenBracket()
                        || (element.type() == TokenType.WORD && directiveRegistry.isKeyword(element.text()))) {
                    throw new SceneLoadException(SceneErrorCode.UNEXPECTED_TOKEN,
                            "Unexpected '" + element.text() + "' in value list of '" + param.name() + "'",
                            element.sourceInfo());
                }
                param.addValue(element);
            }
        } else if (value.isCloseBracket()) {
            throw new SceneLoadException(SceneErrorCode.UNEXPECTED_TOKEN,
                    "Unexpected ']' after parameter '" + param.name() + "'", value.sourceInfo());
        } else {
            param.addValue(value);
        }
        return param;
    }

    @Override
    public ParamList readParamList() throws SceneLoadException {
        ParamList list = new ParamList();
        while (true) {
            Token next = peek();
            // Each parameter starts with a quoted string; anything else ends the list.
            if (next == null || !next.isQuoted()) {
                return list;
            }
            Param param = readParam();
            list.add(param, next.sourceInfo());
        }
    }
}
