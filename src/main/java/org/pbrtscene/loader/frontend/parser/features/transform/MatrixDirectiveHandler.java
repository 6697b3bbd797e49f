package org.pbrtscene.loader.frontend.parser.features.transform;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.directive.Directive;
import org.pbrtscene.loader.frontend.directive.IDirectiveHandler;
import org.pbrtscene.loader.frontend.lexer.TokenType;
import org.pbrtscene.loader.frontend.parser.ParsingContext;

import java.util.function.Function;

/**
 * Grammar for {@code Transform [ m00 ... m33 ]} and {@code ConcatTransform [ m00 ... m33 ]}.
 */
public class MatrixDirectiveHandler implements IDirectiveHandler {

    private static final int MATRIX_SIZE = 16;

    private final Function<float[], Directive> factory;

    /**
     * @param factory Builds the directive from the 16 column-major values.
     */
    public MatrixDirectiveHandler(Function<float[], Directive> factory) {
        this.factory = factory;
    }

    @Override
    public Directive parse(ParsingContext context) throws SceneLoadException {
        context.consume(TokenType.OPEN_BRACKET, "Expected '[' before matrix");
        float[] m = new float[MATRIX_SIZE];
        for (int i = 0; i < MATRIX_SIZE; i++) {
            m[i] = context.readFloat();
        }
        context.consume(TokenType.CLOSE_BRACKET, "Expected ']' after 16 matrix values");
        return factory.apply(m);
    }
}
