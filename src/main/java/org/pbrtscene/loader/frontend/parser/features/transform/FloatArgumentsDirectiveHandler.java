package org.pbrtscene.loader.frontend.parser.features.transform;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.directive.Directive;
import org.pbrtscene.loader.frontend.directive.IDirectiveHandler;
import org.pbrtscene.loader.frontend.parser.ParsingContext;

import java.util.function.Function;

/**
 * Grammar for directives that take a fixed number of bare floats,
 * e.g. {@code Translate x y z} or {@code LookAt} with nine values.
 */
public class FloatArgumentsDirectiveHandler implements IDirectiveHandler {

    private final int count;
    private final Function<float[], Directive> factory;

    /**
     * @param count The number of required floats.
     * @param factory Builds the directive from the parsed floats.
     */
    public FloatArgumentsDirectiveHandler(int count, Function<float[], Directive> factory) {
        this.count = count;
        this.factory = factory;
    }

    @Override
    public Directive parse(ParsingContext context) throws SceneLoadException {
        float[] values = new float[count];
        for (int i = 0; i < count; i++) {
            values[i] = context.readFloat();
        }
        return factory.apply(values);
    }
}
