package org.pbrtscene.loader.frontend.parser.features.scope;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.directive.Directive;
import org.pbrtscene.loader.frontend.directive.IDirectiveHandler;
import org.pbrtscene.loader.frontend.parser.ParsingContext;

import java.util.function.Function;

/**
 * Grammar for directives taking a single quoted name,
 * e.g. {@code CoordinateSystem "name"}, {@code NamedMaterial "name"} or {@code Include "path"}.
 */
public class NameDirectiveHandler implements IDirectiveHandler {

    private final Function<String, Directive> factory;

    public NameDirectiveHandler(Function<String, Directive> factory) {
        this.factory = factory;
    }

    @Override
    public Directive parse(ParsingContext context) throws SceneLoadException {
        return factory.apply(context.readString());
    }
}
