package org.pbrtscene.loader.frontend.parser.features.resource;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.directive.Directive;
import org.pbrtscene.loader.frontend.directive.IDirectiveHandler;
import org.pbrtscene.loader.frontend.param.ParamList;
import org.pbrtscene.loader.frontend.parser.ParsingContext;

import java.util.function.BiFunction;

/**
 * Grammar for resource directives of the form {@code Keyword "type" parameter-list}.
 * Also used for {@code MakeNamedMaterial "name" ...} and {@code Attribute "target" ...},
 * which share the same shape.
 */
public class TypedParamsDirectiveHandler implements IDirectiveHandler {

    private final BiFunction<String, ParamList, Directive> factory;

    public TypedParamsDirectiveHandler(BiFunction<String, ParamList, Directive> factory) {
        this.factory = factory;
    }

    @Override
    public Directive parse(ParsingContext context) throws SceneLoadException {
        String type = context.readString();
        ParamList params = context.readParamList();
        return factory.apply(type, params);
    }
}
