package org.pbrtscene.loader.frontend.parser.features.resource;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.directive.Directive;
import org.pbrtscene.loader.frontend.directive.IDirectiveHandler;
import org.pbrtscene.loader.frontend.parser.ParsingContext;

/**
 * Grammar for {@code Option "type name" value}: exactly one parameter.
 */
public class OptionDirectiveHandler implements IDirectiveHandler {

    @Override
    public Directive parse(ParsingContext context) throws SceneLoadException {
        return new Directive.Option(context.readParam());
    }
}
