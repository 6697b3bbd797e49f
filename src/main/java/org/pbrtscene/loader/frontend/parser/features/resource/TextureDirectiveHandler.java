package org.pbrtscene.loader.frontend.parser.features.resource;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.directive.Directive;
import org.pbrtscene.loader.frontend.directive.IDirectiveHandler;
import org.pbrtscene.loader.frontend.parser.ParsingContext;

/**
 * Grammar for {@code Texture "name" "float|spectrum" "class" parameter-list}.
 */
public class TextureDirectiveHandler implements IDirectiveHandler {

    @Override
    public Directive parse(ParsingContext context) throws SceneLoadException {
        String name = context.readString();
        String valueType = context.readString();
        String textureClass = context.readString();
        return new Directive.Texture(name, valueType, textureClass, context.readParamList());
    }
}
