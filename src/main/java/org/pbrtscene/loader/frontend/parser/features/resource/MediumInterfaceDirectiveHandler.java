package org.pbrtscene.loader.frontend.parser.features.resource;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.directive.Directive;
import org.pbrtscene.loader.frontend.directive.IDirectiveHandler;
import org.pbrtscene.loader.frontend.lexer.Token;
import org.pbrtscene.loader.frontend.parser.ParsingContext;

/**
 * Grammar for {@code MediumInterface "interior" "exterior"}.
 * With a single name, that medium is used on both sides.
 */
public class MediumInterfaceDirectiveHandler implements IDirectiveHandler {

    @Override
    public Directive parse(ParsingContext context) throws SceneLoadException {
        String interior = context.readString();
        Token next = context.peek();
        String exterior = next != null && next.isQuoted() ? context.readString() : interior;
        return new Directive.MediumInterface(interior, exterior);
    }
}
