package org.pbrtscene.loader.frontend.directive;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.parser.ParsingContext;

/**
 * The argument grammar of one directive keyword.
 * The parser consumes the keyword itself and then hands over to the handler, which consumes
 * exactly the tokens its directive requires.
 */
@FunctionalInterface
public interface IDirectiveHandler {

    /**
     * Parses the arguments of the directive.
     *
     * @param context The token stream, positioned just after the keyword.
     * @return The parsed directive.
     * @throws SceneLoadException if the arguments are missing or malformed.
     */
    Directive parse(ParsingContext context) throws SceneLoadException;
}
