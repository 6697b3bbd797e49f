package org.pbrtscene.loader.frontend.parser.features.scope;

import org.pbrtscene.loader.frontend.directive.Directive;
import org.pbrtscene.loader.frontend.directive.IDirectiveHandler;
import org.pbrtscene.loader.frontend.parser.ParsingContext;

import java.util.function.Supplier;

/**
 * Grammar for directives without arguments, such as {@code WorldBegin} or {@code AttributeEnd}.
 */
public class KeywordDirectiveHandler implements IDirectiveHandler {

    private final Supplier<Directive> factory;

    public KeywordDirectiveHandler(Supplier<Directive> factory) {
        this.factory = factory;
    }

    @Override
    public Directive parse(ParsingContext context) {
        return factory.get();
    }
}
