package org.pbrtscene.loader.frontend.directive;

import org.pbrtscene.loader.frontend.parser.features.resource.MediumInterfaceDirectiveHandler;
import org.pbrtscene.loader.frontend.parser.features.resource.OptionDirectiveHandler;
import org.pbrtscene.loader.frontend.parser.features.resource.TextureDirectiveHandler;
import org.pbrtscene.loader.frontend.parser.features.resource.TypedParamsDirectiveHandler;
import org.pbrtscene.loader.frontend.parser.features.scope.KeywordDirectiveHandler;
import org.pbrtscene.loader.frontend.parser.features.scope.NameDirectiveHandler;
import org.pbrtscene.loader.frontend.parser.features.transform.FloatArgumentsDirectiveHandler;
import org.pbrtscene.loader.frontend.parser.features.transform.MatrixDirectiveHandler;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The fixed dispatch table from directive keyword to argument grammar.
 * Keywords are case-sensitive, as in the file format.
 */
public class DirectiveHandlerRegistry {
    private final Map<String, IDirectiveHandler> handlers = new HashMap<>();

    /**
     * Registers a directive handler.
     * @param keyword The directive keyword (e.g., "Shape").
     * @param handler The handler for the directive.
     */
    public void register(String keyword, IDirectiveHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Gets the handler for a given keyword.
     * @param keyword The keyword.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IDirectiveHandler> get(String keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * @param text The text of a token.
     * @return true if the text is a registered directive keyword.
     */
    public boolean isKeyword(String text) {
        return handlers.containsKey(text);
    }

    /**
     * @return All registered keywords.
     */
    public Set<String> keywords() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    /**
     * Initializes the registry with the complete directive vocabulary.
     * @return A new instance of {@link DirectiveHandlerRegistry} with all handlers registered.
     */
    public static DirectiveHandlerRegistry initialize() {
        DirectiveHandlerRegistry registry = new DirectiveHandlerRegistry();

        // Files & options
        registry.register("Include", new NameDirectiveHandler(Directive.Include::new));
        registry.register("Import", new NameDirectiveHandler(Directive.Import::new));
        registry.register("Option", new OptionDirectiveHandler());
        registry.register("ColorSpace", new NameDirectiveHandler(Directive.ColorSpace::new));

        // Header resources
        registry.register("Film", new TypedParamsDirectiveHandler(Directive.Film::new));
        registry.register("Camera", new TypedParamsDirectiveHandler(Directive.Camera::new));
        registry.register("Sampler", new TypedParamsDirectiveHandler(Directive.Sampler::new));
        registry.register("Integrator", new TypedParamsDirectiveHandler(Directive.Integrator::new));
        registry.register("Accelerator", new TypedParamsDirectiveHandler(Directive.Accelerator::new));
        registry.register("PixelFilter", new TypedParamsDirectiveHandler(Directive.PixelFilter::new));

        // Transforms
        registry.register("Identity", new KeywordDirectiveHandler(Directive.Identity::new));
        registry.register("Translate", new FloatArgumentsDirectiveHandler(3,
                v -> new Directive.Translate(v[0], v[1], v[2])));
        registry.register("Scale", new FloatArgumentsDirectiveHandler(3,
                v -> new Directive.Scale(v[0], v[1], v[2])));
        registry.register("Rotate", new FloatArgumentsDirectiveHandler(4,
                v -> new Directive.Rotate(v[0], v[1], v[2], v[3])));
        registry.register("LookAt", new FloatArgumentsDirectiveHandler(9,
                v -> new Directive.LookAt(v[0], v[1], v[2], v[3], v[4], v[5], v[6], v[7], v[8])));
        registry.register("Transform", new MatrixDirectiveHandler(Directive.Transform::new));
        registry.register("ConcatTransform", new MatrixDirectiveHandler(Directive.ConcatTransform::new));
        registry.register("CoordinateSystem", new NameDirectiveHandler(Directive.CoordinateSystem::new));
        registry.register("CoordSysTransform", new NameDirectiveHandler(Directive.CoordSysTransform::new));
        registry.register("TransformTimes", new FloatArgumentsDirectiveHandler(2,
                v -> new Directive.TransformTimes(v[0], v[1])));
        // ActiveTransform takes a bare word (StartTime, EndTime, All).
        registry.register("ActiveTransform", context -> {
            String which = context.advance().text();
            return new Directive.ActiveTransform(which);
        });
        registry.register("ReverseOrientation", new KeywordDirectiveHandler(Directive.ReverseOrientation::new));

        // Scope
        registry.register("WorldBegin", new KeywordDirectiveHandler(Directive.WorldBegin::new));
        registry.register("AttributeBegin", new KeywordDirectiveHandler(Directive.AttributeBegin::new));
        registry.register("AttributeEnd", new KeywordDirectiveHandler(Directive.AttributeEnd::new));
        registry.register("Attribute", new TypedParamsDirectiveHandler(Directive.Attribute::new));
        registry.register("ObjectBegin", new NameDirectiveHandler(Directive.ObjectBegin::new));
        registry.register("ObjectEnd", new KeywordDirectiveHandler(Directive.ObjectEnd::new));
        registry.register("ObjectInstance", new NameDirectiveHandler(Directive.ObjectInstance::new));

        // World resources
        registry.register("LightSource", new TypedParamsDirectiveHandler(Directive.LightSource::new));
        registry.register("AreaLightSource", new TypedParamsDirectiveHandler(Directive.AreaLightSource::new));
        registry.register("Material", new TypedParamsDirectiveHandler(Directive.Material::new));
        registry.register("MakeNamedMaterial", new TypedParamsDirectiveHandler(Directive.MakeNamedMaterial::new));
        registry.register("NamedMaterial", new NameDirectiveHandler(Directive.NamedMaterial::new));
        registry.register("Texture", new TextureDirectiveHandler());
        registry.register("Shape", new TypedParamsDirectiveHandler(Directive.Shape::new));
        registry.register("MakeNamedMedium", new TypedParamsDirectiveHandler(Directive.MakeNamedMedium::new));
        registry.register("MediumInterface", new MediumInterfaceDirectiveHandler());

        return registry;
    }
}
