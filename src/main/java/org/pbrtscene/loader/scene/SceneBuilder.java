package org.pbrtscene.loader.scene;

import org.joml.Matrix4f;
import org.joml.Vector3f;
import org.pbrtscene.loader.api.SceneErrorCode;
import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.directive.Directive;
import org.pbrtscene.loader.frontend.param.ParamList;
import org.pbrtscene.loader.scene.types.Accelerator;
import org.pbrtscene.loader.scene.types.AreaLight;
import org.pbrtscene.loader.scene.types.Camera;
import org.pbrtscene.loader.scene.types.DefaultSceneEntityFactory;
import org.pbrtscene.loader.scene.types.Film;
import org.pbrtscene.loader.scene.types.Filter;
import org.pbrtscene.loader.scene.types.ISceneEntityFactory;
import org.pbrtscene.loader.scene.types.Integrator;
import org.pbrtscene.loader.scene.types.Light;
import org.pbrtscene.loader.scene.types.Material;
import org.pbrtscene.loader.scene.types.Medium;
import org.pbrtscene.loader.scene.types.Sampler;
import org.pbrtscene.loader.scene.types.Shape;
import org.pbrtscene.loader.scene.types.Texture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The graphics-state machine that turns a stream of directives into a {@link Scene}.
 * <p>
 * Directives are accepted in any order: header directives after {@code WorldBegin} and world
 * directives before it are applied as written. Transform directives right-multiply the current
 * transform, so each new operation is expressed in the current local frame.
 * <p>
 * {@code Include} is not handled here; the loader resolves it by pushing a new parser frame.
 * A builder is single-use and not thread-safe.
 */
public class SceneBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(SceneBuilder.class);

    public static final String CAMERA_COORDINATE_SYSTEM = "camera";
    public static final String WORLD_COORDINATE_SYSTEM = "world";

    private final ISceneEntityFactory factory;

    private GraphicsState state = new GraphicsState();
    private final Deque<GraphicsState> stateStack = new ArrayDeque<>();
    private final Map<String, Matrix4f> namedCoordinateSystems = new HashMap<>();
    private boolean worldBegun;

    private final Options options = new Options();
    private CameraEntity camera;
    private Film film;
    private Sampler sampler;
    private Integrator integrator;
    private Accelerator accelerator;
    private Filter filter;

    private final NamedRegistry<TextureEntity> textures = new NamedRegistry<>();
    private final NamedRegistry<Material> materials = new NamedRegistry<>();
    private final NamedRegistry<MediumEntity> mediums = new NamedRegistry<>();
    private final List<LightEntity> lights = new ArrayList<>();
    private final List<AreaLight> areaLights = new ArrayList<>();
    private final List<ShapeEntity> shapes = new ArrayList<>();

    /**
     * Creates a builder that converts resources with a {@link DefaultSceneEntityFactory}.
     */
    public SceneBuilder() {
        this(new DefaultSceneEntityFactory());
    }

    /**
     * @param factory Converts (type, merged parameters) into typed entities.
     */
    public SceneBuilder(ISceneEntityFactory factory) {
        this.factory = factory;
    }

    /**
     * Applies one directive to the current state.
     * @param directive The directive. Must not be an {@link Directive.Include}.
     * @throws SceneLoadException if the directive is unsupported or cannot be applied.
     */
    public void apply(Directive directive) throws SceneLoadException {
        LOG.trace("Applying {}", directive);

        // Transforms
        if (directive instanceof Directive.Identity) {
            state.transform().identity();
        } else if (directive instanceof Directive.Translate t) {
            state.transform().translate(t.x(), t.y(), t.z());
        } else if (directive instanceof Directive.Scale s) {
            state.transform().scale(s.x(), s.y(), s.z());
        } else if (directive instanceof Directive.Rotate r) {
            state.transform().mul(Transforms.rotation(r.angle(), r.x(), r.y(), r.z()));
        } else if (directive instanceof Directive.LookAt l) {
            state.transform().mul(Transforms.lookAt(
                    new Vector3f(l.eyeX(), l.eyeY(), l.eyeZ()),
                    new Vector3f(l.lookX(), l.lookY(), l.lookZ()),
                    new Vector3f(l.upX(), l.upY(), l.upZ())));
        } else if (directive instanceof Directive.Transform t) {
            state.transform().set(Transforms.fromColumnMajor(t.matrix()));
        } else if (directive instanceof Directive.ConcatTransform c) {
            state.transform().mul(Transforms.fromColumnMajor(c.matrix()));
        } else if (directive instanceof Directive.CoordinateSystem c) {
            namedCoordinateSystems.put(c.name(), new Matrix4f(state.transform()));
        } else if (directive instanceof Directive.CoordSysTransform c) {
            Matrix4f named = namedCoordinateSystems.get(c.name());
            if (named == null) {
                throw new SceneLoadException(SceneErrorCode.UNKNOWN_COORDINATE_SYSTEM,
                        "Unknown coordinate system '" + c.name() + "'");
            }
            state.transform().set(named);
        } else if (directive instanceof Directive.ReverseOrientation) {
            state.toggleReverseOrientation();

        // Scope
        } else if (directive instanceof Directive.WorldBegin) {
            worldBegin();
        } else if (directive instanceof Directive.AttributeBegin) {
            stateStack.push(state.copy());
        } else if (directive instanceof Directive.AttributeEnd) {
            if (stateStack.isEmpty()) {
                throw new SceneLoadException(SceneErrorCode.UNBALANCED_ATTRIBUTES,
                        "AttributeEnd without matching AttributeBegin");
            }
            state = stateStack.pop();
        } else if (directive instanceof Directive.Attribute a) {
            AttributeTarget target = AttributeTarget.fromKeyword(a.target())
                    .orElseThrow(() -> new SceneLoadException(SceneErrorCode.UNKNOWN_ATTRIBUTE_TARGET,
                            "Unknown attribute target '" + a.target() + "'"));
            state.attributes(target).merge(a.params());

        // Options and header resources
        } else if (directive instanceof Directive.Option o) {
            options.apply(o.param());
        } else if (directive instanceof Directive.ColorSpace c) {
            options.setColorSpace(c.name());
        } else if (directive instanceof Directive.Camera c) {
            camera(c);
        } else if (directive instanceof Directive.Film f) {
            film = factory.createFilm(f.type(), f.params());
        } else if (directive instanceof Directive.Sampler s) {
            sampler = factory.createSampler(s.type(), s.params());
        } else if (directive instanceof Directive.Integrator i) {
            integrator = factory.createIntegrator(i.type(), i.params());
        } else if (directive instanceof Directive.Accelerator a) {
            accelerator = factory.createAccelerator(a.type(), a.params());
        } else if (directive instanceof Directive.PixelFilter p) {
            filter = factory.createFilter(p.type(), p.params());

        // World resources
        } else if (directive instanceof Directive.Shape s) {
            shape(s);
        } else if (directive instanceof Directive.LightSource l) {
            Light light = factory.createLight(l.type(), inherit(l.params(), AttributeTarget.LIGHT));
            lights.add(new LightEntity(light, state.transform(),
                    mediumIndex(state.exteriorMedium())));
        } else if (directive instanceof Directive.AreaLightSource a) {
            AreaLight areaLight = factory.createAreaLight(a.type(), inherit(a.params(), AttributeTarget.LIGHT));
            areaLights.add(areaLight);
            state.setAreaLightIndex(areaLights.size() - 1);
        } else if (directive instanceof Directive.Material m) {
            Material material = factory.createMaterial(m.type(),
                    inherit(m.params(), AttributeTarget.MATERIAL), textures.names());
            state.setMaterialIndex(materials.add(material));
        } else if (directive instanceof Directive.MakeNamedMaterial m) {
            makeNamedMaterial(m);
        } else if (directive instanceof Directive.NamedMaterial n) {
            namedMaterial(n);
        } else if (directive instanceof Directive.Texture t) {
            Texture texture = factory.createTexture(t.name(), t.valueType(), t.textureClass(),
                    inherit(t.params(), AttributeTarget.TEXTURE), textures.names());
            textures.add(t.name(), new TextureEntity(texture, state.transform()));
        } else if (directive instanceof Directive.MakeNamedMedium m) {
            makeNamedMedium(m);
        } else if (directive instanceof Directive.MediumInterface m) {
            state.setMediumInterface(m.interior(), m.exterior());

        // Not supported
        } else if (directive instanceof Directive.Import
                || directive instanceof Directive.TransformTimes
                || directive instanceof Directive.ActiveTransform
                || directive instanceof Directive.ObjectBegin
                || directive instanceof Directive.ObjectEnd
                || directive instanceof Directive.ObjectInstance) {
            throw new SceneLoadException(SceneErrorCode.UNSUPPORTED_DIRECTIVE,
                    directive.getClass().getSimpleName() + " is not supported");
        } else if (directive instanceof Directive.Include) {
            throw new IllegalArgumentException("Include must be resolved by the loader");
        } else {
            throw new IllegalStateException("Unhandled directive type: " + directive.getClass().getName());
        }
    }

    /**
     * Finishes the load.
     * @return The scene.
     * @throws SceneLoadException if no {@code WorldBegin} was seen or an attribute scope is still open.
     */
    public Scene build() throws SceneLoadException {
        if (!stateStack.isEmpty()) {
            throw new SceneLoadException(SceneErrorCode.UNBALANCED_ATTRIBUTES,
                    stateStack.size() + " AttributeBegin without matching AttributeEnd at end of input");
        }
        if (!worldBegun) {
            throw new SceneLoadException(SceneErrorCode.MISSING_WORLD_BEGIN, "No WorldBegin in scene");
        }
        return new Scene(options, camera, film, sampler, integrator, accelerator, filter,
                textures.entries(), materials.entries(), lights, areaLights, mediums.entries(), shapes,
                textures.names(), materials.names(), mediums.names());
    }

    /**
     * @return A copy of the current transform.
     */
    public Matrix4f currentTransform() {
        return new Matrix4f(state.transform());
    }

    /**
     * @return A copy of the transform recorded under {@code name}, or empty.
     */
    public Optional<Matrix4f> namedCoordinateSystem(String name) {
        return Optional.ofNullable(namedCoordinateSystems.get(name)).map(Matrix4f::new);
    }

    /**
     * @return The number of open attribute scopes.
     */
    public int attributeDepth() {
        return stateStack.size();
    }

    private void worldBegin() throws SceneLoadException {
        if (worldBegun) {
            throw new SceneLoadException(SceneErrorCode.DUPLICATE_WORLD_BEGIN, "WorldBegin appears more than once");
        }
        worldBegun = true;
        state.transform().identity();
        namedCoordinateSystems.put(WORLD_COORDINATE_SYSTEM, new Matrix4f());
    }

    private void camera(Directive.Camera directive) throws SceneLoadException {
        Camera cam = factory.createCamera(directive.type(), directive.params());
        Matrix4f cameraToWorld = new Matrix4f(state.transform()).invert();
        camera = new CameraEntity(cam, cameraToWorld, mediumIndex(state.exteriorMedium()));
        namedCoordinateSystems.put(CAMERA_COORDINATE_SYSTEM, new Matrix4f(cameraToWorld));
    }

    private void shape(Directive.Shape directive) throws SceneLoadException {
        Shape shape = factory.createShape(directive.type(),
                inherit(directive.params(), AttributeTarget.SHAPE), textures.names());
        shapes.add(new ShapeEntity(shape,
                state.transform(),
                state.reverseOrientation(),
                state.materialIndex(),
                state.areaLightIndex(),
                mediumIndex(state.interiorMedium()),
                mediumIndex(state.exteriorMedium())));
    }

    private void makeNamedMaterial(Directive.MakeNamedMaterial directive) throws SceneLoadException {
        ParamList params = inherit(directive.params(), AttributeTarget.MATERIAL);
        String type = params.getString("type")
                .orElseThrow(() -> new SceneLoadException(SceneErrorCode.INVALID_PARAMETER_VALUE,
                        "MakeNamedMaterial '" + directive.name() + "' has no \"string type\" parameter"));
        materials.add(directive.name(), factory.createMaterial(type, params, textures.names()));
    }

    private void namedMaterial(Directive.NamedMaterial directive) {
        Integer index = materials.indexOf(directive.name());
        if (index == null) {
            LOG.debug("Named material '{}' is not defined, using no material", directive.name());
        }
        state.setMaterialIndex(index);
    }

    private void makeNamedMedium(Directive.MakeNamedMedium directive) throws SceneLoadException {
        ParamList params = inherit(directive.params(), AttributeTarget.MEDIUM);
        String type = params.getString("type")
                .orElseThrow(() -> new SceneLoadException(SceneErrorCode.INVALID_PARAMETER_VALUE,
                        "MakeNamedMedium '" + directive.name() + "' has no \"string type\" parameter"));
        Medium medium = factory.createMedium(type, params);
        mediums.add(directive.name(), new MediumEntity(directive.name(), medium, state.transform()));
    }

    private Integer mediumIndex(String name) {
        if (name == null || name.isEmpty()) {
            return null;
        }
        Integer index = mediums.indexOf(name);
        if (index == null) {
            LOG.debug("Medium '{}' is not defined, using no medium", name);
        }
        return index;
    }

    /**
     * Merges inherited attributes into a copy of the directive's parameters.
     * Inherited entries win over the directive's own entries of the same name.
     */
    private ParamList inherit(ParamList own, AttributeTarget target) {
        ParamList merged = own.copy();
        merged.merge(state.attributes(target));
        return merged;
    }
}
