package org.pbrtscene.loader.scene;

import org.joml.Matrix4f;
import org.joml.Matrix4fc;
import org.joml.Vector3f;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pbrtscene.loader.api.SceneErrorCode;
import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.directive.Directive;
import org.pbrtscene.loader.frontend.parser.DirectiveParser;
import org.pbrtscene.loader.scene.types.Shape;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Contains unit tests for the {@link SceneBuilder} state machine: transform composition, attribute scopes,
 * named coordinate systems, parameter inheritance and named-resource resolution.
 * Directives are produced by a real {@link DirectiveParser} over in-memory text.
 */
public class SceneBuilderTest {

    private SceneBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new SceneBuilder();
    }

    private void apply(String... lines) throws SceneLoadException {
        DirectiveParser parser = new DirectiveParser(String.join("\n", lines));
        Optional<Directive> next;
        while ((next = parser.parseNext()).isPresent()) {
            builder.apply(next.get());
        }
    }

    private SceneErrorCode errorOf(String... lines) {
        try {
            apply(lines);
            builder.build();
        } catch (SceneLoadException e) {
            return e.getErrorCode();
        }
        throw new AssertionError("Expected a SceneLoadException");
    }

    private static void assertMatrix(Matrix4fc actual, Matrix4fc expected) {
        assertThat(actual.get(new float[16])).containsExactly(expected.get(new float[16]), within(1e-5f));
    }

    /**
     * Verifies that transform directives right-multiply: Translate then Scale yields T·S, not S·T.
     */
    @Test
    @Tag("unit")
    void testTransformsRightMultiply() throws SceneLoadException {
        apply("Translate 1 0 0", "Scale 2 2 2");

        Matrix4f translateThenScale = new Matrix4f().translation(1, 0, 0).mul(new Matrix4f().scaling(2));
        assertMatrix(builder.currentTransform(), translateThenScale);
        // Under T·S the translation is not scaled.
        assertThat(builder.currentTransform().transformPosition(new Vector3f()).x).isEqualTo(1f, within(1e-6f));
    }

    @Test
    @Tag("unit")
    void testTransformReplacesAndConcatTransformMultiplies() throws SceneLoadException {
        apply("Translate 5 5 5",
                "Transform [2 0 0 0  0 2 0 0  0 0 2 0  0 0 0 1]",
                "ConcatTransform [1 0 0 0  0 1 0 0  0 0 1 0  3 0 0 1]");

        Matrix4f expected = new Matrix4f().scaling(2).mul(new Matrix4f().translation(3, 0, 0));
        assertMatrix(builder.currentTransform(), expected);
    }

    @Test
    @Tag("unit")
    void testRotateUsesDegreesAndNormalizesAxis() throws SceneLoadException {
        apply("Rotate 90 0 0 10");

        Vector3f x = builder.currentTransform().transformDirection(new Vector3f(1, 0, 0));
        assertThat(x.x).isEqualTo(0f, within(1e-6f));
        assertThat(x.y).isEqualTo(1f, within(1e-6f));
    }

    /**
     * Verifies that LookAt maps the eye to the camera-space origin and the look point onto the +z axis.
     */
    @Test
    @Tag("unit")
    void testLookAt() throws SceneLoadException {
        apply("LookAt 0 0 5  0 0 0  0 1 0");

        Matrix4f worldToCamera = builder.currentTransform();
        Vector3f eye = worldToCamera.transformPosition(new Vector3f(0, 0, 5));
        Vector3f look = worldToCamera.transformPosition(new Vector3f(0, 0, 0));
        assertThat(eye.length()).isEqualTo(0f, within(1e-5f));
        assertThat(look.x).isEqualTo(0f, within(1e-5f));
        assertThat(look.y).isEqualTo(0f, within(1e-5f));
        assertThat(look.z).isEqualTo(5f, within(1e-5f));
    }

    @Test
    @Tag("unit")
    void testDegenerateLookAtIsRejected() {
        assertThat(errorOf("LookAt 0 0 0  0 0 0  0 1 0")).isEqualTo(SceneErrorCode.INVALID_PARAMETER_VALUE);
        assertThat(errorOf("LookAt 0 0 0  0 1 0  0 1 0")).isEqualTo(SceneErrorCode.INVALID_PARAMETER_VALUE);
    }

    /**
     * Verifies that N nested scopes restore the transform exactly to its value before the first scope.
     */
    @Test
    @Tag("unit")
    void testNestedScopesRestoreTransform() throws SceneLoadException {
        apply("Translate 1 2 3");
        Matrix4f before = builder.currentTransform();

        apply("AttributeBegin", "Scale 3 3 3",
                "AttributeBegin", "Rotate 30 1 1 0",
                "AttributeBegin", "Translate -4 0 1",
                "AttributeEnd", "AttributeEnd", "AttributeEnd");

        assertThat(builder.currentTransform()).isEqualTo(before);
        assertThat(builder.attributeDepth()).isZero();
    }

    @Test
    @Tag("unit")
    void testUnbalancedScopes() {
        assertThat(errorOf("WorldBegin", "AttributeEnd")).isEqualTo(SceneErrorCode.UNBALANCED_ATTRIBUTES);
        setUp();
        assertThat(errorOf("WorldBegin", "AttributeBegin", "AttributeBegin", "AttributeEnd"))
                .isEqualTo(SceneErrorCode.UNBALANCED_ATTRIBUTES);
    }

    @Test
    @Tag("unit")
    void testWorldBeginChecks() throws SceneLoadException {
        assertThat(errorOf("Shape \"sphere\"")).isEqualTo(SceneErrorCode.MISSING_WORLD_BEGIN);
        setUp();
        assertThat(errorOf("WorldBegin", "WorldBegin")).isEqualTo(SceneErrorCode.DUPLICATE_WORLD_BEGIN);

        setUp();
        apply("Translate 1 1 1", "WorldBegin");
        assertMatrix(builder.currentTransform(), new Matrix4f());
        assertThat(builder.namedCoordinateSystem(SceneBuilder.WORLD_COORDINATE_SYSTEM)).contains(new Matrix4f());
    }

    /**
     * Verifies that CoordSysTransform restores exactly the transform recorded by CoordinateSystem.
     */
    @Test
    @Tag("unit")
    void testCoordinateSystemRoundTrip() throws SceneLoadException {
        apply("Translate 1 2 3", "Rotate 45 0 1 0", "CoordinateSystem \"x\"");
        Matrix4f named = builder.currentTransform();

        apply("Scale 7 7 7", "Translate 9 9 9", "Identity", "CoordSysTransform \"x\"");

        assertThat(builder.currentTransform()).isEqualTo(named);
    }

    /**
     * Verifies the camera registers camera-to-world, the inverse of the transform at the directive,
     * both on the scene and as the "camera" coordinate system.
     */
    @Test
    @Tag("unit")
    void testCameraRegistersInverseTransform() throws SceneLoadException {
        apply("Translate 0 0 5", "Camera \"perspective\" \"float fov\" 45", "WorldBegin");
        Scene scene = builder.build();

        Matrix4f expected = new Matrix4f().translation(0, 0, -5);
        assertThat(scene.camera()).isNotNull();
        assertMatrix(scene.camera().cameraToWorld(), expected);
        assertMatrix(builder.namedCoordinateSystem(SceneBuilder.CAMERA_COORDINATE_SYSTEM).orElseThrow(), expected);

        apply("CoordSysTransform \"camera\"");
        assertMatrix(builder.currentTransform(), expected);
    }

    /**
     * Verifies that an inherited attribute parameter wins over the directive's own parameter of the same name,
     * and that inheritance ends with the scope.
     */
    @Test
    @Tag("unit")
    void testInheritedParametersWin() throws SceneLoadException {
        apply("WorldBegin",
                "AttributeBegin",
                "  Attribute \"shape\" \"float radius\" [2]",
                "  Shape \"sphere\" \"float radius\" [1]",
                "AttributeEnd",
                "Shape \"sphere\" \"float radius\" [1]");
        Scene scene = builder.build();

        assertThat(scene.shapes()).hasSize(2);
        assertThat(((Shape.Sphere) scene.shapes().get(0).shape()).radius()).isEqualTo(2f);
        assertThat(((Shape.Sphere) scene.shapes().get(1).shape()).radius()).isEqualTo(1f);
    }

    @Test
    @Tag("unit")
    void testUnknownAttributeTarget() {
        assertThat(errorOf("WorldBegin", "Attribute \"camera\" \"float fov\" 30"))
                .isEqualTo(SceneErrorCode.UNKNOWN_ATTRIBUTE_TARGET);
    }

    @Test
    @Tag("unit")
    void testNamedMaterialsResolveToIndices() throws SceneLoadException {
        apply("WorldBegin",
                "MakeNamedMaterial \"a\" \"string type\" \"diffuse\"",
                "MakeNamedMaterial \"b\" \"string type\" \"dielectric\"",
                "NamedMaterial \"a\"",
                "Shape \"sphere\"",
                "NamedMaterial \"b\"",
                "Shape \"sphere\"");
        Scene scene = builder.build();

        assertThat(scene.shapes()).extracting(ShapeEntity::materialIndex).containsExactly(0, 1);
        assertThat(scene.namedMaterials()).containsEntry("a", 0).containsEntry("b", 1);
    }

    /**
     * Verifies the deliberate asymmetry: an unknown material name silently means "no material",
     * while an unknown coordinate system name is an error.
     */
    @Test
    @Tag("unit")
    void testUnknownNameAsymmetry() throws SceneLoadException {
        apply("WorldBegin", "Material \"diffuse\"", "NamedMaterial \"missing\"", "Shape \"sphere\"");
        assertThat(builder.build().shapes().get(0).materialIndex()).isNull();

        setUp();
        assertThat(errorOf("WorldBegin", "CoordSysTransform \"missing\""))
                .isEqualTo(SceneErrorCode.UNKNOWN_COORDINATE_SYSTEM);
    }

    @Test
    @Tag("unit")
    void testMaterialSetsCurrentMaterialAndScopeRestoresIt() throws SceneLoadException {
        apply("WorldBegin",
                "Material \"diffuse\"",
                "AttributeBegin",
                "  Material \"conductor\"",
                "  Shape \"sphere\"",
                "AttributeEnd",
                "Shape \"sphere\"");
        Scene scene = builder.build();

        assertThat(scene.materials()).hasSize(2);
        assertThat(scene.shapes()).extracting(ShapeEntity::materialIndex).containsExactly(1, 0);
    }

    @Test
    @Tag("unit")
    void testShapeBackReferences() throws SceneLoadException {
        apply("WorldBegin",
                "MakeNamedMedium \"fog\" \"string type\" \"homogeneous\"",
                "AttributeBegin",
                "  AreaLightSource \"diffuse\" \"rgb L\" [4 4 4]",
                "  ReverseOrientation",
                "  MediumInterface \"fog\" \"\"",
                "  Shape \"disk\"",
                "AttributeEnd",
                "Shape \"sphere\"");
        Scene scene = builder.build();

        ShapeEntity emitter = scene.shapes().get(0);
        assertThat(emitter.areaLightIndex()).isEqualTo(0);
        assertThat(emitter.reverseOrientation()).isTrue();
        assertThat(emitter.interiorMediumIndex()).isEqualTo(0);
        assertThat(emitter.exteriorMediumIndex()).isNull();

        ShapeEntity plain = scene.shapes().get(1);
        assertThat(plain.areaLightIndex()).isNull();
        assertThat(plain.reverseOrientation()).isFalse();
        assertThat(plain.interiorMediumIndex()).isNull();
        assertThat(scene.areaLights()).hasSize(1);
        assertThat(scene.mediums()).extracting(MediumEntity::name).containsExactly("fog");
    }

    @Test
    @Tag("unit")
    void testLightsCaptureTransformAndMedium() throws SceneLoadException {
        apply("WorldBegin",
                "MakeNamedMedium \"air\" \"string type\" \"homogeneous\"",
                "MediumInterface \"air\"",
                "Translate 0 3 0",
                "LightSource \"point\" \"rgb I\" [1 1 1]");
        Scene scene = builder.build();

        assertThat(scene.lights()).hasSize(1);
        assertThat(scene.lights().get(0).mediumIndex()).isEqualTo(0);
        assertMatrix(scene.lights().get(0).lightToWorld(), new Matrix4f().translation(0, 3, 0));
    }

    @Test
    @Tag("unit")
    void testTexturesAreRegisteredByName() throws SceneLoadException {
        apply("WorldBegin",
                "Texture \"checks\" \"spectrum\" \"checkerboard\"",
                "Material \"diffuse\" \"texture reflectance\" \"checks\"");
        Scene scene = builder.build();

        assertThat(scene.namedTextures()).containsEntry("checks", 0);
        assertThat(scene.textures().get(0).texture().name()).isEqualTo("checks");
    }

    @Test
    @Tag("unit")
    void testOptions() throws SceneLoadException {
        apply("Option \"string rendercoordsys\" \"world\"",
                "Option \"bool disablepixeljitter\" true",
                "Option \"integer seed\" 7",
                "ColorSpace \"rec2020\"",
                "WorldBegin");
        Options options = builder.build().options();

        assertThat(options.getRenderCoordSys()).isEqualTo(RenderCoordinateSystem.WORLD);
        assertThat(options.isDisablePixelJitter()).isTrue();
        assertThat(options.getSeed()).isEqualTo(7);
        assertThat(options.getColorSpace()).isEqualTo("rec2020");
        assertThat(options.getDisplacementEdgeScale()).isEqualTo(1f);
    }

    @Test
    @Tag("unit")
    void testOptionErrors() {
        assertThat(errorOf("Option \"bool nosuchoption\" true")).isEqualTo(SceneErrorCode.UNKNOWN_OPTION);
        setUp();
        assertThat(errorOf("Option \"string rendercoordsys\" \"screen\""))
                .isEqualTo(SceneErrorCode.INVALID_OPTION_VALUE);
        setUp();
        assertThat(errorOf("Option \"float seed\" 1.5")).isEqualTo(SceneErrorCode.INVALID_OPTION_VALUE);
    }

    @Test
    @Tag("unit")
    void testUnsupportedDirectivesFailFast() {
        assertThat(errorOf("Import \"geometry.pbrt\"")).isEqualTo(SceneErrorCode.UNSUPPORTED_DIRECTIVE);
        setUp();
        assertThat(errorOf("TransformTimes 0 1")).isEqualTo(SceneErrorCode.UNSUPPORTED_DIRECTIVE);
        setUp();
        assertThat(errorOf("ActiveTransform StartTime")).isEqualTo(SceneErrorCode.UNSUPPORTED_DIRECTIVE);
        setUp();
        assertThat(errorOf("WorldBegin", "ObjectBegin \"tree\"")).isEqualTo(SceneErrorCode.UNSUPPORTED_DIRECTIVE);
    }

    @Test
    @Tag("unit")
    void testUnknownResourceTypeIsUnsupported() {
        assertThat(errorOf("WorldBegin", "Shape \"teapot\"")).isEqualTo(SceneErrorCode.UNSUPPORTED_TYPE);
        setUp();
        assertThat(errorOf("WorldBegin", "MakeNamedMaterial \"m\" \"float roughness\" 0.1"))
                .isEqualTo(SceneErrorCode.INVALID_PARAMETER_VALUE);
    }

    /**
     * Verifies that a built scene keeps no reference to the builder's transform, so later directives
     * and callers holding the original matrix cannot change it.
     */
    @Test
    @Tag("unit")
    void testEntitiesCopyTheirTransform() throws SceneLoadException {
        apply("WorldBegin", "Translate 1 0 0", "Shape \"sphere\"", "LightSource \"point\"", "Translate 5 0 0");
        Scene scene = builder.build();

        assertMatrix(scene.shapes().get(0).objectToWorld(), new Matrix4f().translation(1, 0, 0));
        assertMatrix(scene.lights().get(0).lightToWorld(), new Matrix4f().translation(1, 0, 0));

        Matrix4f source = new Matrix4f().translation(0, 4, 0);
        ShapeEntity entity = new ShapeEntity(scene.shapes().get(0).shape(), source, false, null, null, null, null);
        source.identity();
        assertMatrix(entity.objectToWorld(), new Matrix4f().translation(0, 4, 0));
    }
}
