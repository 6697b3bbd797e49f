package org.pbrtscene.loader.scene;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pbrtscene.loader.api.SceneErrorCode;
import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.directive.Directive;
import org.pbrtscene.loader.frontend.param.ParamList;
import org.pbrtscene.loader.frontend.parser.DirectiveParser;
import org.pbrtscene.loader.scene.types.DefaultSceneEntityFactory;
import org.pbrtscene.loader.scene.types.ISceneEntityFactory;
import org.pbrtscene.loader.scene.types.Material;
import org.pbrtscene.loader.scene.types.ShadingInput;
import org.pbrtscene.loader.scene.types.Shape;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests the contract between the {@link SceneBuilder} and its {@link ISceneEntityFactory}:
 * what the builder passes to the factory and how factory failures propagate.
 */
@ExtendWith(MockitoExtension.class)
public class SceneBuilderFactoryTest {

    private static final Shape SPHERE = new Shape.Sphere(new ShadingInput.Constant(1f), 1f, -1f, 1f, 360f);
    private static final Material DIFFUSE = new Material.Diffuse(
            new Material.Surface(null, ""), new ShadingInput.Constant(0.5f));

    @Mock
    private ISceneEntityFactory factory;

    private static void apply(SceneBuilder builder, String... lines) throws SceneLoadException {
        DirectiveParser parser = new DirectiveParser(String.join("\n", lines));
        Optional<Directive> next;
        while ((next = parser.parseNext()).isPresent()) {
            builder.apply(next.get());
        }
    }

    /**
     * Verifies that the factory receives the merged table, not the directive's own table.
     */
    @Test
    @Tag("unit")
    void testFactoryReceivesMergedParameters() throws SceneLoadException {
        // Arrange
        when(factory.createShape(eq("sphere"), any(ParamList.class), anyMap())).thenReturn(SPHERE);
        SceneBuilder builder = new SceneBuilder(factory);

        // Act
        apply(builder, "WorldBegin",
                "Attribute \"shape\" \"float radius\" 3 \"float zmax\" 1",
                "Shape \"sphere\" \"float radius\" 1 \"float phimax\" 90");

        // Assert
        ArgumentCaptor<ParamList> captor = ArgumentCaptor.forClass(ParamList.class);
        verify(factory).createShape(eq("sphere"), captor.capture(), anyMap());
        ParamList passed = captor.getValue();
        assertThat(passed.names()).containsExactlyInAnyOrder("radius", "zmax", "phimax");
        assertThat(passed.getFloat("radius", 0f)).isEqualTo(3f);
        assertThat(builder.build().shapes()).extracting(ShapeEntity::shape).containsExactly(SPHERE);
    }

    /**
     * Verifies that materials see the textures defined so far, by name and index.
     */
    @Test
    @Tag("unit")
    void testMaterialFactorySeesTextureIndices() throws SceneLoadException {
        // Arrange
        when(factory.createMaterial(eq("diffuse"), any(ParamList.class), anyMap())).thenReturn(DIFFUSE);
        SceneBuilder builder = new SceneBuilder(new TexturePassThroughFactory(factory));

        // Act
        apply(builder, "WorldBegin",
                "Texture \"a\" \"float\" \"constant\"",
                "Texture \"b\" \"spectrum\" \"constant\"",
                "Material \"diffuse\"");

        // Assert
        verify(factory).createMaterial(eq("diffuse"), any(ParamList.class), eq(Map.of("a", 0, "b", 1)));
    }

    @Test
    @Tag("unit")
    void testFactoryErrorsPropagate() throws SceneLoadException {
        // Arrange
        when(factory.createLight(eq("laser"), any(ParamList.class)))
                .thenThrow(new SceneLoadException(SceneErrorCode.UNSUPPORTED_TYPE, "Unsupported light type 'laser'"));
        SceneBuilder builder = new SceneBuilder(factory);

        // Act & Assert
        assertThatThrownBy(() -> apply(builder, "WorldBegin", "LightSource \"laser\""))
                .isInstanceOf(SceneLoadException.class)
                .hasMessageContaining("laser")
                .extracting(e -> ((SceneLoadException) e).getErrorCode())
                .isEqualTo(SceneErrorCode.UNSUPPORTED_TYPE);
    }

    /**
     * Delegates to the mock but builds textures for real, so the texture registry fills up.
     */
    private static final class TexturePassThroughFactory extends DefaultSceneEntityFactory {
        private final ISceneEntityFactory materials;

        private TexturePassThroughFactory(ISceneEntityFactory materials) {
            this.materials = materials;
        }

        @Override
        public Material createMaterial(String type, ParamList params, Map<String, Integer> textures)
                throws SceneLoadException {
            return materials.createMaterial(type, params, Map.copyOf(textures));
        }
    }
}
