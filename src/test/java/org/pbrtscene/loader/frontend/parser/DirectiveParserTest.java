package org.pbrtscene.loader.frontend.parser;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pbrtscene.loader.api.SceneErrorCode;
import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.directive.Directive;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link DirectiveParser}.
 * Each test parses a small in-memory buffer and checks the resulting directive records or error codes.
 */
public class DirectiveParserTest {

    private static List<Directive> parseAll(String source) throws SceneLoadException {
        DirectiveParser parser = new DirectiveParser(source);
        List<Directive> directives = new ArrayList<>();
        Optional<Directive> next;
        while ((next = parser.parseNext()).isPresent()) {
            directives.add(next.get());
        }
        return directives;
    }

    private static SceneErrorCode errorOf(String source) {
        try {
            parseAll(source);
        } catch (SceneLoadException e) {
            return e.getErrorCode();
        }
        throw new AssertionError("Expected a SceneLoadException for: " + source);
    }

    @Test
    @Tag("unit")
    void testEmptyInputIsExhaustedImmediately() throws SceneLoadException {
        assertThat(new DirectiveParser("# only a comment\n").parseNext()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testTransformDirectives() throws SceneLoadException {
        List<Directive> directives = parseAll(String.join("\n",
                "Identity",
                "Translate 1 2 3",
                "Scale 2 2 2",
                "Rotate 90 0 0 1",
                "LookAt 0 0 5  0 0 0  0 1 0",
                "ConcatTransform [1 0 0 0 0 1 0 0 0 0 1 0 0 0 0 1]",
                "ReverseOrientation"));

        assertThat(directives).hasSize(7);
        assertThat(directives.get(0)).isInstanceOf(Directive.Identity.class);
        assertThat(directives.get(1)).isEqualTo(new Directive.Translate(1, 2, 3));
        assertThat(directives.get(3)).isEqualTo(new Directive.Rotate(90, 0, 0, 1));
        assertThat(directives.get(4)).isEqualTo(new Directive.LookAt(0, 0, 5, 0, 0, 0, 0, 1, 0));
        assertThat(((Directive.ConcatTransform) directives.get(5)).matrix()).hasSize(16);
        assertThat(directives.get(6)).isInstanceOf(Directive.ReverseOrientation.class);
    }

    /**
     * Verifies the resource grammar: a quoted type, then a greedy list of parameters, each with either a
     * bare value or a bracketed list.
     */
    @Test
    @Tag("unit")
    void testShapeWithParameters() throws SceneLoadException {
        List<Directive> directives = parseAll(
                "Shape \"trianglemesh\" \"point3 P\" [0 0 0 1 0 0 0 1 0] \"integer indices\" [0 1 2]\n"
                        + "\"float alpha\" 0.5\nWorldBegin");

        assertThat(directives).hasSize(2);
        Directive.Shape shape = (Directive.Shape) directives.get(0);
        assertThat(shape.type()).isEqualTo("trianglemesh");
        assertThat(shape.params().names()).containsExactlyInAnyOrder("P", "indices", "alpha");
        assertThat(shape.params().integers("indices")).hasValueSatisfying(v -> assertThat(v).containsExactly(0, 1, 2));
        assertThat(shape.params().getFloat("alpha", 1f)).isEqualTo(0.5f);
        assertThat(directives.get(1)).isInstanceOf(Directive.WorldBegin.class);
    }

    @Test
    @Tag("unit")
    void testNamedAndTextureDirectives() throws SceneLoadException {
        List<Directive> directives = parseAll(String.join("\n",
                "MakeNamedMaterial \"gold\" \"string type\" \"conductor\"",
                "NamedMaterial \"gold\"",
                "Texture \"checks\" \"spectrum\" \"checkerboard\" \"float uscale\" [8]",
                "MediumInterface \"fog\"",
                "MediumInterface \"inside\" \"outside\"",
                "CoordinateSystem \"here\"",
                "Option \"bool disablepixeljitter\" true",
                "ColorSpace \"aces2065-1\""));

        Directive.MakeNamedMaterial material = (Directive.MakeNamedMaterial) directives.get(0);
        assertThat(material.name()).isEqualTo("gold");
        assertThat(material.params().getString("type", "")).isEqualTo("conductor");
        assertThat(directives.get(1)).isEqualTo(new Directive.NamedMaterial("gold"));
        Directive.Texture texture = (Directive.Texture) directives.get(2);
        assertThat(texture).extracting(Directive.Texture::name, Directive.Texture::valueType,
                Directive.Texture::textureClass).containsExactly("checks", "spectrum", "checkerboard");
        assertThat(directives.get(3)).isEqualTo(new Directive.MediumInterface("fog", "fog"));
        assertThat(directives.get(4)).isEqualTo(new Directive.MediumInterface("inside", "outside"));
        assertThat(directives.get(5)).isEqualTo(new Directive.CoordinateSystem("here"));
        assertThat(((Directive.Option) directives.get(6)).param().name()).isEqualTo("disablepixeljitter");
        assertThat(directives.get(7)).isEqualTo(new Directive.ColorSpace("aces2065-1"));
    }

    @Test
    @Tag("unit")
    void testLastKeywordLocatesTheDirective() throws SceneLoadException {
        DirectiveParser parser = new DirectiveParser("WorldBegin\n  AttributeBegin");

        parser.parseNext();
        parser.parseNext();

        assertThat(parser.lastKeyword().text()).isEqualTo("AttributeBegin");
        assertThat(parser.lastKeyword().line()).isEqualTo(2);
        assertThat(parser.lastKeyword().column()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void testErrorCodes() {
        assertThat(errorOf("Frobnicate 1 2 3")).isEqualTo(SceneErrorCode.UNKNOWN_DIRECTIVE);
        assertThat(errorOf("\"sphere\"")).isEqualTo(SceneErrorCode.UNKNOWN_DIRECTIVE);
        assertThat(errorOf("Translate 1 2")).isEqualTo(SceneErrorCode.UNEXPECTED_END_OF_STREAM);
        assertThat(errorOf("Translate 1 x 2")).isEqualTo(SceneErrorCode.INVALID_NUMBER);
        assertThat(errorOf("Shape sphere")).isEqualTo(SceneErrorCode.INVALID_STRING);
        assertThat(errorOf("Shape \"sphere")).isEqualTo(SceneErrorCode.INVALID_STRING);
        assertThat(errorOf("Shape \"sphere\" \"float radius\" ]")).isEqualTo(SceneErrorCode.UNEXPECTED_TOKEN);
        assertThat(errorOf("Shape \"sphere\" \"float radius\" [1\nWorldBegin"))
                .isEqualTo(SceneErrorCode.UNEXPECTED_TOKEN);
        assertThat(errorOf("Shape \"sphere\" \"float radius\" [1] \"float radius\" [2]"))
                .isEqualTo(SceneErrorCode.DUPLICATE_PARAMETER);
        assertThat(errorOf("Shape \"sphere\" \"colour Kd\" [1]")).isEqualTo(SceneErrorCode.INVALID_PARAM_TYPE);
        assertThat(errorOf("Shape \"sphere\" \"radius\" [1]")).isEqualTo(SceneErrorCode.INVALID_PARAM_NAME);
        assertThat(errorOf("Transform [1 0 0 0]")).isEqualTo(SceneErrorCode.INVALID_NUMBER);
    }
}
