package org.pbrtscene.loader.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pbrtscene.loader.api.SceneErrorCode;
import org.pbrtscene.loader.api.SceneLoadException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for token validation and value coercion.
 */
public class TokenTest {

    private static Token token(String text) {
        TokenType type = text.startsWith("\"") ? TokenType.STRING : TokenType.WORD;
        return new Token(type, text, 3, 7, "test.pbrt");
    }

    @Test
    @Tag("unit")
    void testValidity() {
        assertThat(token("Shape").isValid()).isTrue();
        assertThat(token("\"a b\"").isValid()).isTrue();
        assertThat(token("\"\"").isValid()).isTrue();
        assertThat(token("\"").isValid()).isFalse();
        assertThat(token("\"open").isValid()).isFalse();
        assertThat(token("close\"").isValid()).isFalse();
        assertThat(token("").isValid()).isFalse();
    }

    @Test
    @Tag("unit")
    void testUnquote() throws SceneLoadException {
        assertThat(token("\"sphere\"").unquote()).isEqualTo("sphere");
        assertThat(token("\"\"").unquote()).isEmpty();

        assertThatThrownBy(() -> token("sphere").unquote())
                .isInstanceOf(SceneLoadException.class)
                .extracting(e -> ((SceneLoadException) e).getErrorCode())
                .isEqualTo(SceneErrorCode.INVALID_STRING);
    }

    @Test
    @Tag("unit")
    void testNumbers() throws SceneLoadException {
        assertThat(token("1.5").parseFloat()).isEqualTo(1.5f);
        assertThat(token("-3").parseFloat()).isEqualTo(-3.0f);
        assertThat(token("42").parseInt()).isEqualTo(42);

        assertThatThrownBy(() -> token("1.5").parseInt())
                .isInstanceOf(SceneLoadException.class)
                .extracting(e -> ((SceneLoadException) e).getErrorCode())
                .isEqualTo(SceneErrorCode.INVALID_NUMBER);
        assertThatThrownBy(() -> token("abc").parseFloat())
                .isInstanceOf(SceneLoadException.class)
                .extracting(e -> ((SceneLoadException) e).getErrorCode())
                .isEqualTo(SceneErrorCode.INVALID_NUMBER);
    }

    @Test
    @Tag("unit")
    void testFloatsAcceptPlainDecimalForms() throws SceneLoadException {
        assertThat(token("+2").parseFloat()).isEqualTo(2f);
        assertThat(token(".5").parseFloat()).isEqualTo(0.5f);
        assertThat(token("3.").parseFloat()).isEqualTo(3f);
        assertThat(token("1e3").parseFloat()).isEqualTo(1000f);
        assertThat(token("-2.5E-1").parseFloat()).isEqualTo(-0.25f);
    }

    /**
     * Verifies that number forms which only Java's own literal syntax knows are not taken as floats.
     */
    @Test
    @Tag("unit")
    void testFloatsRejectJavaLiteralForms() {
        for (String text : new String[] {"1f", "1F", "1d", "2.5D", "0x1p3", "NaN", "Infinity", "1e", "."}) {
            assertThatThrownBy(() -> token(text).parseFloat())
                    .as(text)
                    .isInstanceOf(SceneLoadException.class)
                    .extracting(e -> ((SceneLoadException) e).getErrorCode())
                    .isEqualTo(SceneErrorCode.INVALID_NUMBER);
        }
    }

    /**
     * Verifies that booleans may be written bare or quoted.
     */
    @Test
    @Tag("unit")
    void testBooleans() throws SceneLoadException {
        assertThat(token("true").parseBoolean()).isTrue();
        assertThat(token("\"false\"").parseBoolean()).isFalse();

        assertThatThrownBy(() -> token("yes").parseBoolean())
                .isInstanceOf(SceneLoadException.class)
                .extracting(e -> ((SceneLoadException) e).getErrorCode())
                .isEqualTo(SceneErrorCode.INVALID_BOOLEAN);
    }

    @Test
    @Tag("unit")
    void testErrorsCarryTokenLocation() {
        assertThatThrownBy(() -> token("x").parseFloat())
                .isInstanceOf(SceneLoadException.class)
                .satisfies(e -> {
                    SceneLoadException sle = (SceneLoadException) e;
                    assertThat(sle.getSourceInfo().fileName()).isEqualTo("test.pbrt");
                    assertThat(sle.getSourceInfo().lineNumber()).isEqualTo(3);
                    assertThat(sle.getSourceInfo().columnNumber()).isEqualTo(7);
                    assertThat(sle.getMessage()).startsWith("[INVALID_NUMBER]").contains("test.pbrt:3:7");
                });
    }
}
