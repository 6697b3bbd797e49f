package org.pbrtscene.loader.frontend.param;

import java.util.Optional;

/**
 * The fixed vocabulary of parameter type keywords.
 * The type selects the value container of a {@link Param}; see {@link #valueKind()}.
 */
public enum ParamType {
    BOOLEAN("bool"),
    FLOAT("float"),
    INTEGER("integer"),
    POINT2("point2"),
    POINT3("point3"),
    VECTOR2("vector2"),
    VECTOR3("vector3"),
    NORMAL3("normal3"),
    SPECTRUM("spectrum"),
    RGB("rgb"),
    BLACKBODY("blackbody"),
    STRING("string"),
    TEXTURE("texture");

    /**
     * The four value containers a parameter can hold.
     */
    public enum ValueKind { FLOATS, INTEGERS, STRINGS, BOOLEANS }

    private final String keyword;

    ParamType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return The keyword used for this type in scene files.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Returns the container kind for this type. Composite geometric types and colors are stored as
     * flat float sequences; their element count is checked by the entity factory, not here.
     *
     * @return The value container kind.
     */
    public ValueKind valueKind() {
        return switch (this) {
            case BOOLEAN -> ValueKind.BOOLEANS;
            case INTEGER, BLACKBODY -> ValueKind.INTEGERS;
            case STRING, TEXTURE -> ValueKind.STRINGS;
            default -> ValueKind.FLOATS;
        };
    }

    /**
     * Looks up a type by its keyword.
     * @param keyword The keyword, e.g. "float".
     * @return The type, or empty if the keyword is not part of the vocabulary.
     */
    public static Optional<ParamType> fromKeyword(String keyword) {
        for (ParamType type : values()) {
            if (type.keyword.equals(keyword)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
