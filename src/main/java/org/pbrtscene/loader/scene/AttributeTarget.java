package org.pbrtscene.loader.scene;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The categories whose parameters can be inherited through {@code Attribute "<category>" ...}.
 */
public enum AttributeTarget {
    SHAPE,
    LIGHT,
    MATERIAL,
    MEDIUM,
    TEXTURE;

    public static Optional<AttributeTarget> fromKeyword(String keyword) {
        return Arrays.stream(values())
                .filter(v -> v.name().toLowerCase(Locale.ROOT).equals(keyword))
                .findFirst();
    }
}
