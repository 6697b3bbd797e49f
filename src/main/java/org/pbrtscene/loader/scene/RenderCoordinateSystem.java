package org.pbrtscene.loader.scene;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The space in which rendering computations take place.
 */
public enum RenderCoordinateSystem {
    /** Translate the scene so that the camera is at the origin. */
    CAMERAWORLD,
    CAMERA,
    WORLD;

    /**
     * @param keyword The value of the {@code rendercoordsys} option, e.g. {@code cameraworld}.
     * @return The matching constant, or empty for an unknown keyword.
     */
    public static Optional<RenderCoordinateSystem> fromKeyword(String keyword) {
        return Arrays.stream(values())
                .filter(v -> v.name().toLowerCase(Locale.ROOT).equals(keyword))
                .findFirst();
    }
}
