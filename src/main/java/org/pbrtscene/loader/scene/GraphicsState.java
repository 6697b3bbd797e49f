package org.pbrtscene.loader.scene;

import org.joml.Matrix4f;
import org.pbrtscene.loader.frontend.param.ParamList;

import java.util.EnumMap;
import java.util.Map;

/**
 * The scope-restorable part of the builder's state. {@code AttributeBegin} saves a {@link #copy()},
 * {@code AttributeEnd} restores it.
 */
final class GraphicsState {

    private boolean reverseOrientation;
    private final Matrix4f transform;
    private String interiorMedium;
    private String exteriorMedium;
    private Integer materialIndex;
    private Integer areaLightIndex;
    private final Map<AttributeTarget, ParamList> attributes;

    GraphicsState() {
        this.transform = new Matrix4f();
        this.attributes = new EnumMap<>(AttributeTarget.class);
        for (AttributeTarget target : AttributeTarget.values()) {
            attributes.put(target, new ParamList());
        }
    }

    private GraphicsState(GraphicsState other) {
        this.reverseOrientation = other.reverseOrientation;
        this.transform = new Matrix4f(other.transform);
        this.interiorMedium = other.interiorMedium;
        this.exteriorMedium = other.exteriorMedium;
        this.materialIndex = other.materialIndex;
        this.areaLightIndex = other.areaLightIndex;
        this.attributes = new EnumMap<>(AttributeTarget.class);
        other.attributes.forEach((target, params) -> attributes.put(target, params.copy()));
    }

    /**
     * @return A deep copy; nothing is shared with this state.
     */
    GraphicsState copy() {
        return new GraphicsState(this);
    }

    /**
     * @return The live current transform. Callers mutate it in place.
     */
    Matrix4f transform() {
        return transform;
    }

    boolean reverseOrientation() {
        return reverseOrientation;
    }

    void toggleReverseOrientation() {
        reverseOrientation = !reverseOrientation;
    }

    String interiorMedium() {
        return interiorMedium;
    }

    String exteriorMedium() {
        return exteriorMedium;
    }

    void setMediumInterface(String interior, String exterior) {
        this.interiorMedium = interior;
        this.exteriorMedium = exterior;
    }

    Integer materialIndex() {
        return materialIndex;
    }

    void setMaterialIndex(Integer materialIndex) {
        this.materialIndex = materialIndex;
    }

    Integer areaLightIndex() {
        return areaLightIndex;
    }

    void setAreaLightIndex(Integer areaLightIndex) {
        this.areaLightIndex = areaLightIndex;
    }

    /**
     * @return The live inherited parameter table of {@code target}.
     */
    ParamList attributes(AttributeTarget target) {
        return attributes.get(target);
    }
}
