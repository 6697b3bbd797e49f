package org.pbrtscene.loader.scene.types;

import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.frontend.param.ParamList;

/**
 * The ray-intersection acceleration structure.
 */
public sealed interface Accelerator {

    record Bvh(int maxNodePrims, String splitMethod) implements Accelerator {}

    record KdTree(int intersectCost, int traversalCost, float emptyBonus, int maxPrims, int maxDepth)
            implements Accelerator {}

    static Accelerator create(String type, ParamList params) throws SceneLoadException {
        return switch (type) {
            case "bvh" -> new Bvh(
                    params.getInteger("maxnodeprims", 4),
                    params.getString("splitmethod", "sah"));
            case "kdtree" -> new KdTree(
                    params.getInteger("intersectcost", 5),
                    params.getInteger("traversalcost", 1),
                    params.getFloat("emptybonus", 0.5f),
                    params.getInteger("maxprims", 1),
                    params.getInteger("maxdepth", -1));
            default -> throw ParamReader.unsupported("accelerator", type);
        };
    }
}
