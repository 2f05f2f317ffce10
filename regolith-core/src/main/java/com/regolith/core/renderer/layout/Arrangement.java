package com.regolith.core.renderer.layout;

import java.util.List;

/**
 * Result of laying out several nodes: the moved nodes and the box that encloses them.
 *
 * @param items nodes in input order, each translated to its final position
 * @param box combined extent and anchors
 */
public record Arrangement(List<RenderedNode> items, BoundingBox box) {

    public Arrangement {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public RenderedNode first() {
        return items.get(0);
    }

    public RenderedNode last() {
        return items.get(items.size() - 1);
    }
}
