package com.regolith.core.renderer.layout;

import com.regolith.core.renderer.svg.Group;
import com.regolith.core.renderer.svg.SvgElement;

import java.util.Objects;

/**
 * An SVG element together with its bounding box.
 *
 * @param element the markup
 * @param box extent and anchors of the markup, in its own coordinates
 */
public record RenderedNode(SvgElement element, BoundingBox box) {

    public RenderedNode {
        Objects.requireNonNull(element, "element must not be null");
        Objects.requireNonNull(box, "box must not be null");
    }

    /**
     * Creates a node with no markup and a zero box.
     *
     * @return empty node
     */
    public static RenderedNode empty() {
        return new RenderedNode(Group.empty(), BoundingBox.zero());
    }

    /**
     * Moves the node, wrapping its element in a translating group when the offset is
     * non-zero.
     *
     * @param dx horizontal offset
     * @param dy vertical offset
     * @return moved node
     */
    public RenderedNode translate(double dx, double dy) {
        return new RenderedNode(Group.translated(dx, dy, element), box.translate(dx, dy));
    }
}
