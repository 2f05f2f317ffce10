package com.regolith.core.renderer.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Horizontal and vertical arrangement of rendered nodes.
 */
public final class Layout {

    private Layout() {
    }

    /**
     * Lays nodes out left to right with their connector lines on one height.
     *
     * <p>Each node is shifted down so that its anchor lands on the largest anchor height
     * among the nodes. The combined box starts at x = 0, spans the union of the moved
     * boxes vertically and takes its left and right anchors from the first and last
     * node.
     *
     * @param items nodes to arrange
     * @param gap horizontal space between neighbours
     * @return moved nodes and combined box, or an empty arrangement with a zero box
     */
    public static Arrangement spaceHorizontally(List<RenderedNode> items, double gap) {
        if (items.isEmpty()) {
            return new Arrangement(List.of(), BoundingBox.zero());
        }

        double maxAnchorY = 0;
        for (RenderedNode item : items) {
            maxAnchorY = Math.max(maxAnchorY, item.box().anchorY());
        }

        List<RenderedNode> placed = new ArrayList<>(items.size());
        double x = 0;
        double minY = Double.MAX_VALUE;
        double maxY = 0;
        for (RenderedNode item : items) {
            double dy = maxAnchorY - item.box().anchorY();
            RenderedNode moved = item.translate(x - item.box().x(), dy);
            placed.add(moved);

            minY = Math.min(minY, moved.box().y());
            maxY = Math.max(maxY, moved.box().y2());
            x = moved.box().x2() + gap;
        }

        RenderedNode first = placed.get(0);
        RenderedNode last = placed.get(placed.size() - 1);
        BoundingBox box = new BoundingBox(
            0, minY, last.box().x2(), maxY - minY,
            first.box().anchorLeft(), last.box().anchorRight(), maxAnchorY);
        return new Arrangement(placed, box);
    }

    /**
     * Stacks nodes top to bottom, each centred within the widest one.
     *
     * <p>The combined box starts at the origin, anchors on both edges at mid-height.
     *
     * @param items nodes to arrange
     * @param gap vertical space between neighbours
     * @return moved nodes and combined box, or an empty arrangement with a zero box
     */
    public static Arrangement spaceVertically(List<RenderedNode> items, double gap) {
        if (items.isEmpty()) {
            return new Arrangement(List.of(), BoundingBox.zero());
        }

        double maxWidth = 0;
        for (RenderedNode item : items) {
            maxWidth = Math.max(maxWidth, item.box().width());
        }

        List<RenderedNode> placed = new ArrayList<>(items.size());
        double y = 0;
        for (RenderedNode item : items) {
            double dx = (maxWidth - item.box().width()) / 2;
            RenderedNode moved = item.translate(dx - item.box().x(), y - item.box().y());
            placed.add(moved);
            y = moved.box().y2() + gap;
        }

        double totalHeight = placed.get(placed.size() - 1).box().y2();
        return new Arrangement(placed, BoundingBox.of(0, 0, maxWidth, totalHeight));
    }
}
