package com.regolith.core.renderer.layout;

/**
 * Extent of a rendered element plus the points where connector lines attach.
 *
 * <p>For every box produced by the renderer, {@code y <= anchorY <= y + height}.
 *
 * @param x left edge
 * @param y top edge
 * @param width width
 * @param height height
 * @param anchorLeft x where the incoming line attaches
 * @param anchorRight x where the outgoing line leaves
 * @param anchorY y of the horizontal line through the element
 */
public record BoundingBox(
    double x,
    double y,
    double width,
    double height,
    double anchorLeft,
    double anchorRight,
    double anchorY
) {

    private static final BoundingBox ZERO = new BoundingBox(0, 0, 0, 0, 0, 0, 0);

    /**
     * Creates a box whose anchors sit on its left and right edges at mid-height.
     *
     * @param x left edge
     * @param y top edge
     * @param width width
     * @param height height
     * @return new box
     */
    public static BoundingBox of(double x, double y, double width, double height) {
        return new BoundingBox(x, y, width, height, x, x + width, y + height / 2);
    }

    /**
     * Creates a box at the origin with the given size and anchor height.
     *
     * @param width width
     * @param height height
     * @param anchorY y of the connector line
     * @return new box
     */
    public static BoundingBox anchoredAt(double width, double height, double anchorY) {
        return new BoundingBox(0, 0, width, height, 0, width, anchorY);
    }

    public static BoundingBox zero() {
        return ZERO;
    }

    public double x2() {
        return x + width;
    }

    public double y2() {
        return y + height;
    }

    /**
     * Returns this box moved by the given offset, anchors included.
     *
     * @param dx horizontal offset
     * @param dy vertical offset
     * @return moved box
     */
    public BoundingBox translate(double dx, double dy) {
        return new BoundingBox(x + dx, y + dy, width, height, anchorLeft + dx, anchorRight + dx, anchorY + dy);
    }
}
