package com.regolith.core.renderer.svg;

/**
 * {@code <rect>} element. Zero radii and stroke width are omitted, as are empty paint
 * attributes.
 *
 * @param x left edge
 * @param y top edge
 * @param width width
 * @param height height
 * @param radius corner radius, used for both rx and ry
 * @param fill fill paint, or empty to leave it to the stylesheet
 * @param stroke stroke paint, or empty
 * @param strokeWidth stroke width, or 0
 * @param cssClass class attribute, or empty
 */
public record Rect(
    double x,
    double y,
    double width,
    double height,
    double radius,
    String fill,
    String stroke,
    double strokeWidth,
    String cssClass
) implements SvgElement {

    /**
     * Creates a rounded rectangle at the origin whose paint comes from the stylesheet.
     *
     * @param width width
     * @param height height
     * @param radius corner radius
     * @return new rect
     */
    public static Rect rounded(double width, double height, double radius) {
        return new Rect(0, 0, width, height, radius, "", "", 0, "");
    }

    @Override
    public void render(StringBuilder out) {
        out.append("<rect");
        SvgFormat.attribute(out, "x", x);
        SvgFormat.attribute(out, "y", y);
        SvgFormat.attribute(out, "width", width);
        SvgFormat.attribute(out, "height", height);
        if (radius > 0) {
            SvgFormat.attribute(out, "rx", radius);
            SvgFormat.attribute(out, "ry", radius);
        }
        if (SvgFormat.isSet(fill)) {
            SvgFormat.attribute(out, "fill", fill);
        }
        if (SvgFormat.isSet(stroke)) {
            SvgFormat.attribute(out, "stroke", stroke);
        }
        if (strokeWidth > 0) {
            SvgFormat.attribute(out, "stroke-width", strokeWidth);
        }
        if (SvgFormat.isSet(cssClass)) {
            SvgFormat.attribute(out, "class", cssClass);
        }
        out.append("/>");
    }
}
