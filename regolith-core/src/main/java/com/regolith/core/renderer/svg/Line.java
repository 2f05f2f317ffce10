package com.regolith.core.renderer.svg;

/**
 * {@code <line>} element.
 *
 * @param x1 start x
 * @param y1 start y
 * @param x2 end x
 * @param y2 end y
 * @param stroke stroke paint, or empty
 * @param strokeWidth stroke width, or 0
 * @param cssClass class attribute, or empty
 */
public record Line(
    double x1,
    double y1,
    double x2,
    double y2,
    String stroke,
    double strokeWidth,
    String cssClass
) implements SvgElement {

    /**
     * Creates a horizontal line.
     *
     * @param fromX start x
     * @param toX end x
     * @param y vertical position
     * @param stroke stroke paint
     * @param strokeWidth stroke width
     * @return new line
     */
    public static Line horizontal(double fromX, double toX, double y, String stroke, double strokeWidth) {
        return new Line(fromX, y, toX, y, stroke, strokeWidth, "");
    }

    @Override
    public void render(StringBuilder out) {
        out.append("<line");
        SvgFormat.attribute(out, "x1", x1);
        SvgFormat.attribute(out, "y1", y1);
        SvgFormat.attribute(out, "x2", x2);
        SvgFormat.attribute(out, "y2", y2);
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
