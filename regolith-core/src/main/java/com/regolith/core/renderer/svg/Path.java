package com.regolith.core.renderer.svg;

/**
 * {@code <path>} element. Paths are unfilled unless a fill is given.
 *
 * @param d path data
 * @param fill fill paint, {@code none} when empty
 * @param stroke stroke paint, or empty
 * @param strokeWidth stroke width, or 0
 * @param cssClass class attribute, or empty
 */
public record Path(String d, String fill, String stroke, double strokeWidth, String cssClass) implements SvgElement {

    public static Path stroked(String d, String stroke, double strokeWidth) {
        return new Path(d, "", stroke, strokeWidth, "");
    }

    @Override
    public void render(StringBuilder out) {
        out.append("<path");
        SvgFormat.attribute(out, "d", d == null ? "" : d);
        SvgFormat.attribute(out, "fill", SvgFormat.isSet(fill) ? fill : "none");
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
