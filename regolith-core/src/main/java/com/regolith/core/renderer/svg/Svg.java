package com.regolith.core.renderer.svg;

import java.util.List;

/**
 * Root {@code <svg>} element. The stylesheet is written first, before any child, inside a
 * CDATA section.
 *
 * @param width document width
 * @param height document height
 * @param style CSS for the embedded {@code <style>} block, or empty
 * @param children child elements in paint order
 */
public record Svg(double width, double height, String style, List<SvgElement> children) implements SvgElement {

    public static final String NAMESPACE = "http://www.w3.org/2000/svg";

    public Svg {
        style = style == null ? "" : style;
        children = children == null ? List.of() : List.copyOf(children);
    }

    public String viewBox() {
        return "0 0 " + SvgFormat.number(width) + " " + SvgFormat.number(height);
    }

    @Override
    public void render(StringBuilder out) {
        out.append("<svg");
        SvgFormat.attribute(out, "xmlns", NAMESPACE);
        SvgFormat.attribute(out, "width", width);
        SvgFormat.attribute(out, "height", height);
        SvgFormat.attribute(out, "viewBox", viewBox());
        out.append('>');
        if (!style.isEmpty()) {
            out.append("<style><![CDATA[").append(style.replace("]]>", "]]]]><![CDATA[>")).append("]]></style>");
        }
        for (SvgElement child : children) {
            child.render(out);
        }
        out.append("</svg>");
    }
}
