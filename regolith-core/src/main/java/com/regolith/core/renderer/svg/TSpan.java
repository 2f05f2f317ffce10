package com.regolith.core.renderer.svg;

/**
 * {@code <tspan>} run inside a {@link Text}.
 *
 * @param content text content (escaped on output)
 * @param cssClass class attribute, or empty
 * @param fill fill paint, or empty
 */
public record TSpan(String content, String cssClass, String fill) implements SvgElement {

    public TSpan {
        content = content == null ? "" : content;
    }

    public static TSpan plain(String content) {
        return new TSpan(content, "", "");
    }

    public static TSpan classed(String content, String cssClass) {
        return new TSpan(content, cssClass, "");
    }

    @Override
    public void render(StringBuilder out) {
        out.append("<tspan");
        if (SvgFormat.isSet(cssClass)) {
            SvgFormat.attribute(out, "class", cssClass);
        }
        if (SvgFormat.isSet(fill)) {
            SvgFormat.attribute(out, "fill", fill);
        }
        out.append('>');
        SvgFormat.escape(content, out);
        out.append("</tspan>");
    }
}
