package com.regolith.core.renderer.svg;

import java.util.List;

/**
 * {@code <text>} element holding either plain content or a list of spans.
 *
 * @param x anchor x
 * @param y baseline y
 * @param content plain text, ignored when spans are present
 * @param fontFamily font family, or empty
 * @param fontSize font size, or 0
 * @param fill fill paint, or empty
 * @param textAnchor text-anchor value ("start", "middle", "end"), or empty
 * @param cssClass class attribute, or empty
 * @param spans styled runs, rendered instead of content when not empty
 */
public record Text(
    double x,
    double y,
    String content,
    String fontFamily,
    double fontSize,
    String fill,
    String textAnchor,
    String cssClass,
    List<TSpan> spans
) implements SvgElement {

    public Text {
        content = content == null ? "" : content;
        spans = spans == null ? List.of() : List.copyOf(spans);
    }

    @Override
    public void render(StringBuilder out) {
        out.append("<text");
        SvgFormat.attribute(out, "x", x);
        SvgFormat.attribute(out, "y", y);
        if (SvgFormat.isSet(fontFamily)) {
            SvgFormat.attribute(out, "font-family", fontFamily);
        }
        if (fontSize > 0) {
            SvgFormat.attribute(out, "font-size", fontSize);
        }
        if (SvgFormat.isSet(fill)) {
            SvgFormat.attribute(out, "fill", fill);
        }
        if (SvgFormat.isSet(textAnchor)) {
            SvgFormat.attribute(out, "text-anchor", textAnchor);
        }
        if (SvgFormat.isSet(cssClass)) {
            SvgFormat.attribute(out, "class", cssClass);
        }
        out.append('>');
        if (spans.isEmpty()) {
            SvgFormat.escape(content, out);
        } else {
            for (TSpan span : spans) {
                span.render(out);
            }
        }
        out.append("</text>");
    }
}
