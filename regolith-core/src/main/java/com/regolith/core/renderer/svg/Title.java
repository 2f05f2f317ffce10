package com.regolith.core.renderer.svg;

/**
 * {@code <title>} element, shown as a tooltip by most viewers.
 *
 * @param content tooltip text (escaped on output)
 */
public record Title(String content) implements SvgElement {

    @Override
    public void render(StringBuilder out) {
        out.append("<title>");
        SvgFormat.escape(content == null ? "" : content, out);
        out.append("</title>");
    }
}
