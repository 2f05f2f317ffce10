package com.regolith.core.renderer.svg;

/**
 * A node of the SVG document tree.
 *
 * <p>Elements are immutable and write their markup into a shared buffer, so a whole
 * document is produced in one pass.
 */
public interface SvgElement {

    /**
     * Appends this element's markup to the buffer.
     *
     * @param out target buffer
     */
    void render(StringBuilder out);

    /**
     * Renders this element on its own.
     *
     * @return element markup
     */
    default String render() {
        StringBuilder out = new StringBuilder();
        render(out);
        return out.toString();
    }
}
