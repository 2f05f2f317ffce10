package com.regolith.core.renderer.svg;

import java.util.List;

/**
 * {@code <g>} container with optional class and transform.
 *
 * @param cssClass class attribute, or empty
 * @param transform transform attribute, or empty
 * @param children child elements in paint order
 */
public record Group(String cssClass, String transform, List<SvgElement> children) implements SvgElement {

    public Group {
        cssClass = cssClass == null ? "" : cssClass;
        transform = transform == null ? "" : transform;
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Creates a group with no attributes and no children.
     *
     * @return empty group
     */
    public static Group empty() {
        return new Group("", "", List.of());
    }

    public static Group of(List<SvgElement> children) {
        return new Group("", "", children);
    }

    public static Group classed(String cssClass, List<SvgElement> children) {
        return new Group(cssClass, "", children);
    }

    /**
     * Wraps an element in a translating group.
     *
     * <p>A zero offset returns the element itself.
     *
     * @param dx horizontal offset
     * @param dy vertical offset
     * @param element element to move
     * @return translated element
     */
    public static SvgElement translated(double dx, double dy, SvgElement element) {
        if (dx == 0 && dy == 0) {
            return element;
        }
        return new Group("", translate(dx, dy), List.of(element));
    }

    /**
     * Formats a {@code translate(dx,dy)} transform.
     *
     * @param dx horizontal offset
     * @param dy vertical offset
     * @return transform value
     */
    public static String translate(double dx, double dy) {
        return "translate(" + SvgFormat.number(dx) + "," + SvgFormat.number(dy) + ")";
    }

    @Override
    public void render(StringBuilder out) {
        out.append("<g");
        if (SvgFormat.isSet(cssClass)) {
            SvgFormat.attribute(out, "class", cssClass);
        }
        if (SvgFormat.isSet(transform)) {
            SvgFormat.attribute(out, "transform", transform);
        }
        out.append('>');
        for (SvgElement child : children) {
            child.render(out);
        }
        out.append("</g>");
    }
}
