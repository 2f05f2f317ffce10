package com.regolith.core.renderer;

import com.regolith.core.config.RenderConfig;
import com.regolith.core.renderer.svg.SvgFormat;

/**
 * Builds the CSS embedded in every diagram.
 *
 * <p>Box fills are keyed on the group class of each node kind. Child combinators keep a
 * container's fill from reaching the boxes nested inside it.
 */
public final class StyleSheet {

    private static final String UNKNOWN_FILL = "#d3d3d3";

    private StyleSheet() {
    }

    /**
     * Returns the stylesheet for the given configuration.
     *
     * @param config colors and font settings
     * @return CSS text
     */
    public static String css(RenderConfig config) {
        String smallFont = SvgFormat.number(config.fontSize() - 2) + "px";
        StringBuilder css = new StringBuilder();
        rule(css, "svg", "background-color: " + config.backgroundColor() + ";");
        fill(css, "literal", config.literalFill());
        fill(css, "escape", config.escapeFill());
        fill(css, "charset", config.charsetFill());
        fill(css, "anchor", config.anchorFill());
        fill(css, "any-character", config.anyCharFill());
        fill(css, "flags", config.flagsFill());
        fill(css, "recursive-ref", config.recursiveRefFill());
        fill(css, "callout", config.calloutFill());
        fill(css, "backtrack-control", config.backtrackControlFill());
        fill(css, "conditional", config.conditionalFill());
        fill(css, "condition-label", config.conditionalFill());
        fill(css, "unknown", UNKNOWN_FILL);
        rule(css, ".comment > rect", "fill: #e8e8e8; stroke: #999; stroke-dasharray: 4,2;");
        rule(css, ".comment > text", "fill: #666; font-style: italic;");
        rule(css, "text", "font-family: " + config.fontFamily() + "; font-size: "
            + SvgFormat.number(config.fontSize()) + "px; fill: " + config.textColor() + ";");
        rule(css, ".anchor > text", "fill: #fff;");
        rule(css, ".quote", "fill: #000;");
        rule(css, ".subexp-label, .charset-label, .flags-label, .conditional-label",
            "font-size: " + smallFont + "; font-style: italic;");
        rule(css, ".repeat-label", "fill: " + config.repeatLabelColor() + "; font-size: " + smallFont + ";");
        return css.toString();
    }

    private static void fill(StringBuilder css, String cssClass, String color) {
        rule(css, "." + cssClass + " > rect", "fill: " + color + ";");
    }

    private static void rule(StringBuilder css, String selector, String body) {
        css.append(selector).append(" { ").append(body).append(" }\n");
    }
}
