package com.regolith.core.renderer;

import com.regolith.core.config.RenderConfig;
import com.regolith.core.renderer.layout.BoundingBox;
import com.regolith.core.renderer.layout.RenderedNode;
import com.regolith.core.renderer.layout.TextMetrics;
import com.regolith.core.renderer.svg.Group;
import com.regolith.core.renderer.svg.Rect;
import com.regolith.core.renderer.svg.SvgElement;
import com.regolith.core.renderer.svg.TSpan;
import com.regolith.core.renderer.svg.Text;

import java.util.ArrayList;
import java.util.List;

/**
 * Box primitives every node rule is built from.
 *
 * <p>All boxes are drawn at the origin; callers position them through
 * {@link RenderedNode#translate(double, double)}.
 */
final class Boxes {

    private static final String MIDDLE = "middle";

    private final RenderConfig config;

    Boxes(RenderConfig config) {
        this.config = config;
    }

    /**
     * Rounded box with one centred line of text. Paint comes from the stylesheet
     * through the group class.
     */
    RenderedNode labeled(String text, String cssClass) {
        return singleLine(text, config.fontSize(), cssClass, "", List.of());
    }

    /**
     * Labeled box whose text is wrapped in quote marks styled with class {@code quote}.
     */
    RenderedNode quoted(String text, String cssClass) {
        List<TSpan> spans = List.of(
            TSpan.classed("\"", "quote"),
            TSpan.plain(text),
            TSpan.classed("\"", "quote"));
        return singleLine("\"" + text + "\"", config.fontSize(), cssClass, "", spans);
    }

    RenderedNode comment(String text) {
        return singleLine("# " + text, config.fontSize() - 2, "comment", "comment-text", List.of());
    }

    private RenderedNode singleLine(String text, double fontSize, String cssClass, String textClass,
                                    List<TSpan> spans) {
        double padding = config.padding() / 2;
        double width = TextMetrics.measure(text, config) + 2 * padding;
        double height = config.fontSize() + 2 * padding;

        Rect rect = Rect.rounded(width, height, config.cornerRadius());
        Text label = new Text(
            width / 2, height / 2 + config.fontSize() / 3,
            spans.isEmpty() ? text : "",
            config.fontFamily(), fontSize, "", MIDDLE, textClass, spans);

        return new RenderedNode(
            Group.classed(cssClass, List.of(rect, label)),
            BoundingBox.of(0, 0, width, height));
    }

    /**
     * Box with a small italic heading and one centred line per item, as used for
     * character classes and the flags legend.
     *
     * @param heading heading text, drawn in class {@code <cssClass>-label}
     * @param items one line each
     * @param cssClass group class
     * @return rendered box
     */
    RenderedNode list(String heading, List<String> items, String cssClass) {
        double padding = config.padding();
        double fontSize = config.fontSize();

        double maxItemWidth = 0;
        for (String item : items) {
            maxItemWidth = Math.max(maxItemWidth, TextMetrics.measure(item, config));
        }
        double contentWidth = Math.max(maxItemWidth + 2 * padding, TextMetrics.measure(heading, config));

        double labelHeight = fontSize + padding;
        double itemHeight = fontSize + padding / 2;
        double width = contentWidth + 2 * padding;
        double height = labelHeight + items.size() * itemHeight + padding;

        List<SvgElement> children = new ArrayList<>();
        children.add(Rect.rounded(width, height, config.cornerRadius()));
        children.add(heading(heading, cssClass + "-label"));

        double y = labelHeight + fontSize;
        for (String item : items) {
            children.add(new Text(width / 2, y, item, config.fontFamily(), fontSize, "", MIDDLE, "", List.of()));
            y += itemHeight;
        }

        return new RenderedNode(Group.classed(cssClass, children), BoundingBox.of(0, 0, width, height));
    }

    /**
     * Group box: explicit fill and stroke, title in class {@code subexp-label}.
     *
     * @param title caption
     * @param content nested diagram
     * @param fill fill for this nesting depth
     * @return rendered box, anchored on the content's line
     */
    RenderedNode group(String title, RenderedNode content, String fill) {
        return titled(title, content, "subexp", "subexp-label", fill, config.subexpStroke(), config.lineWidth());
    }

    /**
     * Titled box whose paint comes from the stylesheet, title in class
     * {@code <cssClass>-label}.
     */
    RenderedNode titled(String title, RenderedNode content, String cssClass) {
        return titled(title, content, cssClass, cssClass + "-label", "", "", 0);
    }

    private RenderedNode titled(String title, RenderedNode content, String cssClass, String labelClass,
                                String fill, String stroke, double strokeWidth) {
        double padding = config.padding();
        BoundingBox inner = content.box();

        double labelHeight = config.fontSize() + padding;
        double width = Math.max(inner.width(), TextMetrics.measure(title, config)) + 2 * padding;
        double height = labelHeight + inner.height() + padding;

        Rect rect = new Rect(0, 0, width, height, config.cornerRadius(), fill, stroke, strokeWidth, "");
        double contentX = (width - inner.width()) / 2;

        List<SvgElement> children = List.of(
            rect,
            heading(title, labelClass),
            Group.translated(contentX, labelHeight, content.element()));

        return new RenderedNode(
            Group.classed(cssClass, children),
            BoundingBox.anchoredAt(width, height, labelHeight + inner.anchorY()));
    }

    /**
     * Grey banner listing pattern-start options.
     */
    RenderedNode banner(String text) {
        double padding = config.padding() / 2;
        double width = TextMetrics.measure(text, config) + 2 * padding;
        double height = config.fontSize() + 2 * padding;

        Rect rect = new Rect(0, 0, width, height, config.cornerRadius(), "#e8e8e8", "#999", config.lineWidth(), "");
        Text label = new Text(width / 2, height / 2 + config.fontSize() / 3, text,
            config.fontFamily(), config.fontSize() - 2, "", MIDDLE, "pattern-options-label", List.of());

        return new RenderedNode(
            Group.classed("pattern-options", List.of(rect, label)),
            BoundingBox.of(0, 0, width, height));
    }

    private Text heading(String text, String cssClass) {
        return new Text(config.padding(), config.fontSize(), text, config.fontFamily(), config.fontSize() - 2,
            "", "", cssClass, List.of());
    }
}
