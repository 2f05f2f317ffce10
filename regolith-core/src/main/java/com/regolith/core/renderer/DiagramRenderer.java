package com.regolith.core.renderer;

import com.regolith.core.ast.Regexp;
import com.regolith.core.config.RenderConfig;
import com.regolith.core.renderer.layout.RenderedNode;
import com.regolith.core.renderer.svg.Group;
import com.regolith.core.renderer.svg.Line;
import com.regolith.core.renderer.svg.Svg;
import com.regolith.core.renderer.svg.SvgElement;
import com.regolith.core.renderer.svg.Title;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a parsed regular expression as a railroad diagram in SVG.
 *
 * <p>The output is a single self-contained {@code <svg>} document: an embedded
 * stylesheet, entry and exit lines, the diagram itself and, when present, a legend for
 * the pattern's flags and a banner for its pattern-start options. The same AST and
 * configuration always produce the same bytes.
 *
 * <p>Instances hold only the immutable configuration and may be shared between threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Regexp ast = flavor.parse("(cat|dog)s?");
 * String svg = new DiagramRenderer(RenderConfig.defaults()).render(ast);
 * Files.writeString(Path.of("regex.svg"), svg);
 * }</pre>
 */
public class DiagramRenderer {

    private static final Logger log = LoggerFactory.getLogger(DiagramRenderer.class);

    private final RenderConfig config;
    private final NodeRenderer nodes;
    private final Boxes boxes;

    public DiagramRenderer() {
        this(RenderConfig.defaults());
    }

    public DiagramRenderer(RenderConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.nodes = new NodeRenderer(config);
        this.boxes = new Boxes(config);
    }

    public RenderConfig getConfig() {
        return config;
    }

    /**
     * Renders the expression to SVG markup.
     *
     * @param ast parsed expression
     * @return SVG document
     */
    public String render(Regexp ast) {
        return render(ast, null);
    }

    /**
     * Renders the expression to SVG markup with a document title.
     *
     * @param ast parsed expression
     * @param title text for a {@code <title>} element (usually the pattern), or
     *              {@code null} for none
     * @return SVG document
     */
    public String render(Regexp ast, String title) {
        Svg svg = toSvg(ast, title);
        StringBuilder out = new StringBuilder(4096);
        svg.render(out);
        log.debug("Rendered diagram {}x{} ({} chars)", svg.width(), svg.height(), out.length());
        return out.toString();
    }

    /**
     * Builds the SVG element tree without serializing it.
     *
     * @param ast parsed expression
     * @param title document title, or {@code null}
     * @return root element
     */
    public Svg toSvg(Regexp ast, String title) {
        Objects.requireNonNull(ast, "ast must not be null");
        double padding = config.padding();

        RenderedNode diagram = nodes.renderRegexp(ast, RenderContext.root(config));
        double contentWidth = diagram.box().width();
        double width = contentWidth + 2 * padding;
        double height = diagram.box().height() + 2 * padding;

        RenderedNode legend = null;
        double legendWidth = 0;
        if (ast.hasFlags()) {
            legend = boxes.list("Flags:", Labels.flags(ast.flags()), "flags");
            legendWidth = legend.box().width() + padding;
            width += legendWidth;
            height = Math.max(height, legend.box().height() + 2 * padding);
        }

        RenderedNode banner = null;
        double bannerHeight = 0;
        if (!ast.options().isEmpty()) {
            banner = boxes.banner(Labels.patternOptions(ast.options()));
            bannerHeight = banner.box().height() + padding / 2;
            width = Math.max(width, banner.box().width() + 2 * padding);
            height += bannerHeight;
        }

        double top = bannerHeight + padding;
        double anchorY = top + diagram.box().anchorY();
        double exitX = padding + contentWidth;

        List<SvgElement> children = new ArrayList<>();
        if (title != null && !title.isEmpty()) {
            children.add(new Title(title));
        }
        children.add(Line.horizontal(padding / 2, padding, anchorY, config.lineColor(), config.lineWidth()));
        children.add(Line.horizontal(exitX, exitX + padding / 2, anchorY, config.lineColor(), config.lineWidth()));
        children.add(Group.translated(padding, top, diagram.element()));
        if (banner != null) {
            children.add(Group.translated(padding, padding / 2, banner.element()));
        }
        if (legend != null) {
            children.add(Group.translated(exitX + padding / 2, top, legend.element()));
        }

        return new Svg(width, height, StyleSheet.css(config), children);
    }
}
