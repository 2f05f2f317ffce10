package com.regolith.core.renderer;

import com.regolith.core.ast.Repeat;
import com.regolith.core.config.RenderConfig;
import com.regolith.core.renderer.layout.BoundingBox;
import com.regolith.core.renderer.layout.PathBuilder;
import com.regolith.core.renderer.layout.RenderedNode;
import com.regolith.core.renderer.svg.Group;
import com.regolith.core.renderer.svg.Line;
import com.regolith.core.renderer.svg.Path;
import com.regolith.core.renderer.svg.SvgElement;
import com.regolith.core.renderer.svg.Text;

import java.util.ArrayList;
import java.util.List;

/**
 * Draws quantifiers as railroad tracks around their content.
 *
 * <p>A skip track above the content appears when the minimum is 0; a loop track below
 * it, with a direction arrow and an optional count caption, appears when the maximum is
 * not 1. The arrow points left for greedy loops and right for lazy ones.
 */
final class RepeatRenderer {

    static final double CURVE_RADIUS = 10;
    static final double ARROW_SIZE = 5;

    private final RenderConfig config;

    RepeatRenderer(RenderConfig config) {
        this.config = config;
    }

    RenderedNode wrap(RenderedNode content, Repeat repeat) {
        double r = CURVE_RADIUS;
        boolean hasSkip = repeat.min() == 0;
        boolean hasLoop = repeat.max() != 1;

        BoundingBox inner = content.box();
        double skipHeight = hasSkip ? 2 * r : 0;
        double loopHeight = hasLoop ? 2 * r : 0;

        double width = inner.width() + 2 * r;
        double height = inner.height() + skipHeight + loopHeight;
        double anchorY = skipHeight + inner.anchorY();

        List<SvgElement> children = new ArrayList<>();

        if (hasSkip) {
            String d = new PathBuilder()
                .moveTo(0, anchorY)
                .quadraticTo(0, anchorY - r, r, anchorY - r)
                .horizontalTo(width - r)
                .quadraticTo(width, anchorY - r, width, anchorY)
                .build();
            children.add(new Path(d, "", config.lineColor(), config.lineWidth(), "skip-path"));
        }

        if (hasLoop) {
            double loopY = skipHeight + inner.height() + r;
            String d = new PathBuilder()
                .moveTo(width, anchorY)
                .quadraticTo(width, loopY, width - r, loopY)
                .horizontalTo(r)
                .quadraticTo(0, loopY, 0, anchorY)
                .build();
            children.add(new Path(d, "", config.lineColor(), config.lineWidth(), "loop-path"));
            children.add(arrow(width / 2, loopY, repeat.greedy()));

            String caption = Labels.repeat(repeat);
            if (!caption.isEmpty()) {
                children.add(new Text(width / 2, loopY + config.fontSize(), caption, config.fontFamily(),
                    config.fontSize() - 2, "", "middle", "repeat-label", List.of()));
                height += config.fontSize();
            }
        }

        children.add(Group.translated(r, skipHeight, content.element()));

        // Stubs join the outer track to the content's own anchors
        children.add(Line.horizontal(0, r, anchorY, config.lineColor(), config.lineWidth()));
        children.add(Line.horizontal(r + inner.width(), width, anchorY, config.lineColor(), config.lineWidth()));

        return new RenderedNode(
            Group.classed("repeat", children),
            BoundingBox.anchoredAt(width, height, anchorY));
    }

    private Path arrow(double x, double y, boolean greedy) {
        double tail = greedy ? x + ARROW_SIZE : x - ARROW_SIZE;
        String d = new PathBuilder()
            .moveTo(tail, y - ARROW_SIZE)
            .lineTo(x, y)
            .lineTo(tail, y + ARROW_SIZE)
            .build();
        return Path.stroked(d, config.lineColor(), config.lineWidth());
    }
}
