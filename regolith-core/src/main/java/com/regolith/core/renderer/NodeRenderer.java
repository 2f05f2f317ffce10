package com.regolith.core.renderer;

import com.regolith.core.ast.Anchor;
import com.regolith.core.ast.AnyCharacter;
import com.regolith.core.ast.BackReference;
import com.regolith.core.ast.BacktrackControl;
import com.regolith.core.ast.BalancedGroup;
import com.regolith.core.ast.BranchReset;
import com.regolith.core.ast.Callout;
import com.regolith.core.ast.Charset;
import com.regolith.core.ast.CharsetItem;
import com.regolith.core.ast.Comment;
import com.regolith.core.ast.Conditional;
import com.regolith.core.ast.Escape;
import com.regolith.core.ast.InlineModifier;
import com.regolith.core.ast.Literal;
import com.regolith.core.ast.Match;
import com.regolith.core.ast.MatchFragment;
import com.regolith.core.ast.Node;
import com.regolith.core.ast.QuotedLiteral;
import com.regolith.core.ast.RecursiveRef;
import com.regolith.core.ast.Regexp;
import com.regolith.core.ast.Subexp;
import com.regolith.core.ast.UnicodePropertyEscape;
import com.regolith.core.config.RenderConfig;
import com.regolith.core.renderer.layout.Arrangement;
import com.regolith.core.renderer.layout.BoundingBox;
import com.regolith.core.renderer.layout.Layout;
import com.regolith.core.renderer.layout.PathBuilder;
import com.regolith.core.renderer.layout.RenderedNode;
import com.regolith.core.renderer.svg.Group;
import com.regolith.core.renderer.svg.Path;
import com.regolith.core.renderer.svg.SvgElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders AST nodes into positioned SVG fragments.
 *
 * <p>Every node kind maps to one rule; node implementations it does not know are drawn
 * as a box labeled with their type. Stateless apart from the configuration, so one
 * instance can serve concurrent renders.
 */
final class NodeRenderer {

    static final double CONNECTOR_WIDTH = 20;
    static final double CURVE_RADIUS = 10;

    private final RenderConfig config;
    private final Boxes boxes;
    private final RepeatRenderer repeats;

    NodeRenderer(RenderConfig config) {
        this.config = config;
        this.boxes = new Boxes(config);
        this.repeats = new RepeatRenderer(config);
    }

    RenderedNode render(Node node, RenderContext context) {
        if (node instanceof Regexp regexp) {
            return renderRegexp(regexp, context);
        }
        if (node instanceof Match match) {
            return renderMatch(match, context);
        }
        if (node instanceof MatchFragment fragment) {
            return renderFragment(fragment, context);
        }
        if (node instanceof Literal literal) {
            return boxes.quoted(literal.text(), "literal");
        }
        if (node instanceof QuotedLiteral quoted) {
            return boxes.quoted(quoted.text(), "literal");
        }
        if (node instanceof Escape escape) {
            return boxes.labeled(escape.value(), "escape");
        }
        if (node instanceof BackReference ref) {
            return boxes.labeled(Labels.backReference(ref), "escape");
        }
        if (node instanceof UnicodePropertyEscape property) {
            return boxes.labeled(Labels.unicodeProperty(property), "escape");
        }
        if (node instanceof Anchor anchor) {
            return boxes.labeled(Labels.anchor(anchor.anchorType()), "anchor");
        }
        if (node instanceof AnyCharacter) {
            return boxes.labeled("any character", "any-character");
        }
        if (node instanceof Charset charset) {
            return renderCharset(charset);
        }
        if (node instanceof Subexp group) {
            return renderGroup(Labels.group(group), group.regexp(), context);
        }
        if (node instanceof BranchReset reset) {
            return renderGroup("branch reset", reset.regexp(), context);
        }
        if (node instanceof BalancedGroup balanced) {
            return renderGroup(Labels.balancedGroup(balanced), balanced.regexp(), context);
        }
        if (node instanceof Comment comment) {
            return boxes.comment(comment.text());
        }
        if (node instanceof InlineModifier modifier) {
            return renderInlineModifier(modifier, context);
        }
        if (node instanceof Conditional conditional) {
            return renderConditional(conditional, context);
        }
        if (node instanceof RecursiveRef ref) {
            return boxes.labeled(Labels.recursiveRef(ref), "recursive-ref");
        }
        if (node instanceof BacktrackControl control) {
            return boxes.labeled(Labels.backtrackControl(control), "backtrack-control");
        }
        if (node instanceof Callout callout) {
            return boxes.labeled(Labels.callout(callout), "callout");
        }
        return boxes.labeled("<" + node.type() + ">", "unknown");
    }

    /**
     * Alternation: branches stacked vertically, fanned out from a shared entry point
     * and joined again at a shared exit point.
     */
    RenderedNode renderRegexp(Regexp regexp, RenderContext context) {
        List<Match> matches = regexp.matches();
        if (matches.isEmpty()) {
            return RenderedNode.empty();
        }
        if (matches.size() == 1) {
            return renderMatch(matches.get(0), context);
        }

        List<RenderedNode> branches = new ArrayList<>(matches.size());
        for (Match match : matches) {
            branches.add(renderMatch(match, context));
        }
        Arrangement stacked = Layout.spaceVertically(branches, 2 * config.verticalGap());

        double r = CURVE_RADIUS;
        double trackRight = CONNECTOR_WIDTH + stacked.box().width();
        double width = trackRight + CONNECTOR_WIDTH;
        double height = stacked.box().height();
        double anchorY = height / 2;

        List<SvgElement> children = new ArrayList<>();
        for (RenderedNode branch : stacked.items()) {
            double branchY = branch.box().anchorY();
            // narrower branches are centred, so the tracks run on to their anchors
            double entryX = CONNECTOR_WIDTH + branch.box().anchorLeft();
            double exitX = CONNECTOR_WIDTH + branch.box().anchorRight();

            PathBuilder left = new PathBuilder().moveTo(0, anchorY);
            PathBuilder right = new PathBuilder().moveTo(exitX, branchY);
            if (branchY == anchorY) {
                left.horizontalTo(entryX);
                right.horizontalTo(width);
            } else {
                double toward = branchY < anchorY ? -r : r;
                left.quadraticTo(r, anchorY, r, anchorY + toward)
                    .verticalTo(branchY - toward)
                    .quadraticTo(r, branchY, CONNECTOR_WIDTH, branchY);
                if (entryX > CONNECTOR_WIDTH) {
                    left.horizontalTo(entryX);
                }
                if (exitX < trackRight) {
                    right.horizontalTo(trackRight);
                }
                right.quadraticTo(width - r, branchY, width - r, branchY - toward)
                    .verticalTo(anchorY + toward)
                    .quadraticTo(width - r, anchorY, width, anchorY);
            }
            children.add(Path.stroked(left.build(), config.lineColor(), config.lineWidth()));
            children.add(Path.stroked(right.build(), config.lineColor(), config.lineWidth()));
        }
        for (RenderedNode branch : stacked.items()) {
            children.add(Group.translated(CONNECTOR_WIDTH, 0, branch.element()));
        }

        return new RenderedNode(
            Group.classed("regexp", children),
            BoundingBox.anchoredAt(width, height, anchorY));
    }

    /**
     * Concatenation: fragments side by side, joined by one connector path.
     */
    RenderedNode renderMatch(Match match, RenderContext context) {
        if (match.fragments().isEmpty()) {
            return RenderedNode.empty();
        }

        List<RenderedNode> fragments = new ArrayList<>(match.fragments().size());
        for (MatchFragment fragment : match.fragments()) {
            fragments.add(renderFragment(fragment, context));
        }
        Arrangement row = Layout.spaceHorizontally(fragments, config.horizontalGap());
        double y = row.box().anchorY();

        List<SvgElement> children = new ArrayList<>();
        List<RenderedNode> items = row.items();
        if (items.size() > 1) {
            PathBuilder connector = new PathBuilder().moveTo(items.get(0).box().anchorRight(), y);
            for (int i = 1; i < items.size(); i++) {
                connector.lineTo(items.get(i).box().anchorLeft(), y);
                if (i < items.size() - 1) {
                    connector.moveTo(items.get(i).box().anchorRight(), y);
                }
            }
            children.add(Path.stroked(connector.build(), config.lineColor(), config.lineWidth()));
        }
        for (RenderedNode item : items) {
            children.add(item.element());
        }

        return new RenderedNode(Group.classed("match", children), row.box());
    }

    private RenderedNode renderFragment(MatchFragment fragment, RenderContext context) {
        RenderedNode content = render(fragment.content(), context);
        if (!fragment.hasRepeat()) {
            return content;
        }
        return repeats.wrap(content, fragment.repeat());
    }

    private RenderedNode renderCharset(Charset charset) {
        List<String> lines = new ArrayList<>(charset.items().size());
        for (CharsetItem item : charset.items()) {
            lines.add(Labels.charsetItem(item));
        }
        return boxes.list(Labels.charsetHeading(charset), lines, "charset");
    }

    /**
     * Group rule: the box takes the fill for the current depth, its content is drawn
     * one level deeper.
     */
    private RenderedNode renderGroup(String title, Regexp body, RenderContext context) {
        RenderedNode content = renderRegexp(body, context.nested());
        return boxes.group(title, content, context.groupFill());
    }

    private RenderedNode renderInlineModifier(InlineModifier modifier, RenderContext context) {
        String label = Labels.inlineModifier(modifier);
        if (modifier.isScoped()) {
            return boxes.titled(label, renderRegexp(modifier.regexp(), context), "flags");
        }
        return boxes.labeled(label, "flags");
    }

    private RenderedNode renderConditional(Conditional conditional, RenderContext context) {
        Arrangement yes = branch("then", conditional.trueBranch(), context);

        List<SvgElement> children = new ArrayList<>();
        double totalWidth;
        double totalHeight;
        if (conditional.hasFalseBranch()) {
            Arrangement no = branch("else", conditional.falseBranch(), context);
            double gap = config.verticalGap();
            totalWidth = Math.max(yes.box().width(), no.box().width());
            totalHeight = yes.box().height() + gap + no.box().height();

            children.add(branchGroup("condition-yes", yes, (totalWidth - yes.box().width()) / 2, 0));
            children.add(branchGroup("condition-no", no,
                (totalWidth - no.box().width()) / 2, yes.box().height() + gap));
        } else {
            totalWidth = yes.box().width();
            totalHeight = yes.box().height();
            children.add(branchGroup("condition-yes", yes, 0, 0));
        }

        RenderedNode content = new RenderedNode(Group.of(children), BoundingBox.of(0, 0, totalWidth, totalHeight));
        return boxes.titled(Labels.condition(conditional.condition()), content, "conditional");
    }

    private Arrangement branch(String caption, Regexp body, RenderContext context) {
        RenderedNode label = boxes.labeled(caption, "condition-label");
        RenderedNode content = renderRegexp(body, context);
        return Layout.spaceHorizontally(List.of(label, content), config.horizontalGap());
    }

    private static Group branchGroup(String cssClass, Arrangement row, double dx, double dy) {
        List<SvgElement> elements = new ArrayList<>(row.items().size());
        for (RenderedNode item : row.items()) {
            elements.add(item.element());
        }
        String transform = dx == 0 && dy == 0 ? "" : Group.translate(dx, dy);
        return new Group(cssClass, transform, elements);
    }
}
