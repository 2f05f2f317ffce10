package com.regolith.core.renderer;

import com.regolith.core.ast.Anchor;
import com.regolith.core.ast.AnchorType;
import com.regolith.core.ast.AnyCharacter;
import com.regolith.core.ast.BackReference;
import com.regolith.core.ast.BacktrackControl;
import com.regolith.core.ast.BalancedGroup;
import com.regolith.core.ast.BranchReset;
import com.regolith.core.ast.Callout;
import com.regolith.core.ast.Charset;
import com.regolith.core.ast.CharsetLiteral;
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
import com.regolith.core.ast.Repeat;
import com.regolith.core.ast.Subexp;
import com.regolith.core.ast.UnicodePropertyEscape;
import com.regolith.core.config.RenderConfig;
import com.regolith.core.renderer.layout.BoundingBox;
import com.regolith.core.renderer.layout.RenderedNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link NodeRenderer}.
 */
class NodeRendererTest {

    private static final Regexp BODY = Regexp.of(
        Match.of(MatchFragment.of(new Literal("ab"))),
        Match.of(MatchFragment.repeated(new AnyCharacter(), Repeat.zeroOrMore())));

    private NodeRenderer nodes;
    private RenderContext root;

    @BeforeEach
    void setUp() {
        RenderConfig config = RenderConfig.defaults();
        nodes = new NodeRenderer(config);
        root = RenderContext.root(config);
    }

    static Stream<Node> everyNodeKind() {
        return Stream.of(
            new Literal("abc"),
            new QuotedLiteral("a.b"),
            new Escape("class", "d", "digit"),
            new BackReference(1, null),
            new UnicodePropertyEscape("L", false),
            new Anchor(AnchorType.WORD_BOUNDARY),
            new AnyCharacter(),
            new Charset(false, List.of(new CharsetLiteral("x"))),
            Subexp.capture(1, BODY),
            new BranchReset(BODY),
            new BalancedGroup("close", "open", BODY),
            new Comment("note"),
            new InlineModifier("i", "", null),
            new InlineModifier("i", "", BODY),
            new Conditional(new BackReference(1, null), BODY, BODY),
            new Conditional(new RecursiveRef("R"), BODY, null),
            new RecursiveRef("R"),
            new BacktrackControl("PRUNE", null),
            new Callout(1, null),
            BODY,
            Match.of(MatchFragment.of(new Literal("a")), MatchFragment.of(new Literal("b"))),
            MatchFragment.repeated(new Literal("a"), Repeat.between(2, 3)),
            (Node) () -> "custom");
    }

    @ParameterizedTest
    @MethodSource("everyNodeKind")
    void render_anyNode_anchorLiesWithinBox(Node node) {
        BoundingBox box = nodes.render(node, root).box();

        assertThat(box.width()).isPositive();
        assertThat(box.height()).isPositive();
        assertThat(box.anchorY()).isBetween(box.y(), box.y2());
    }

    @Test
    void render_literal_sizesBoxToText() {
        BoundingBox box = nodes.render(new Literal("abc"), root).box();

        assertThat(box).isEqualTo(BoundingBox.of(0, 0, 52, 24));
    }

    @Test
    void render_group_anchorsOnContentLine() {
        RenderedNode group = nodes.render(Subexp.capture(1, Regexp.of(Match.of(MatchFragment.of(new Literal("a"))))), root);

        // label row (font size + padding) plus the literal's own anchor
        assertThat(group.box().anchorY()).isEqualTo(24 + 12);
    }

    @Test
    void renderRegexp_noBranches_isEmpty() {
        RenderedNode rendered = nodes.renderRegexp(new Regexp(List.of(), "", List.of()), root);

        assertThat(rendered.box()).isEqualTo(BoundingBox.zero());
    }

    @Test
    void renderRegexp_alternation_anchorsAtMidHeight() {
        BoundingBox box = nodes.renderRegexp(BODY, root).box();

        assertThat(box.anchorY()).isEqualTo(box.height() / 2);
        assertThat(box.anchorLeft()).isZero();
        assertThat(box.anchorRight()).isEqualTo(box.width());
    }

    @Test
    void renderMatch_placesFragmentsWithGap() {
        Match match = Match.of(MatchFragment.of(new Literal("a")), MatchFragment.of(new Anchor(AnchorType.END)));

        BoundingBox box = nodes.renderMatch(match, root).box();

        // "a" quoted is 3 chars, "End of line" is 11; each box adds the padding
        assertThat(box.width()).isCloseTo(35.2 + 10 + 102.4, within(1e-9));
    }
}
