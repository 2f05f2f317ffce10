package com.regolith.core.flavor.impl;

import com.regolith.core.ast.Anchor;
import com.regolith.core.ast.AnchorType;
import com.regolith.core.ast.AnyCharacter;
import com.regolith.core.ast.Charset;
import com.regolith.core.ast.CharsetLiteral;
import com.regolith.core.ast.CharsetRange;
import com.regolith.core.ast.Literal;
import com.regolith.core.ast.Match;
import com.regolith.core.ast.MatchFragment;
import com.regolith.core.ast.PosixClass;
import com.regolith.core.ast.Regexp;
import com.regolith.core.ast.Repeat;
import com.regolith.core.ast.Subexp;
import com.regolith.core.flavor.RegexParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PosixEreFlavor}.
 */
class PosixEreFlavorTest {

    private PosixEreFlavor flavor;

    @BeforeEach
    void setUp() {
        flavor = new PosixEreFlavor();
    }

    @Test
    void metadata_describesPosixEre() {
        assertThat(flavor.getId()).isEqualTo("posix-ere");
        assertThat(flavor.getDisplayName()).contains("POSIX");
        assertThat(flavor.getSupportedFlags()).isEmpty();
        assertThat(flavor.getSupportedFeatures().enabledFeatures()).containsExactly("posixClasses");
    }

    @Test
    void parse_withNull_throwsException() {
        assertThatThrownBy(() -> flavor.parse(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("pattern must not be null");
    }

    @Nested
    @DisplayName("valid patterns")
    class ValidPatterns {

        @Test
        void parse_emptyPattern_returnsOneEmptyBranch() throws RegexParseException {
            Regexp regexp = flavor.parse("");

            assertThat(regexp.matches()).hasSize(1);
            assertThat(regexp.matches().get(0).fragments()).isEmpty();
        }

        @Test
        void parse_plainText_mergesIntoOneLiteral() throws RegexParseException {
            Regexp regexp = flavor.parse("abc");

            assertThat(fragments(regexp, 0)).containsExactly(MatchFragment.of(new Literal("abc")));
        }

        @Test
        void parse_quantifiedCharacter_splitsLiteral() throws RegexParseException {
            Regexp regexp = flavor.parse("ab*c");

            assertThat(fragments(regexp, 0)).containsExactly(
                MatchFragment.of(new Literal("a")),
                MatchFragment.repeated(new Literal("b"), Repeat.zeroOrMore()),
                MatchFragment.of(new Literal("c")));
        }

        @Test
        void parse_alternation_returnsBranchPerAlternative() throws RegexParseException {
            Regexp regexp = flavor.parse("cat|dog|");

            assertThat(regexp.matches()).hasSize(3);
            assertThat(fragments(regexp, 0)).containsExactly(MatchFragment.of(new Literal("cat")));
            assertThat(fragments(regexp, 1)).containsExactly(MatchFragment.of(new Literal("dog")));
            assertThat(fragments(regexp, 2)).isEmpty();
        }

        @Test
        void parse_anchorsAndDot_returnsDedicatedNodes() throws RegexParseException {
            Regexp regexp = flavor.parse("^.$");

            assertThat(fragments(regexp, 0)).containsExactly(
                MatchFragment.of(new Anchor(AnchorType.START)),
                MatchFragment.of(new AnyCharacter()),
                MatchFragment.of(new Anchor(AnchorType.END)));
        }

        @Test
        void parse_groups_numberedByOpeningParenthesis() throws RegexParseException {
            Regexp regexp = flavor.parse("(a)(b(c))");

            List<MatchFragment> top = fragments(regexp, 0);
            assertThat(top).hasSize(2);
            Subexp first = (Subexp) top.get(0).content();
            Subexp second = (Subexp) top.get(1).content();
            Subexp inner = (Subexp) second.regexp().matches().get(0).fragments().get(1).content();

            assertThat(first.number()).isEqualTo(1);
            assertThat(second.number()).isEqualTo(2);
            assertThat(inner.number()).isEqualTo(3);
        }

        @Test
        void parse_quantifiedGroup_attachesRepeatToGroup() throws RegexParseException {
            Regexp regexp = flavor.parse("(ab)+");

            MatchFragment fragment = fragments(regexp, 0).get(0);
            assertThat(fragment.content()).isInstanceOf(Subexp.class);
            assertThat(fragment.repeat()).isEqualTo(Repeat.oneOrMore());
        }

        @ParameterizedTest
        @CsvSource({
            "a?, 0, 1",
            "a+, 1, -1",
            "a{3}, 3, 3",
            "'a{2,}', 2, -1",
            "'a{2,5}', 2, 5",
            "'a{0,255}', 0, 255"
        })
        void parse_quantifiers_returnsBounds(String pattern, int min, int max) throws RegexParseException {
            Repeat repeat = fragments(flavor.parse(pattern), 0).get(0).repeat();

            assertThat(repeat).isEqualTo(new Repeat(min, max, true, false));
        }

        @Test
        void parse_braceWithoutDigit_isLiteral() throws RegexParseException {
            assertThat(fragments(flavor.parse("a{"), 0)).containsExactly(MatchFragment.of(new Literal("a{")));
            assertThat(fragments(flavor.parse("x{,3}"), 0)).containsExactly(MatchFragment.of(new Literal("x{,3}")));
        }

        @Test
        void parse_escapedMetacharacter_isLiteral() throws RegexParseException {
            assertThat(fragments(flavor.parse("a\\.b\\*"), 0))
                .containsExactly(MatchFragment.of(new Literal("a.b*")));
        }

        @Test
        void parse_bracketExpression_returnsItems() throws RegexParseException {
            Charset charset = charset(flavor.parse("[^a-z_[:digit:]]"));

            assertThat(charset.inverted()).isTrue();
            assertThat(charset.items()).containsExactly(
                new CharsetRange("a", "z"),
                new CharsetLiteral("_"),
                new PosixClass("digit", false));
        }

        @Test
        void parse_leadingBracketAndTrailingDash_areLiterals() throws RegexParseException {
            Charset charset = charset(flavor.parse("[]a-]"));

            assertThat(charset.inverted()).isFalse();
            assertThat(charset.items()).containsExactly(
                new CharsetLiteral("]"),
                new CharsetLiteral("a"),
                new CharsetLiteral("-"));
        }

        @Test
        void parse_negatedPosixClass_isNegated() throws RegexParseException {
            Charset charset = charset(flavor.parse("[[:^space:]]"));

            assertThat(charset.items()).containsExactly(new PosixClass("space", true));
        }

        @Test
        void parse_backslashInsideBracket_isLiteral() throws RegexParseException {
            Charset charset = charset(flavor.parse("[\\n]"));

            assertThat(charset.items()).containsExactly(new CharsetLiteral("\\"), new CharsetLiteral("n"));
        }

        @Test
        void parse_supplementaryCharacter_keptWhole() throws RegexParseException {
            Regexp regexp = flavor.parse("😀+");

            assertThat(fragments(regexp, 0)).containsExactly(
                MatchFragment.repeated(new Literal("😀"), Repeat.oneOrMore()));
        }
    }

    @Nested
    @DisplayName("invalid patterns")
    class InvalidPatterns {

        @ParameterizedTest
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "a)        | unmatched ')'                                         | 2",
            "x(ab      | unmatched '('                                         | 2",
            "*a        | dangling quantifier '*': nothing to repeat            | 1",
            "\"a|+\"     | dangling quantifier '+': nothing to repeat            | 3",
            "a**       | quantifier '*' cannot follow another quantifier       | 3",
            "a{2}{3}   | quantifier '{' cannot follow another quantifier       | 5",
            "a{3,1}    | invalid interval {3,1}: minimum is greater than maximum | 2",
            "a{256}    | invalid interval: count 256 exceeds 255               | 2",
            "a{3       | invalid interval: expected '}'                        | 2",
            "[abc      | unterminated bracket expression                       | 1",
            "[[:foo:]] | unknown POSIX class '[:foo:]'                         | 2",
            "[[:alpha] | unterminated POSIX class                              | 2",
            "[[=a=]]   | collating symbols and equivalence classes are not supported | 2",
            "[z-a]     | reversed range 'z-a'                                  | 2",
            "a\\       | trailing backslash                                    | 2"
        })
        void parse_invalidPattern_reportsMessageAndColumn(String pattern, String message, int column) {
            assertThatThrownBy(() -> flavor.parse(pattern))
                .isInstanceOf(RegexParseException.class)
                .hasMessage(message)
                .extracting("column").isEqualTo(column);
        }

        @Test
        void parse_perlClassEscape_suggestsPosixClass() {
            assertThatThrownBy(() -> flavor.parse("a\\d"))
                .isInstanceOf(RegexParseException.class)
                .hasMessage("\\d is not supported in POSIX ERE; use [[:digit:]]");
        }

        @Test
        void parse_backReference_isRejected() {
            assertThatThrownBy(() -> flavor.parse("(a)\\1"))
                .isInstanceOf(RegexParseException.class)
                .hasMessage("back-reference \\1 is not supported in POSIX ERE");
        }

        @Test
        void parse_wordBoundary_isRejected() {
            assertThatThrownBy(() -> flavor.parse("\\bword"))
                .isInstanceOf(RegexParseException.class)
                .hasMessageContaining("word boundary");
        }

        @Test
        void parse_controlEscape_suggestsLiteralCharacter() {
            assertThatThrownBy(() -> flavor.parse("a\\tb"))
                .isInstanceOf(RegexParseException.class)
                .hasMessage("\\t is not a standard POSIX ERE escape; write a literal tab instead");
        }

        @Test
        void parse_errorOnSecondLine_reportsLineAndColumn() {
            assertThatThrownBy(() -> flavor.parse("a\nb)"))
                .isInstanceOfSatisfying(RegexParseException.class, e -> {
                    assertThat(e.getLine()).isEqualTo(2);
                    assertThat(e.getColumn()).isEqualTo(2);
                    assertThat(e.hasPosition()).isTrue();
                });
        }
    }

    private static List<MatchFragment> fragments(Regexp regexp, int branch) {
        Match match = regexp.matches().get(branch);
        return match.fragments();
    }

    private static Charset charset(Regexp regexp) {
        return (Charset) fragments(regexp, 0).get(0).content();
    }
}
