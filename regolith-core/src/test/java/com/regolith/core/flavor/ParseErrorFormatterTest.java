package com.regolith.core.flavor;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ParseErrorFormatter}.
 */
class ParseErrorFormatterTest {

    @Test
    void format_withColumn_pointsCaretAtColumn() {
        RegexParseException error = new RegexParseException("invalid interval", 1, 2);

        String text = ParseErrorFormatter.format("a{3,1}", error);

        assertThat(text).isEqualTo("""
            Error parsing pattern:

              a{3,1}
               ^

            invalid interval""");
    }

    @Test
    void format_multiLinePattern_showsOnlyOffendingLine() {
        RegexParseException error = new RegexParseException("dangling quantifier", 2, 3);

        String text = ParseErrorFormatter.format("abc\nde*+f", error);

        assertThat(text).isEqualTo("""
            Error parsing pattern:

              de*+f
                ^

            dangling quantifier""");
    }

    @Test
    void format_withoutPosition_omitsCaret() {
        RegexParseException error = new RegexParseException("something failed");

        String text = ParseErrorFormatter.format("abc", error);

        assertThat(text).isEqualTo("Error parsing pattern:\n\n  abc\n\nsomething failed");
        assertThat(error.hasPosition()).isFalse();
    }

    @Test
    void format_withColumnPastEnd_omitsCaret() {
        RegexParseException error = new RegexParseException("unexpected end", 1, 4);

        String text = ParseErrorFormatter.format("abc", error);

        assertThat(text).doesNotContain("^");
    }
}
