package com.regolith.core.ast;

import java.util.Objects;

/**
 * A content node with an optional quantifier.
 *
 * @param content the quantified content
 * @param repeat quantifier, or {@code null} when the content appears exactly once
 */
public record MatchFragment(Node content, Repeat repeat) implements Node {

    public MatchFragment {
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Creates an unquantified fragment.
     *
     * @param content fragment content
     * @return new fragment
     */
    public static MatchFragment of(Node content) {
        return new MatchFragment(content, null);
    }

    /**
     * Creates a quantified fragment.
     *
     * @param content fragment content
     * @param repeat quantifier
     * @return new fragment
     */
    public static MatchFragment repeated(Node content, Repeat repeat) {
        return new MatchFragment(content, Objects.requireNonNull(repeat, "repeat must not be null"));
    }

    public boolean hasRepeat() {
        return repeat != null;
    }

    @Override
    public String type() {
        return "match_fragment";
    }
}
