package com.regolith.core.ast;

import java.util.List;

/**
 * Bracket expression: {@code [abc]}, {@code [^abc]}, {@code [a-z]}.
 *
 * @param inverted true for a negated class
 * @param items class members in source order
 */
public record Charset(boolean inverted, List<CharsetItem> items) implements Node {

    public Charset {
        items = items == null ? List.of() : List.copyOf(items);
    }

    @Override
    public String type() {
        return "charset";
    }
}
