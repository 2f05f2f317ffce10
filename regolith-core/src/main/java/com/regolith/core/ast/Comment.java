package com.regolith.core.ast;

import java.util.Objects;

/**
 * Inline comment {@code (?#...)}.
 *
 * @param text comment body
 */
public record Comment(String text) implements Node {

    public Comment {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public String type() {
        return "comment";
    }
}
