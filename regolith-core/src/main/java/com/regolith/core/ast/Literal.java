package com.regolith.core.ast;

import java.util.Objects;

/**
 * One or more literal characters.
 *
 * @param text the literal text
 */
public record Literal(String text) implements Node {

    public Literal {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public String type() {
        return "literal";
    }
}
