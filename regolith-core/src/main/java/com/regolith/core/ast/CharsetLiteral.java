package com.regolith.core.ast;

import java.util.Objects;

/**
 * Literal character inside a bracket expression.
 *
 * @param text the character
 */
public record CharsetLiteral(String text) implements CharsetItem {

    public CharsetLiteral {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public String type() {
        return "charset_literal";
    }
}
