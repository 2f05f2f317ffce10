package com.regolith.core.ast;

import java.util.Objects;

/**
 * Quoted sequence {@code \Q...\E}.
 *
 * @param text the quoted text
 */
public record QuotedLiteral(String text) implements Node {

    public QuotedLiteral {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public String type() {
        return "quoted_literal";
    }
}
