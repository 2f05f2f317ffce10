package com.regolith.core.ast;

import java.util.Objects;

/**
 * Range such as {@code a-z} inside a bracket expression.
 *
 * @param first first character of the range
 * @param last last character of the range
 */
public record CharsetRange(String first, String last) implements CharsetItem {

    public CharsetRange {
        Objects.requireNonNull(first, "first must not be null");
        Objects.requireNonNull(last, "last must not be null");
    }

    @Override
    public String type() {
        return "charset_range";
    }
}
