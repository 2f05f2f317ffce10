package com.regolith.core.ast;

import java.util.Objects;

/**
 * Set operation against a nested class, e.g. Java {@code [a-z&&[^aeiou]]} or
 * .NET {@code [a-z-[aeiou]]}.
 *
 * @param operator the set operation
 * @param operand the nested class combined with the enclosing items
 */
public record CharsetOperation(Operator operator, Charset operand) implements CharsetItem {

    /**
     * Supported set operations.
     */
    public enum Operator {
        INTERSECTION,
        SUBTRACTION
    }

    public CharsetOperation {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(operand, "operand must not be null");
    }

    @Override
    public String type() {
        return "charset_operation";
    }
}
