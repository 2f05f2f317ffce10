package com.regolith.core.ast;

/**
 * Back-reference such as {@code \1} or {@code \k<name>}.
 *
 * <p>When used as the condition of a {@link Conditional}, a negative number denotes a
 * relative reference.
 *
 * @param number referenced group number (0 for named references)
 * @param name referenced group name, or {@code null} for numbered references
 */
public record BackReference(int number, String name) implements Node {

    public boolean isNamed() {
        return name != null && !name.isEmpty();
    }

    @Override
    public String type() {
        return "back_reference";
    }
}
