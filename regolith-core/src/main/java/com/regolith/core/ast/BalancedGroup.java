package com.regolith.core.ast;

import java.util.Objects;

/**
 * .NET balancing group {@code (?<name-other>...)} or {@code (?<-other>...)}.
 *
 * @param name group pushed on success, or {@code null}/empty for the non-capturing form
 * @param otherName group popped on success
 * @param regexp the contained expression
 */
public record BalancedGroup(String name, String otherName, Regexp regexp) implements Node {

    public BalancedGroup {
        Objects.requireNonNull(otherName, "otherName must not be null");
        Objects.requireNonNull(regexp, "regexp must not be null");
    }

    public boolean isCapturing() {
        return name != null && !name.isEmpty();
    }

    @Override
    public String type() {
        return "balanced_group";
    }
}
