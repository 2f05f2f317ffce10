package com.regolith.core.ast;

import java.util.Objects;

/**
 * PCRE2 pattern-start option such as {@code (*UTF)} or {@code (*LIMIT_MATCH=10)}.
 *
 * @param name option name
 * @param value option value for {@code LIMIT_*} options, otherwise empty
 */
public record PatternOption(String name, String value) implements Node {

    public PatternOption {
        Objects.requireNonNull(name, "name must not be null");
        value = value == null ? "" : value;
    }

    public boolean hasValue() {
        return !value.isEmpty();
    }

    @Override
    public String type() {
        return "pattern_option";
    }
}
