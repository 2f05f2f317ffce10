package com.regolith.core.ast;

import java.util.Objects;

/**
 * Unicode property escape {@code \p{...}} or {@code \P{...}}.
 *
 * @param property property name, e.g. "Letter" or "Script=Greek"
 * @param negated true for {@code \P{...}}
 */
public record UnicodePropertyEscape(String property, boolean negated) implements Node {

    public UnicodePropertyEscape {
        Objects.requireNonNull(property, "property must not be null");
    }

    @Override
    public String type() {
        return "unicode_property_escape";
    }
}
