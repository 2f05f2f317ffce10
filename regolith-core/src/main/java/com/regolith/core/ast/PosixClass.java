package com.regolith.core.ast;

import java.util.Objects;

/**
 * POSIX character class such as {@code [:alpha:]}.
 *
 * @param name class name ("alpha", "digit", ...)
 * @param negated true for the {@code [:^alpha:]} form
 */
public record PosixClass(String name, boolean negated) implements CharsetItem {

    public PosixClass {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public String type() {
        return "posix_class";
    }
}
