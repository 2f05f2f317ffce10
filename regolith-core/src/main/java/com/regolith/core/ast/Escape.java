package com.regolith.core.ast;

import java.util.Objects;

/**
 * Escape sequence such as {@code \d}, {@code \w} or {@code \n}.
 *
 * @param escapeType machine-readable kind ("digit", "word", "newline", ...)
 * @param code the escape code as written after the backslash
 * @param value human-readable description shown in the diagram
 */
public record Escape(String escapeType, String code, String value) implements CharsetItem {

    public Escape {
        Objects.requireNonNull(value, "value must not be null");
        escapeType = escapeType == null ? "literal" : escapeType;
        code = code == null ? "" : code;
    }

    @Override
    public String type() {
        return "escape";
    }
}
