package com.regolith.core.ast;

import java.util.Objects;

/**
 * Backtracking control verb such as {@code (*FAIL)} or {@code (*SKIP:name)}.
 *
 * @param verb verb name ("ACCEPT", "FAIL", "MARK", ...)
 * @param arg optional argument, empty when absent
 */
public record BacktrackControl(String verb, String arg) implements Node {

    public BacktrackControl {
        Objects.requireNonNull(verb, "verb must not be null");
        arg = arg == null ? "" : arg;
    }

    public boolean hasArg() {
        return !arg.isEmpty();
    }

    @Override
    public String type() {
        return "backtrack_control";
    }
}
