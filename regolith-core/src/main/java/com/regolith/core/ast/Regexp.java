package com.regolith.core.ast;

import java.util.List;

/**
 * Root (or nested) expression: an ordered list of alternation branches.
 *
 * @param matches alternation branches in rendering order
 * @param flags flag letters written after the pattern (empty when none)
 * @param options PCRE2 pattern-start options such as {@code (*UTF)} (empty when none)
 */
public record Regexp(
    List<Match> matches,
    String flags,
    List<PatternOption> options
) implements Node {

    /**
     * Compact constructor with validation.
     */
    public Regexp {
        matches = matches == null ? List.of() : List.copyOf(matches);
        flags = flags == null ? "" : flags;
        options = options == null ? List.of() : List.copyOf(options);
    }

    /**
     * Creates an expression without flags or options.
     *
     * @param matches alternation branches
     * @return new expression
     */
    public static Regexp of(Match... matches) {
        return new Regexp(List.of(matches), "", List.of());
    }

    /**
     * Returns a copy of this expression carrying the given flags.
     *
     * @param newFlags flag letters
     * @return new expression
     */
    public Regexp withFlags(String newFlags) {
        return new Regexp(matches, newFlags, options);
    }

    /**
     * Returns a copy of this expression carrying the given pattern-start options.
     *
     * @param newOptions pattern-start options
     * @return new expression
     */
    public Regexp withOptions(List<PatternOption> newOptions) {
        return new Regexp(matches, flags, newOptions);
    }

    public boolean hasFlags() {
        return !flags.isEmpty();
    }

    @Override
    public String type() {
        return "regexp";
    }
}
