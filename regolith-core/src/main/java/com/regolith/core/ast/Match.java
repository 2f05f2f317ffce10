package com.regolith.core.ast;

import java.util.List;

/**
 * One alternation branch: fragments in concatenation order.
 *
 * @param fragments concatenated fragments
 */
public record Match(List<MatchFragment> fragments) implements Node {

    public Match {
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
    }

    /**
     * Creates a branch from the given fragments.
     *
     * @param fragments fragments in order
     * @return new branch
     */
    public static Match of(MatchFragment... fragments) {
        return new Match(List.of(fragments));
    }

    @Override
    public String type() {
        return "match";
    }
}
