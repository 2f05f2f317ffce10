package com.regolith.core.ast;

import java.util.Objects;

/**
 * Parenthesized group: capturing, named, non-capturing, lookaround or atomic.
 *
 * @param groupType kind of group
 * @param number capture number assigned by the parser (0 for non-capturing kinds)
 * @param name group name for named captures, otherwise {@code null}
 * @param regexp the contained expression
 */
public record Subexp(GroupType groupType, int number, String name, Regexp regexp) implements Node {

    public Subexp {
        Objects.requireNonNull(groupType, "groupType must not be null");
        Objects.requireNonNull(regexp, "regexp must not be null");
    }

    /**
     * Creates a numbered capture group.
     *
     * @param number capture number
     * @param regexp contained expression
     * @return new group
     */
    public static Subexp capture(int number, Regexp regexp) {
        return new Subexp(GroupType.CAPTURE, number, null, regexp);
    }

    @Override
    public String type() {
        return "subexp";
    }
}
