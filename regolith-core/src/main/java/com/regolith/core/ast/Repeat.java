package com.regolith.core.ast;

/**
 * Quantifier: {@code *}, {@code +}, {@code ?}, {@code {n}}, {@code {n,}}, {@code {n,m}}.
 *
 * @param min minimum repetitions
 * @param max maximum repetitions, {@link #UNBOUNDED} for no upper limit
 * @param greedy false for lazy quantifiers (trailing {@code ?})
 * @param possessive true for possessive quantifiers (trailing {@code +})
 */
public record Repeat(int min, int max, boolean greedy, boolean possessive) implements Node {

    /** Upper bound marker for unbounded quantifiers. */
    public static final int UNBOUNDED = -1;

    public static Repeat zeroOrMore() {
        return new Repeat(0, UNBOUNDED, true, false);
    }

    public static Repeat oneOrMore() {
        return new Repeat(1, UNBOUNDED, true, false);
    }

    public static Repeat optional() {
        return new Repeat(0, 1, true, false);
    }

    public static Repeat exactly(int count) {
        return new Repeat(count, count, true, false);
    }

    public static Repeat atLeast(int min) {
        return new Repeat(min, UNBOUNDED, true, false);
    }

    public static Repeat between(int min, int max) {
        return new Repeat(min, max, true, false);
    }

    /**
     * Returns the lazy variant of this quantifier.
     *
     * @return non-greedy copy
     */
    public Repeat lazy() {
        return new Repeat(min, max, false, possessive);
    }

    /**
     * Returns the possessive variant of this quantifier.
     *
     * @return possessive copy
     */
    public Repeat possessively() {
        return new Repeat(min, max, greedy, true);
    }

    public boolean isUnbounded() {
        return max == UNBOUNDED;
    }

    @Override
    public String type() {
        return "repeat";
    }
}
