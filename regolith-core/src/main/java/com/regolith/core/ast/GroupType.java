package com.regolith.core.ast;

/**
 * Kinds of parenthesized groups.
 */
public enum GroupType {
    CAPTURE,
    NAMED_CAPTURE,
    NON_CAPTURE,
    POSITIVE_LOOKAHEAD,
    NEGATIVE_LOOKAHEAD,
    POSITIVE_LOOKBEHIND,
    NEGATIVE_LOOKBEHIND,
    NON_ATOMIC_POSITIVE_LOOKAHEAD,
    NON_ATOMIC_POSITIVE_LOOKBEHIND,
    ATOMIC,
    SCRIPT_RUN,
    ATOMIC_SCRIPT_RUN;

    /**
     * Returns whether groups of this kind receive a capture number.
     *
     * @return true for numbered groups
     */
    public boolean isCapturing() {
        return this == CAPTURE || this == NAMED_CAPTURE;
    }
}
