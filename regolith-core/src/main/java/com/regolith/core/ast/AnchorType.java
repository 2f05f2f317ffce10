package com.regolith.core.ast;

/**
 * Kinds of zero-width position assertions.
 */
public enum AnchorType {
    /** {@code ^} */
    START,
    /** {@code $} */
    END,
    /** {@code \b} */
    WORD_BOUNDARY,
    /** {@code \B} */
    NON_WORD_BOUNDARY,
    /** {@code \A} */
    STRING_START,
    /** {@code \Z}, before a final newline */
    STRING_END,
    /** {@code \z} */
    ABSOLUTE_END,
    /** {@code \<} (GNU) */
    WORD_START,
    /** {@code \>} (GNU) */
    WORD_END,
    /** {@code \G} */
    END_OF_PREVIOUS_MATCH,
    /** {@code \b{g}} (Java) */
    GRAPHEME_CLUSTER_BOUNDARY
}
