package com.regolith.core.ast;

import java.util.Objects;

/**
 * Branch reset group {@code (?|...)}.
 *
 * @param regexp the contained alternation
 */
public record BranchReset(Regexp regexp) implements Node {

    public BranchReset {
        Objects.requireNonNull(regexp, "regexp must not be null");
    }

    @Override
    public String type() {
        return "branch_reset";
    }
}
