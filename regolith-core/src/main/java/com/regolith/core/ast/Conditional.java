package com.regolith.core.ast;

import java.util.Objects;

/**
 * Conditional pattern {@code (?(cond)yes|no)}.
 *
 * @param condition what is tested: a {@link BackReference}, {@link RecursiveRef},
 *                  {@link Literal} or lookaround {@link Subexp}
 * @param trueBranch pattern used when the condition holds
 * @param falseBranch pattern used otherwise, or {@code null}
 */
public record Conditional(Node condition, Regexp trueBranch, Regexp falseBranch) implements Node {

    public Conditional {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(trueBranch, "trueBranch must not be null");
    }

    public boolean hasFalseBranch() {
        return falseBranch != null;
    }

    @Override
    public String type() {
        return "conditional";
    }
}
