package com.regolith.core.ast;

import java.util.Objects;

/**
 * Position assertion such as {@code ^}, {@code $} or {@code \b}.
 *
 * @param anchorType which position is asserted
 */
public record Anchor(AnchorType anchorType) implements Node {

    public Anchor {
        Objects.requireNonNull(anchorType, "anchorType must not be null");
    }

    @Override
    public String type() {
        return "anchor";
    }
}
