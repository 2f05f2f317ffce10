package com.regolith.core.ast;

/**
 * The {@code .} metacharacter.
 */
public record AnyCharacter() implements Node {

    @Override
    public String type() {
        return "any_character";
    }
}
