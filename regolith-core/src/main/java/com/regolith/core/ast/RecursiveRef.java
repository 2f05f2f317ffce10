package com.regolith.core.ast;

/**
 * Recursion into the whole pattern or a group: {@code (?R)}, {@code (?1)}, {@code (?&name)}.
 *
 * @param target "R" or "0" for the whole pattern, a (signed) number, or a group name
 */
public record RecursiveRef(String target) implements Node {

    public RecursiveRef {
        target = target == null ? "" : target;
    }

    @Override
    public String type() {
        return "recursive_ref";
    }
}
