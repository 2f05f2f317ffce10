package com.regolith.core.ast;

/**
 * Common contract for every node of a parsed regular expression.
 *
 * <p>The tree is produced by a {@link com.regolith.core.flavor.Flavor} and is flavor-agnostic:
 * all eight supported dialects share these node kinds. Nodes are immutable records and every
 * nested {@link Regexp} is owned by exactly one parent.
 *
 * <p>Renderers dispatch on the concrete record type. Implementations outside this package are
 * allowed (forward-compatible kinds) and are drawn as a generic box labeled with {@link #type()}.
 */
public interface Node {

    /**
     * Returns the snake_case kind name of this node (e.g. "literal", "subexp").
     *
     * @return node kind name
     */
    String type();
}
