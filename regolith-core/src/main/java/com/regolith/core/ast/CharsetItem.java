package com.regolith.core.ast;

/**
 * Marker for nodes that may appear inside a bracket expression.
 *
 * @see Charset
 */
public interface CharsetItem extends Node {
}
