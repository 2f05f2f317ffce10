package com.regolith.core.renderer;

import com.regolith.core.config.RenderConfig;

import java.util.List;
import java.util.Objects;

/**
 * Context passed down the render recursion.
 *
 * <p>Immutable: entering a group creates a {@link #nested()} copy, so siblings never see
 * each other's depth.
 *
 * @param config styling for this render
 * @param depth number of enclosing group boxes (0 at the top level)
 */
public record RenderContext(
    RenderConfig config,
    int depth
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(config, "config must not be null");
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative: " + depth);
        }
    }

    /**
     * Creates the context for the top of a diagram.
     *
     * @param config styling for this render
     * @return depth-0 context
     */
    public static RenderContext root(RenderConfig config) {
        return new RenderContext(config, 0);
    }

    /**
     * Returns the context for content inside a group box.
     *
     * @return context one level deeper
     */
    public RenderContext nested() {
        return new RenderContext(config, depth + 1);
    }

    /**
     * Gets the fill for a group box at this depth.
     *
     * <p>Depth 0 uses {@link RenderConfig#subexpFill()}; deeper levels cycle through
     * {@link RenderConfig#subexpColors()}, falling back to the depth-0 fill when the
     * palette is empty.
     *
     * @return fill paint
     */
    public String groupFill() {
        List<String> palette = config.subexpColors();
        if (depth == 0 || palette.isEmpty()) {
            return config.subexpFill();
        }
        return palette.get((depth - 1) % palette.size());
    }
}
