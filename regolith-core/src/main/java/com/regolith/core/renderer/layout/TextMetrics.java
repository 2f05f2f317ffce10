package com.regolith.core.renderer.layout;

import com.regolith.core.config.RenderConfig;

/**
 * Text width estimation with a fixed per-character width.
 */
public final class TextMetrics {

    private TextMetrics() {
    }

    /**
     * Estimates the rendered width of a string as its code point count times
     * {@link RenderConfig#charWidth()}.
     *
     * @param text text to measure
     * @param config supplies the character width
     * @return estimated width
     */
    public static double measure(String text, RenderConfig config) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return text.codePointCount(0, text.length()) * config.charWidth();
    }
}
