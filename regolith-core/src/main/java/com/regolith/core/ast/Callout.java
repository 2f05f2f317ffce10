package com.regolith.core.ast;

/**
 * PCRE2 callout {@code (?C)}, {@code (?Cn)} or {@code (?C"text")}.
 *
 * @param number callout number 0-255, or {@link #STRING_CALLOUT} for string callouts
 * @param text callout text for string callouts
 */
public record Callout(int number, String text) implements Node {

    /** Number used by string callouts. */
    public static final int STRING_CALLOUT = -1;

    public Callout {
        text = text == null ? "" : text;
    }

    public boolean isNumeric() {
        return number >= 0;
    }

    @Override
    public String type() {
        return "callout";
    }
}
