package com.regolith.core.ast;

/**
 * Inline flag modifier: global {@code (?i)} or scoped {@code (?i:...)}.
 *
 * @param enable flag letters switched on (empty when none)
 * @param disable flag letters switched off (empty when none)
 * @param regexp scoped content, or {@code null} for the global form
 */
public record InlineModifier(String enable, String disable, Regexp regexp) implements Node {

    public InlineModifier {
        enable = enable == null ? "" : enable;
        disable = disable == null ? "" : disable;
    }

    public boolean isScoped() {
        return regexp != null;
    }

    @Override
    public String type() {
        return "inline_modifier";
    }
}
