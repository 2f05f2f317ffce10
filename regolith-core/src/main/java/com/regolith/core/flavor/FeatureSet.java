package com.regolith.core.flavor;

import java.util.ArrayList;
import java.util.List;

/**
 * Syntax features a flavor accepts.
 *
 * <p>Informational only: the renderer draws any tree it is given. The CLI prints these
 * when listing flavors.
 *
 * @param lookahead supports {@code (?=...)} and {@code (?!...)}
 * @param lookbehind supports {@code (?<=...)} and {@code (?<!...)}
 * @param lookbehindUnlimited supports variable-length lookbehind
 * @param namedGroups supports named capture groups
 * @param atomicGroups supports atomic groups {@code (?>...)}
 * @param possessiveQuantifiers supports possessive quantifiers {@code *+ ++ ?+}
 * @param recursivePatterns supports recursion {@code (?R)}, {@code (?1)}, {@code (?&name)}
 * @param conditionalPatterns supports conditionals {@code (?(cond)yes|no)}
 * @param unicodeProperties supports {@code \p{...}} and {@code \P{...}}
 * @param posixClasses supports POSIX classes such as {@code [:alpha:]}
 * @param balancedGroups supports balancing groups {@code (?<name-other>...)}
 * @param inlineModifiers supports inline modifiers such as {@code (?i)}
 * @param comments supports comment groups {@code (?#...)}
 * @param branchReset supports branch reset groups {@code (?|...)}
 * @param backtrackingControl supports backtracking control verbs such as {@code (*PRUNE)}
 */
public record FeatureSet(
    boolean lookahead,
    boolean lookbehind,
    boolean lookbehindUnlimited,
    boolean namedGroups,
    boolean atomicGroups,
    boolean possessiveQuantifiers,
    boolean recursivePatterns,
    boolean conditionalPatterns,
    boolean unicodeProperties,
    boolean posixClasses,
    boolean balancedGroups,
    boolean inlineModifiers,
    boolean comments,
    boolean branchReset,
    boolean backtrackingControl
) {

    /**
     * Creates a feature set with every feature disabled.
     *
     * @return empty feature set
     */
    public static FeatureSet none() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the names of the enabled features, in declaration order.
     *
     * @return enabled feature names
     */
    public List<String> enabledFeatures() {
        List<String> enabled = new ArrayList<>();
        if (lookahead) {
            enabled.add("lookahead");
        }
        if (lookbehind) {
            enabled.add("lookbehind");
        }
        if (lookbehindUnlimited) {
            enabled.add("lookbehindUnlimited");
        }
        if (namedGroups) {
            enabled.add("namedGroups");
        }
        if (atomicGroups) {
            enabled.add("atomicGroups");
        }
        if (possessiveQuantifiers) {
            enabled.add("possessiveQuantifiers");
        }
        if (recursivePatterns) {
            enabled.add("recursivePatterns");
        }
        if (conditionalPatterns) {
            enabled.add("conditionalPatterns");
        }
        if (unicodeProperties) {
            enabled.add("unicodeProperties");
        }
        if (posixClasses) {
            enabled.add("posixClasses");
        }
        if (balancedGroups) {
            enabled.add("balancedGroups");
        }
        if (inlineModifiers) {
            enabled.add("inlineModifiers");
        }
        if (comments) {
            enabled.add("comments");
        }
        if (branchReset) {
            enabled.add("branchReset");
        }
        if (backtrackingControl) {
            enabled.add("backtrackingControl");
        }
        return enabled;
    }

    /**
     * Builder for {@link FeatureSet}; every feature starts disabled.
     */
    public static class Builder {
        private boolean lookahead;
        private boolean lookbehind;
        private boolean lookbehindUnlimited;
        private boolean namedGroups;
        private boolean atomicGroups;
        private boolean possessiveQuantifiers;
        private boolean recursivePatterns;
        private boolean conditionalPatterns;
        private boolean unicodeProperties;
        private boolean posixClasses;
        private boolean balancedGroups;
        private boolean inlineModifiers;
        private boolean comments;
        private boolean branchReset;
        private boolean backtrackingControl;

        public Builder lookahead(boolean value) {
            this.lookahead = value;
            return this;
        }

        public Builder lookbehind(boolean value) {
            this.lookbehind = value;
            return this;
        }

        public Builder lookbehindUnlimited(boolean value) {
            this.lookbehindUnlimited = value;
            return this;
        }

        public Builder namedGroups(boolean value) {
            this.namedGroups = value;
            return this;
        }

        public Builder atomicGroups(boolean value) {
            this.atomicGroups = value;
            return this;
        }

        public Builder possessiveQuantifiers(boolean value) {
            this.possessiveQuantifiers = value;
            return this;
        }

        public Builder recursivePatterns(boolean value) {
            this.recursivePatterns = value;
            return this;
        }

        public Builder conditionalPatterns(boolean value) {
            this.conditionalPatterns = value;
            return this;
        }

        public Builder unicodeProperties(boolean value) {
            this.unicodeProperties = value;
            return this;
        }

        public Builder posixClasses(boolean value) {
            this.posixClasses = value;
            return this;
        }

        public Builder balancedGroups(boolean value) {
            this.balancedGroups = value;
            return this;
        }

        public Builder inlineModifiers(boolean value) {
            this.inlineModifiers = value;
            return this;
        }

        public Builder comments(boolean value) {
            this.comments = value;
            return this;
        }

        public Builder branchReset(boolean value) {
            this.branchReset = value;
            return this;
        }

        public Builder backtrackingControl(boolean value) {
            this.backtrackingControl = value;
            return this;
        }

        public FeatureSet build() {
            return new FeatureSet(
                lookahead, lookbehind, lookbehindUnlimited,
                namedGroups, atomicGroups, possessiveQuantifiers,
                recursivePatterns, conditionalPatterns, unicodeProperties,
                posixClasses, balancedGroups, inlineModifiers,
                comments, branchReset, backtrackingControl
            );
        }
    }
}
