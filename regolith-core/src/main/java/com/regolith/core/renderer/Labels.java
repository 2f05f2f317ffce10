package com.regolith.core.renderer;

import com.regolith.core.ast.AnchorType;
import com.regolith.core.ast.BackReference;
import com.regolith.core.ast.BacktrackControl;
import com.regolith.core.ast.BalancedGroup;
import com.regolith.core.ast.Callout;
import com.regolith.core.ast.Charset;
import com.regolith.core.ast.CharsetItem;
import com.regolith.core.ast.CharsetLiteral;
import com.regolith.core.ast.CharsetOperation;
import com.regolith.core.ast.CharsetRange;
import com.regolith.core.ast.Escape;
import com.regolith.core.ast.GroupType;
import com.regolith.core.ast.InlineModifier;
import com.regolith.core.ast.Literal;
import com.regolith.core.ast.Node;
import com.regolith.core.ast.PatternOption;
import com.regolith.core.ast.PosixClass;
import com.regolith.core.ast.RecursiveRef;
import com.regolith.core.ast.Repeat;
import com.regolith.core.ast.Subexp;
import com.regolith.core.ast.UnicodePropertyEscape;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Human-readable captions for diagram boxes.
 */
public final class Labels {

    private static final Map<String, String> POSIX_CLASS_LABELS = Map.ofEntries(
        Map.entry("alnum", "alphanumeric"),
        Map.entry("alpha", "alphabetic"),
        Map.entry("blank", "blank (space/tab)"),
        Map.entry("cntrl", "control character"),
        Map.entry("digit", "digit"),
        Map.entry("graph", "visible character"),
        Map.entry("lower", "lowercase"),
        Map.entry("print", "printable"),
        Map.entry("punct", "punctuation"),
        Map.entry("space", "whitespace"),
        Map.entry("upper", "uppercase"),
        Map.entry("xdigit", "hex digit")
    );

    private static final Map<Character, String> FLAG_LABELS = Map.of(
        'd', "hasIndices",
        'g', "global",
        'i', "ignore case",
        'm', "multiline",
        's', "dotAll",
        'u', "unicode",
        'v', "unicodeSets",
        'y', "sticky"
    );

    private Labels() {
    }

    public static String anchor(AnchorType type) {
        return switch (type) {
            case START -> "Start of line";
            case END -> "End of line";
            case WORD_BOUNDARY -> "Word boundary";
            case NON_WORD_BOUNDARY -> "Non-word boundary";
            case WORD_START -> "Start of word";
            case WORD_END -> "End of word";
            case STRING_START -> "Start of input";
            case STRING_END -> "End of input";
            case ABSOLUTE_END -> "Absolute end";
            case END_OF_PREVIOUS_MATCH -> "End of previous match";
            case GRAPHEME_CLUSTER_BOUNDARY -> "Grapheme cluster boundary";
        };
    }

    public static String backReference(BackReference ref) {
        if (ref.isNamed()) {
            return "back reference '" + ref.name() + "'";
        }
        return "back reference #" + ref.number();
    }

    public static String unicodeProperty(UnicodePropertyEscape escape) {
        return (escape.negated() ? "NOT Unicode " : "Unicode ") + escape.property();
    }

    /**
     * Describes a recursion target: {@code R} and {@code 0} mean the whole pattern,
     * signed or unsigned digits a group number, anything else a group name.
     */
    public static String recursiveRef(RecursiveRef ref) {
        String target = ref.target();
        if (target.equals("R") || target.equals("0")) {
            return "recurse whole pattern";
        }
        if (target.isEmpty()) {
            return "recurse";
        }
        char first = target.charAt(0);
        if (first == '+' || first == '-' || Character.isDigit(first)) {
            return "recurse to group " + target;
        }
        return "recurse to '" + target + "'";
    }

    public static String backtrackControl(BacktrackControl control) {
        String arg = control.arg();
        boolean hasArg = control.hasArg();
        return switch (control.verb()) {
            case "ACCEPT" -> "accept match";
            case "FAIL" -> "force fail";
            case "MARK" -> hasArg ? "mark '" + arg + "'" : "mark";
            case "COMMIT" -> "commit (no retry)";
            case "PRUNE" -> hasArg ? "prune '" + arg + "'" : "prune";
            case "SKIP" -> hasArg ? "skip to '" + arg + "'" : "skip";
            case "THEN" -> hasArg ? "then '" + arg + "'" : "then (try next alt)";
            default -> hasArg ? "*" + control.verb() + ":" + arg : "*" + control.verb();
        };
    }

    public static String callout(Callout callout) {
        if (callout.isNumeric()) {
            return "callout (" + callout.number() + ")";
        }
        return "callout \"" + callout.text() + "\"";
    }

    public static String group(Subexp group) {
        GroupType type = group.groupType();
        return switch (type) {
            case CAPTURE -> "group #" + group.number();
            case NAMED_CAPTURE -> "group #" + group.number() + " '" + group.name() + "'";
            case NON_CAPTURE -> "non-capturing group";
            case POSITIVE_LOOKAHEAD -> "positive lookahead";
            case NEGATIVE_LOOKAHEAD -> "negative lookahead";
            case POSITIVE_LOOKBEHIND -> "positive lookbehind";
            case NEGATIVE_LOOKBEHIND -> "negative lookbehind";
            case NON_ATOMIC_POSITIVE_LOOKAHEAD -> "non-atomic lookahead";
            case NON_ATOMIC_POSITIVE_LOOKBEHIND -> "non-atomic lookbehind";
            case ATOMIC -> "atomic group";
            case SCRIPT_RUN -> "script run";
            case ATOMIC_SCRIPT_RUN -> "atomic script run";
        };
    }

    public static String balancedGroup(BalancedGroup group) {
        if (group.isCapturing()) {
            return "balanced group '" + group.name() + "' (pop '" + group.otherName() + "')";
        }
        return "balance (pop '" + group.otherName() + "')";
    }

    public static String inlineModifier(InlineModifier modifier) {
        String enable = modifier.enable();
        String disable = modifier.disable();
        if (!enable.isEmpty() && !disable.isEmpty()) {
            return "flags: +" + enable + " -" + disable;
        }
        if (!enable.isEmpty()) {
            return "flags: +" + enable;
        }
        if (!disable.isEmpty()) {
            return "flags: -" + disable;
        }
        return "flags";
    }

    /**
     * Describes the test of a conditional group.
     *
     * @param condition the condition node
     * @return caption for the conditional box
     */
    public static String condition(Node condition) {
        if (condition instanceof BackReference ref) {
            if (ref.isNamed()) {
                return "if '" + ref.name() + "' matched";
            }
            return "if group " + Math.abs(ref.number()) + " matched";
        }
        if (condition instanceof RecursiveRef ref) {
            String target = ref.target();
            if (target.equals("R")) {
                return "if in recursion";
            }
            if (target.equals("DEFINE") || target.isEmpty()) {
                return "DEFINE";
            }
            return "if in recursion to '" + target + "'";
        }
        if (condition instanceof Literal literal) {
            return literal.text().equals("DEFINE") ? "DEFINE" : "if " + literal.text();
        }
        if (condition instanceof Subexp assertion) {
            return switch (assertion.groupType()) {
                case POSITIVE_LOOKAHEAD -> "if followed by...";
                case NEGATIVE_LOOKAHEAD -> "if not followed by...";
                case POSITIVE_LOOKBEHIND -> "if preceded by...";
                case NEGATIVE_LOOKBEHIND -> "if not preceded by...";
                default -> "if assertion";
            };
        }
        return "if condition";
    }

    /**
     * Returns the caption under a quantifier loop, or an empty string when the loop
     * shape says it all ({@code *}, {@code +}, {@code {1}}).
     *
     * @param repeat the quantifier
     * @return caption, possibly empty
     */
    public static String repeat(Repeat repeat) {
        String label;
        if (repeat.min() == repeat.max()) {
            label = repeat.min() == 1 ? "" : repeat.min() + " times";
        } else if (repeat.isUnbounded()) {
            label = repeat.min() <= 1 ? "" : repeat.min() + "+ times";
        } else {
            label = repeat.min() + " to " + repeat.max() + " times";
        }

        if (repeat.possessive()) {
            return label.isEmpty() ? "possessive" : label + " (possessive)";
        }
        return label;
    }

    public static String posixClass(PosixClass posixClass) {
        String label = POSIX_CLASS_LABELS.getOrDefault(posixClass.name(), posixClass.name());
        return posixClass.negated() ? "NOT " + label : label;
    }

    /**
     * Describes one member of a bracket expression.
     *
     * @param item the member
     * @return one line of the character class box
     */
    public static String charsetItem(CharsetItem item) {
        if (item instanceof CharsetLiteral literal) {
            return "\"" + literal.text() + "\"";
        }
        if (item instanceof CharsetRange range) {
            return "\"" + range.first() + "\" - \"" + range.last() + "\"";
        }
        if (item instanceof Escape escape) {
            return escape.value();
        }
        if (item instanceof PosixClass posixClass) {
            return posixClass(posixClass);
        }
        if (item instanceof CharsetOperation operation) {
            String verb = operation.operator() == CharsetOperation.Operator.INTERSECTION ? "and " : "minus ";
            return verb + charsetSummary(operation.operand());
        }
        return "<" + item.type() + ">";
    }

    /**
     * Summarizes a nested class on one line, e.g. {@code none of "a", "e"}.
     */
    static String charsetSummary(Charset charset) {
        List<String> parts = new ArrayList<>();
        for (CharsetItem item : charset.items()) {
            parts.add(charsetItem(item));
        }
        String joined = String.join(", ", parts);
        return charset.inverted() ? "none of " + joined : joined;
    }

    public static String charsetHeading(Charset charset) {
        return charset.inverted() ? "None of:" : "One of:";
    }

    /**
     * Describes a flag letter. Letters without a known meaning are shown as they are.
     *
     * @param flag flag letter
     * @return description
     */
    public static String flag(char flag) {
        return FLAG_LABELS.getOrDefault(flag, String.valueOf(flag));
    }

    public static List<String> flags(String flags) {
        List<String> labels = new ArrayList<>(flags.length());
        for (int i = 0; i < flags.length(); i++) {
            labels.add(flag(flags.charAt(i)));
        }
        return labels;
    }

    /**
     * Formats pattern-start options as {@code Options: *UTF, *LIMIT_MATCH=10}.
     *
     * @param options options in source order
     * @return banner text
     */
    public static String patternOptions(List<PatternOption> options) {
        List<String> parts = new ArrayList<>(options.size());
        for (PatternOption option : options) {
            parts.add(option.hasValue() ? "*" + option.name() + "=" + option.value() : "*" + option.name());
        }
        return "Options: " + String.join(", ", parts);
    }
}
