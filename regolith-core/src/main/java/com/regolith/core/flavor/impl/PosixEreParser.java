package com.regolith.core.flavor.impl;

import com.regolith.core.ast.Anchor;
import com.regolith.core.ast.AnchorType;
import com.regolith.core.ast.AnyCharacter;
import com.regolith.core.ast.Charset;
import com.regolith.core.ast.CharsetItem;
import com.regolith.core.ast.CharsetLiteral;
import com.regolith.core.ast.CharsetRange;
import com.regolith.core.ast.Literal;
import com.regolith.core.ast.Match;
import com.regolith.core.ast.MatchFragment;
import com.regolith.core.ast.Node;
import com.regolith.core.ast.PosixClass;
import com.regolith.core.ast.Regexp;
import com.regolith.core.ast.Repeat;
import com.regolith.core.ast.Subexp;
import com.regolith.core.flavor.RegexParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser for POSIX Extended Regular Expressions.
 *
 * <p>One instance parses one pattern; create a new parser per call.
 *
 * <pre>
 * regexp     := branch ('|' branch)*
 * branch     := piece*
 * piece      := atom quantifier?
 * atom       := '(' regexp ')' | bracket | '.' | '^' | '$' | '\' char | char
 * quantifier := '*' | '+' | '?' | '{' n '}' | '{' n ',' '}' | '{' n ',' m '}'
 * </pre>
 */
final class PosixEreParser {

    /** RE_DUP_MAX from IEEE Std 1003.1. */
    static final int MAX_REPEAT = 255;

    static final Set<String> POSIX_CLASSES = Set.of(
        "alnum", "alpha", "blank", "cntrl", "digit", "graph",
        "lower", "print", "punct", "space", "upper", "xdigit"
    );

    private static final String METACHARACTERS = ".[]()*+?{}|^$\\";

    private static final Map<Character, String> UNSUPPORTED_CLASS_ESCAPES = Map.of(
        'd', "use [[:digit:]]",
        'D', "use [^[:digit:]]",
        'w', "use [[:alnum:]_]",
        'W', "use [^[:alnum:]_]",
        's', "use [[:space:]]",
        'S', "use [^[:space:]]"
    );

    private static final Map<Character, String> CONTROL_ESCAPES = Map.of(
        'n', "newline",
        't', "tab",
        'r', "carriage return",
        'f', "form feed",
        'v', "vertical tab"
    );

    private final String pattern;
    private int pos;
    private int groupCount;

    PosixEreParser(String pattern) {
        this.pattern = pattern;
    }

    /**
     * Parses the whole pattern.
     *
     * @return root expression
     * @throws RegexParseException if the pattern is not valid POSIX ERE
     */
    Regexp parse() throws RegexParseException {
        Regexp regexp = parseAlternation();
        if (more()) {
            // Only an unmatched ')' stops the top-level alternation early
            throw error("unmatched ')'", pos);
        }
        return regexp;
    }

    private Regexp parseAlternation() throws RegexParseException {
        List<Match> matches = new ArrayList<>();
        matches.add(parseBranch());
        while (match('|')) {
            matches.add(parseBranch());
        }
        return new Regexp(matches, "", List.of());
    }

    private Match parseBranch() throws RegexParseException {
        List<MatchFragment> fragments = new ArrayList<>();
        StringBuilder pendingText = new StringBuilder();

        while (more() && !peek("|)")) {
            Node atom = parseAtom();
            Repeat repeat = parseQuantifier();

            if (atom instanceof Literal literal && repeat == null) {
                pendingText.append(literal.text());
                continue;
            }
            flushLiteral(pendingText, fragments);
            fragments.add(repeat == null ? MatchFragment.of(atom) : MatchFragment.repeated(atom, repeat));
        }
        flushLiteral(pendingText, fragments);
        return new Match(fragments);
    }

    private static void flushLiteral(StringBuilder pendingText, List<MatchFragment> fragments) {
        if (pendingText.length() > 0) {
            fragments.add(MatchFragment.of(new Literal(pendingText.toString())));
            pendingText.setLength(0);
        }
    }

    private Node parseAtom() throws RegexParseException {
        int start = pos;
        char c = pattern.charAt(pos);
        switch (c) {
            case '(':
                return parseGroup();
            case '[':
                return parseBracket();
            case '.':
                pos++;
                return new AnyCharacter();
            case '^':
                pos++;
                return new Anchor(AnchorType.START);
            case '$':
                pos++;
                return new Anchor(AnchorType.END);
            case '\\':
                return parseEscape();
            case '*':
            case '+':
            case '?':
                throw error("dangling quantifier '" + c + "': nothing to repeat", start);
            case '{':
                if (startsInterval()) {
                    throw error("dangling quantifier '{': nothing to repeat", start);
                }
                pos++;
                return new Literal("{");
            default:
                return new Literal(nextCodePointAsString());
        }
    }

    private Node parseGroup() throws RegexParseException {
        int open = pos;
        pos++;
        int number = ++groupCount;
        Regexp body = parseAlternation();
        if (!match(')')) {
            throw error("unmatched '('", open);
        }
        return Subexp.capture(number, body);
    }

    private Node parseEscape() throws RegexParseException {
        int start = pos;
        pos++;
        if (!more()) {
            throw error("trailing backslash", start);
        }
        char c = pattern.charAt(pos);

        if (UNSUPPORTED_CLASS_ESCAPES.containsKey(c)) {
            throw error("\\" + c + " is not supported in POSIX ERE; "
                + UNSUPPORTED_CLASS_ESCAPES.get(c), start);
        }
        if (c == 'b' || c == 'B') {
            throw error("\\" + c + " (word boundary) is not supported in POSIX ERE", start);
        }
        if (c >= '1' && c <= '9') {
            throw error("back-reference \\" + c + " is not supported in POSIX ERE", start);
        }
        if (CONTROL_ESCAPES.containsKey(c)) {
            throw error("\\" + c + " is not a standard POSIX ERE escape; write a literal "
                + CONTROL_ESCAPES.get(c) + " instead", start);
        }
        if (METACHARACTERS.indexOf(c) >= 0) {
            pos++;
            return new Literal(String.valueOf(c));
        }
        // Undefined escapes of ordinary characters match the character itself
        return new Literal(nextCodePointAsString());
    }

    private Node parseBracket() throws RegexParseException {
        int open = pos;
        pos++;
        boolean inverted = match('^');
        List<CharsetItem> items = new ArrayList<>();
        boolean first = true;

        while (true) {
            if (!more()) {
                throw error("unterminated bracket expression", open);
            }
            if (!first && match(']')) {
                break;
            }
            first = false;

            if (pattern.startsWith("[:", pos)) {
                items.add(parsePosixClass());
            } else if (pattern.startsWith("[=", pos) || pattern.startsWith("[.", pos)) {
                throw error("collating symbols and equivalence classes are not supported", pos);
            } else {
                items.add(parseBracketCharacter());
            }
        }
        return new Charset(inverted, items);
    }

    private CharsetItem parsePosixClass() throws RegexParseException {
        int start = pos;
        int close = pattern.indexOf(":]", pos + 2);
        if (close < 0) {
            throw error("unterminated POSIX class", start);
        }
        String name = pattern.substring(pos + 2, close);
        boolean negated = name.startsWith("^");
        if (negated) {
            name = name.substring(1);
        }
        if (!POSIX_CLASSES.contains(name)) {
            throw error("unknown POSIX class '[:" + name + ":]'", start);
        }
        pos = close + 2;
        return new PosixClass(name, negated);
    }

    private CharsetItem parseBracketCharacter() throws RegexParseException {
        int start = pos;
        int first = nextCodePoint();
        if (pos + 1 < pattern.length() && pattern.charAt(pos) == '-' && pattern.charAt(pos + 1) != ']') {
            pos++;
            int last = nextCodePoint();
            if (last < first) {
                throw error("reversed range '" + pattern.substring(start, pos) + "'", start);
            }
            return new CharsetRange(Character.toString(first), Character.toString(last));
        }
        return new CharsetLiteral(Character.toString(first));
    }

    private Repeat parseQuantifier() throws RegexParseException {
        Repeat repeat = parseSingleQuantifier();
        if (repeat != null && more() && (peek("*+?") || startsInterval())) {
            throw error("quantifier '" + pattern.charAt(pos) + "' cannot follow another quantifier", pos);
        }
        return repeat;
    }

    private Repeat parseSingleQuantifier() throws RegexParseException {
        if (match('*')) {
            return Repeat.zeroOrMore();
        }
        if (match('+')) {
            return Repeat.oneOrMore();
        }
        if (match('?')) {
            return Repeat.optional();
        }
        if (startsInterval()) {
            return parseInterval();
        }
        return null;
    }

    private Repeat parseInterval() throws RegexParseException {
        int open = pos;
        pos++;
        int min = parseCount(open);
        int max = min;
        if (match(',')) {
            max = more() && Character.isDigit(pattern.charAt(pos)) ? parseCount(open) : Repeat.UNBOUNDED;
        }
        if (!match('}')) {
            throw error("invalid interval: expected '}'", open);
        }
        if (max != Repeat.UNBOUNDED && max < min) {
            throw error("invalid interval " + pattern.substring(open, pos)
                + ": minimum is greater than maximum", open);
        }
        return new Repeat(min, max, true, false);
    }

    private int parseCount(int open) throws RegexParseException {
        int start = pos;
        while (more() && Character.isDigit(pattern.charAt(pos))) {
            pos++;
        }
        String digits = pattern.substring(start, pos);
        if (digits.length() > 3 || Integer.parseInt(digits) > MAX_REPEAT) {
            throw error("invalid interval: count " + digits + " exceeds " + MAX_REPEAT, open);
        }
        return Integer.parseInt(digits);
    }

    /** A '{' only opens an interval when a digit follows it. */
    private boolean startsInterval() {
        return pos + 1 < pattern.length()
            && pattern.charAt(pos) == '{'
            && Character.isDigit(pattern.charAt(pos + 1));
    }

    private boolean more() {
        return pos < pattern.length();
    }

    private boolean peek(String chars) {
        return more() && chars.indexOf(pattern.charAt(pos)) != -1;
    }

    private boolean match(char c) {
        if (more() && pattern.charAt(pos) == c) {
            pos++;
            return true;
        }
        return false;
    }

    private int nextCodePoint() {
        int cp = pattern.codePointAt(pos);
        pos += Character.charCount(cp);
        return cp;
    }

    private String nextCodePointAsString() {
        return Character.toString(nextCodePoint());
    }

    private RegexParseException error(String message, int offset) {
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < offset; i++) {
            if (pattern.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new RegexParseException(message, line, offset - lineStart + 1);
    }
}
