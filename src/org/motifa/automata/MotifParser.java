/* @LICENSE@
 */
package org.motifa.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Turns raw pattern text into the structured parameters of each automaton.
 * All methods upper case their input first.
 * <p>
 * Pattern formats:
 * <ul>
 * <li>{@link AutomatonStyle#DFA}: a literal motif, e.g. <code>ATG</code>;
 * may be empty.</li>
 * <li>{@link AutomatonStyle#NFA}: literal motifs separated by
 * <code>|</code>, e.g. <code>ATG|TAA|TGA</code>.</li>
 * <li>{@link AutomatonStyle#ENFA}: <code>HEAD{min,max}TAIL</code> or
 * <code>HEAD{n}TAIL</code>, e.g. <code>TATA{1,10}TATA</code>, where the
 * bounds are base-10 non-negative integers.</li>
 * <li>{@link AutomatonStyle#PDA}: free text, not used for detection.</li>
 * </ul>
 */
public final class MotifParser {

    private MotifParser() {
    } // never instantiated

    public static final char ALTERNATION = '|';

    static String upper(String pattern) {
        return pattern == null ? "" : pattern.toUpperCase(Locale.ROOT);
    }

    public static String parseLiteral(String pattern) {
        return upper(pattern);
    }

    /**
     * Splits on {@link #ALTERNATION}, dropping empty motifs. A pattern with no
     * motif at all yields a single empty alternative.
     */
    public static List<String> parseAlternatives(String pattern) {
        List<String> alternatives = new ArrayList<String>();
        String s = upper(pattern);
        int from = 0;
        while (from <= s.length()) {
            int bar = s.indexOf(ALTERNATION, from);
            if (bar < 0) bar = s.length();
            if (bar > from) alternatives.add(s.substring(from, bar));
            from = bar + 1;
        }
        if (alternatives.isEmpty()) alternatives.add("");
        return Collections.unmodifiableList(alternatives);
    }

    /**
     * @throws InvalidPatternException
     *             if the braces are missing, repeated or unbalanced, if a
     *             bound is not a non-negative base-10 integer, if
     *             <code>min &gt; max</code>, if the head or tail holds a
     *             non-base, or if both head and tail are empty.
     */
    public static SpacerPattern parseSpacer(String pattern) {
        final String s = upper(pattern);
        int open = s.indexOf('{');
        int close = s.indexOf('}');
        if (open < 0 || close < 0) {
            throw new InvalidPatternException(
                "Expected HEAD{min,max}TAIL, e.g. TATA{1,10}TATA", s,
                open < 0 ? -1 : s.length());
        }
        if (close < open) {
            throw new InvalidPatternException("Unbalanced '}'", s, close);
        }
        int extra = firstBrace(s, close + 1);
        if (extra < 0) {
            int inner = s.indexOf('{', open + 1);
            if (inner >= 0 && inner < close) extra = inner;
        }
        if (extra >= 0) {
            throw new InvalidPatternException("Only one spacer allowed", s, extra);
        }
        String head = s.substring(0, open);
        String tail = s.substring(close + 1);
        checkBases(head, s, 0);
        checkBases(tail, s, close + 1);
        if (head.length() == 0 && tail.length() == 0) {
            throw new InvalidPatternException(
                "Head and tail may not both be empty", s, 0);
        }

        String range = s.substring(open + 1, close);
        int comma = range.indexOf(',');
        int minGap;
        int maxGap;
        if (comma < 0) {
            minGap = maxGap = bound(range, s, open + 1);
        } else {
            minGap = bound(range.substring(0, comma), s, open + 1);
            maxGap = bound(range.substring(comma + 1), s, open + comma + 2);
        }
        if (maxGap < minGap) {
            throw new InvalidPatternException(
                "Invalid spacer range: min " + minGap + " > max " + maxGap,
                s, open + 1);
        }
        return new SpacerPattern(head, minGap, maxGap, tail);
    }

    private static int firstBrace(String s, int from) {
        for (int i = from; i < s.length(); ++i) {
            char c = s.charAt(i);
            if (c == '{' || c == '}') return i;
        }
        return -1;
    }

    private static void checkBases(String motif, String s, int offset) {
        for (int i = 0; i < motif.length(); ++i) {
            if (!Bases.isBase(motif.charAt(i))) {
                throw new InvalidPatternException(
                    "Illegal base '" + motif.charAt(i) + "'", s, offset + i);
            }
        }
    }

    private static int bound(String digits, String s, int index) {
        if (digits.length() == 0) {
            throw new InvalidPatternException("Missing spacer bound", s, index);
        }
        for (int i = 0; i < digits.length(); ++i) {
            if (digits.charAt(i) < '0' || digits.charAt(i) > '9') {
                throw new InvalidPatternException(
                    "Spacer bound is not a non-negative integer", s, index + i);
            }
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new InvalidPatternException(
                "Spacer bound out of range", s, index, e);
        }
    }

    /**
     * The checks applied to user input before an automaton is built: the
     * finite automata require a motif, and literal motifs may hold bases only
     * (plus {@link #ALTERNATION} for {@link AutomatonStyle#NFA}). Spacer
     * syntax is checked by {@link #parseSpacer(String)}; the
     * {@link AutomatonStyle#PDA} accepts anything.
     *
     * @throws InvalidPatternException
     *             on the first violation.
     */
    public static void validate(AutomatonStyle style, String pattern) {
        String s = upper(pattern);
        if (style == AutomatonStyle.PDA) return;
        if (s.length() == 0) {
            throw new InvalidPatternException(
                "A pattern is required for " + style.tag(), s, -1);
        }
        switch (style) {
        case ENFA:
            parseSpacer(s);
            break;
        case NFA:
        case DFA:
            for (int i = 0; i < s.length(); ++i) {
                char c = s.charAt(i);
                if (Bases.isBase(c)) continue;
                if (c == ALTERNATION && style == AutomatonStyle.NFA) continue;
                throw new InvalidPatternException(style == AutomatonStyle.NFA
                    ? "Pattern may contain only A, T, G, C and '|'"
                    : "Pattern may contain only A, T, G, C", s, i);
            }
            break;
        default:
            throw new AssertionError(style);
        }
    }
}
