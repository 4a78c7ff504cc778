/* @LICENSE@
 */
package org.motifa.automata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Represents each kind of motif recognizer. This enum class is also the
 * factory for {@link MotifAutomaton}s: each constant builds its own kind, and
 * {@link #create(String, String)} dispatches on a textual type tag.
 */
public enum AutomatonStyle {

    /**
     * Exact literal matching, see {@link LiteralDfa}.
     */
    DFA("DFA", "DFA – Exact literal matching") {
        @Override
        public LiteralDfa newAutomaton(String pattern) {
            return new LiteralDfa(pattern);
        }
    },

    /**
     * Alternatives, e.g. <code>ATG|TAA|TGA</code>; see {@link AlternativesNfa}.
     */
    NFA("NFA", "NFA – Alternatives (ATG|TAA|TGA)") {
        @Override
        public AlternativesNfa newAutomaton(String pattern) {
            return new AlternativesNfa(pattern);
        }
    },

    /**
     * Head, bounded spacer, tail, e.g. <code>TATA{1,10}TATA</code>; see
     * {@link SpacerEnfa}.
     */
    ENFA("Epsilon-NFA", "ε-NFA – Spacer ranges (TATA{1,10}TATA)") {
        @Override
        public SpacerEnfa newAutomaton(String pattern) {
            return new SpacerEnfa(pattern);
        }
    },

    /**
     * Complement palindromes; see {@link HairpinPda}. A missing pattern
     * becomes {@link HairpinPda#DEFAULT_PATTERN}.
     */
    PDA("PDA", "PDA – Complement palindromes (hairpins)") {
        @Override
        public HairpinPda newAutomaton(String pattern) {
            return new HairpinPda(pattern == null || pattern.length() == 0
                ? HairpinPda.DEFAULT_PATTERN : pattern);
        }
    };

    private static final Logger logger = Logger.getLogger("org.motifa.automata");
    private static final Level level = Level.FINEST;

    /**
     * A runtime exception thrown when a type tag names none of the styles.
     */
    public static final class UnsupportedTypeException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final String tag;

        public UnsupportedTypeException(String tag) {
            super("Unsupported automata type: " + tag);
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }

    private final String tag;
    private final String label;

    AutomatonStyle(String tag, String label) {
        this.tag = tag;
        this.label = label;
    }

    /**
     * @return the type tag, e.g. <code>Epsilon-NFA</code>.
     */
    public String tag() {
        return tag;
    }

    /**
     * @return a human readable label for menus.
     */
    public String label() {
        return label;
    }

    /**
     * Builds an automaton of this style.
     *
     * @throws InvalidPatternException
     *             if the pattern cannot be parsed for this style.
     */
    public abstract MotifAutomaton<?> newAutomaton(String pattern);

    /**
     * @throws UnsupportedTypeException
     *             if no style has the tag.
     */
    public static AutomatonStyle forTag(String tag) {
        for (AutomatonStyle style : values()) {
            if (style.tag.equals(tag)) return style;
        }
        throw new UnsupportedTypeException(tag);
    }

    /**
     * Builds the automaton named by a type tag. Parse failures of the pattern
     * propagate unchanged.
     *
     * @throws UnsupportedTypeException
     *             if no style has the tag.
     * @throws InvalidPatternException
     *             if the pattern cannot be parsed for the style.
     */
    public static MotifAutomaton<?> create(String tag, String pattern) {
        AutomatonStyle style = forTag(tag);
        logger.log(level, "AutomatonStyle selected: " + style + ", pattern: " + pattern);
        return style.newAutomaton(pattern);
    }

    /**
     * @return (tag, label) pairs in declaration order, for menus.
     */
    public static Map<String, String> labels() {
        Map<String, String> ret = new LinkedHashMap<String, String>();
        for (AutomatonStyle style : values()) {
            ret.put(style.tag, style.label);
        }
        return Collections.unmodifiableMap(ret);
    }
}
