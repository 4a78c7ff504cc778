/* @LICENSE@
 */
package org.motifa.automata;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Recognizer for complement palindromes, the reverse-complement symmetric
 * spans (e.g. <code>GAATTC</code>) that let a strand fold back on itself into
 * a hairpin.
 * <p>
 * Detection is done entirely by {@link #findAllMatches(CharSequence)}, which
 * expands outwards from every center between two adjacent bases while the
 * left base pairs with the right one. Only even length spans are found; an odd
 * length one would need a self-complementary center base, and there is none.
 * <p>
 * {@link #step(char)} only keeps a transition log for display: each base is
 * pushed onto a small stack, which slides (drops its oldest base) once it
 * holds more than {@link #STACK_LIMIT} bases. The stack is never consulted for
 * detection, and <code>step</code> never reports a match.
 * <p>
 * The pattern text is kept for display only.
 */
public final class HairpinPda extends MotifAutomaton<HairpinPda.Mode> {

    private static final Logger logger = Logger.getLogger("org.motifa.automata");
    private static final Level level = Level.FINEST;

    /**
     * Coarse control state of the logging stack.
     */
    public enum Mode {
        PUSH("push"), POP("pop");

        private final String label;

        Mode(String label) {
            this.label = label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    public static final String DEFAULT_PATTERN = "PALINDROME";
    public static final int DEFAULT_MIN_LENGTH = 4;
    public static final int STACK_LIMIT = 8;

    private final int minLength;
    private final Deque<Character> stack = new ArrayDeque<Character>();
    private Mode mode = Mode.PUSH;
    private int position = 0;

    public HairpinPda(String pattern) {
        this(pattern, DEFAULT_MIN_LENGTH);
    }

    /**
     * @param minLength
     *            the shortest span reported; values below 2 are raised to 2.
     */
    public HairpinPda(String pattern, int minLength) {
        super(AutomatonStyle.PDA, pattern);
        this.minLength = Math.max(2, minLength);
        logger.log(level, "built " + this);
    }

    public int minLength() {
        return minLength;
    }

    /**
     * @return the stack contents, oldest base first.
     */
    public List<Character> stack() {
        return Collections.unmodifiableList(new ArrayList<Character>(stack));
    }

    public Mode mode() {
        return mode;
    }

    /**
     * @return the number of bases pushed since the last reset.
     */
    public int position() {
        return position;
    }

    @Override
    public void reset() {
        stack.clear();
        position = 0;
        mode = Mode.PUSH;
    }

    @Override
    public StepResult<Mode> step(char symbol) {
        final char c = Character.toUpperCase(symbol);
        if (!Bases.isBase(c)) {
            return new StepResult<Mode>(currentStates(), false, ignored(c));
        }
        String before = Misc.stringOf(stack);
        String action = "PUSH";
        stack.addLast(c);
        ++position;
        if (stack.size() > STACK_LIMIT) {
            mode = Mode.POP;
            stack.removeFirst();
            action = "SHIFT";
        } else {
            mode = Mode.PUSH;
        }
        String desc = "Read '" + c + "': mode=" + mode + ", " + action
            + ", stack=" + before + " -> " + Misc.stringOf(stack);
        return new StepResult<Mode>(currentStates(), false, desc);
    }

    /**
     * Center expansion over every adjacent pair <code>(i, i+1)</code>: the
     * maximal span around the center in which each base pairs with its mirror
     * is reported if it holds at least {@link #minLength()} bases. Results are
     * distinct and ascending. Leaves the stack untouched.
     */
    @Override
    public List<Interval> findAllMatches(CharSequence sequence) {
        final String s = MotifParser.upper(sequence.toString());
        final int n = s.length();
        SortedSet<Interval> found = new TreeSet<Interval>();
        for (int i = 0; i + 1 < n; ++i) {
            int l = i;
            int r = i + 1;
            while (l >= 0 && r < n && Bases.complement(s.charAt(l)) == s.charAt(r)) {
                --l;
                ++r;
            }
            // last pairing positions were (l+1, r-1)
            if ((r - 1) - (l + 1) + 1 >= minLength) {
                found.add(new Interval(l + 1, r - 1));
            }
        }
        return new ArrayList<Interval>(found);
    }

    @Override
    public String describe(Set<Mode> states) {
        if (mode == Mode.POP) {
            return "Stack sliding (size " + stack.size() + ")";
        }
        return "Scanning (stack " + stack.size() + ")";
    }

    @Override
    public List<Mode> states() {
        return Arrays.asList(Mode.values());
    }

    @Override
    public SortedSet<Mode> initialStates() {
        return Collections.unmodifiableSortedSet(
            new TreeSet<Mode>(Collections.singleton(Mode.PUSH)));
    }

    /**
     * @return the empty set; acceptance is not decided step-wise.
     */
    @Override
    public SortedSet<Mode> acceptStates() {
        return Collections.unmodifiableSortedSet(new TreeSet<Mode>());
    }

    @Override
    public SortedSet<Mode> currentStates() {
        return Collections.unmodifiableSortedSet(
            new TreeSet<Mode>(Collections.singleton(mode)));
    }

    @Override
    public String label(Mode state) {
        return state.toString();
    }

    /**
     * The control moves of the logging stack: every base keeps a pushing
     * stack pushing or starts it sliding, and a sliding stack keeps sliding.
     */
    @Override
    public SortedMap<Edge<Mode>, SortedSet<Mode>> transitions() {
        SortedMap<Edge<Mode>, SortedSet<Mode>> ret =
            new TreeMap<Edge<Mode>, SortedSet<Mode>>();
        for (char a : Bases.symbols()) {
            ret.put(Edge.on(Mode.PUSH, a),
                new TreeSet<Mode>(Arrays.asList(Mode.PUSH, Mode.POP)));
            ret.put(Edge.on(Mode.POP, a),
                new TreeSet<Mode>(Collections.singleton(Mode.POP)));
        }
        return ret;
    }

    @Override
    protected String doToString() {
        return pattern + " (min length " + minLength + ")";
    }
}
