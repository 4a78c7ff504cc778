/* @LICENSE@
 */
package org.motifa.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Epsilon-NFA for a head motif, a spacer of <code>min..max</code> arbitrary
 * bases, and a tail motif, written <code>HEAD{min,max}TAIL</code>; e.g.
 * <code>TATA{1,10}TATA</code> for a promoter-like box with flexible spacing.
 * <p>
 * The formal automaton, as reported by {@link #transitions()}, chains the
 * head states to the spacer through an epsilon move from
 * <code>head:|HEAD|</code> to <code>spacer:0</code>. The simulation in
 * {@link #step(char)} does not follow that relation literally: it enters
 * <code>spacer:0</code> directly on the last head symbol, and its only closure
 * is that <code>head:0</code> is re-added before and after every symbol, so a
 * fresh attempt can begin anywhere. Acceptance is <code>tail:|TAIL|</code>
 * being active.
 * <p>
 * {@link #findAllMatches(CharSequence)} is a separate, direct search and does
 * not touch the simulation. It reports one interval per (head position,
 * spacer length) pair, so one head occurrence may yield several overlapping
 * matches where the simulation flags a single accepting step, or none.
 */
public final class SpacerEnfa extends MotifAutomaton<SpacerState> {

    private static final Logger logger = Logger.getLogger("org.motifa.automata");
    private static final Level level = Level.FINEST;

    private static final SpacerState START = SpacerState.head(0);

    private final SpacerPattern spec;
    private final SpacerState accept;
    private SortedSet<SpacerState> current = new TreeSet<SpacerState>();

    /**
     * @throws InvalidPatternException
     *             if the pattern is not of the form <code>HEAD{min,max}TAIL</code>.
     */
    public SpacerEnfa(String pattern) {
        super(AutomatonStyle.ENFA, pattern);
        spec = MotifParser.parseSpacer(pattern);
        accept = SpacerState.tail(spec.tail.length());
        reset();
        logger.log(level, "built " + this + " as " + spec);
    }

    public SpacerPattern spacerPattern() {
        return spec;
    }

    @Override
    public void reset() {
        current = new TreeSet<SpacerState>(Collections.singleton(START));
    }

    private static SortedSet<SpacerState> closure(Set<SpacerState> states) {
        SortedSet<SpacerState> ret = new TreeSet<SpacerState>(states);
        ret.add(START);
        return ret;
    }

    @Override
    public StepResult<SpacerState> step(char symbol) {
        final char c = Character.toUpperCase(symbol);
        if (!Bases.isBase(c)) {
            return new StepResult<SpacerState>(currentStates(), false, ignored(c));
        }
        final String head = spec.head;
        final String tail = spec.tail;
        final SortedSet<SpacerState> prev = closure(current);
        SortedSet<SpacerState> next = new TreeSet<SpacerState>();

        for (SpacerState st : prev) {
            final int k = st.progress();
            switch (st.phase()) {
            case HEAD:
                if (k < head.length() && head.charAt(k) == c) {
                    next.add(k + 1 == head.length()
                        ? SpacerState.spacer(0) : SpacerState.head(k + 1));
                }
                break;
            case SPACER:
                if (k < spec.maxGap) {
                    next.add(SpacerState.spacer(k + 1));
                }
                if (k >= spec.minGap && tail.length() > 0 && tail.charAt(0) == c) {
                    next.add(SpacerState.tail(1));
                }
                break;
            case TAIL:
                if (k < tail.length() && tail.charAt(k) == c) {
                    next.add(SpacerState.tail(k + 1));
                }
                break;
            default:
                throw new AssertionError(st);
            }
        }
        current = closure(next);
        boolean accepting = current.contains(accept);

        String desc = "Read '" + c + "': " + Misc.labelsOf(this, prev)
            + " -> " + Misc.labelsOf(this, current);
        if (accepting) desc += " [MATCH]";
        return new StepResult<SpacerState>(currentStates(), accepting, desc);
    }

    /**
     * Every head occurrence, extended by every allowed spacer length after
     * which the tail follows. Leaves the simulation untouched.
     */
    @Override
    public List<Interval> findAllMatches(CharSequence sequence) {
        final String s = MotifParser.upper(sequence.toString());
        final String head = spec.head;
        final String tail = spec.tail;
        final int n = s.length();
        List<Interval> matches = new ArrayList<Interval>();
        for (int i = 0; i + head.length() <= n; ++i) {
            if (!s.startsWith(head, i)) continue;
            // longest gap that still leaves room for the tail
            final int room = n - i - head.length() - tail.length();
            final int max = Math.min(spec.maxGap, room);
            for (int g = spec.minGap; g <= max; ++g) {
                int j = i + head.length() + g;
                if (s.startsWith(tail, j)) {
                    matches.add(new Interval(i, j + tail.length() - 1));
                }
            }
        }
        return matches;
    }

    @Override
    public String describe(Set<SpacerState> states) {
        if (states.isEmpty()) return "No active states";
        SpacerState best = Collections.max(states);
        int k = best.progress();
        switch (best.phase()) {
        case HEAD:
            return "Head: matched " + k + "/" + spec.head.length()
                + " need '" + need(spec.head, k) + "'";
        case SPACER:
            return "Spacer length so far: " + k + " (min " + spec.minGap + ")";
        default:
            if (best.equals(accept)) {
                return "ACCEPT: " + spec.head + " + spacer[" + spec.minGap + ","
                    + spec.maxGap + "] + " + spec.tail;
            }
            return "Tail: matched " + k + "/" + spec.tail.length()
                + " need '" + need(spec.tail, k) + "'";
        }
    }

    private static String need(String motif, int k) {
        return k < motif.length() ? motif.substring(k, k + 1) : "";
    }

    @Override
    public List<SpacerState> states() {
        List<SpacerState> states = new ArrayList<SpacerState>();
        for (int k = 0; k <= spec.head.length(); ++k) states.add(SpacerState.head(k));
        for (int g = 0; g <= spec.maxGap; ++g) states.add(SpacerState.spacer(g));
        for (int k = 0; k <= spec.tail.length(); ++k) states.add(SpacerState.tail(k));
        return states;
    }

    @Override
    public SortedSet<SpacerState> initialStates() {
        return Collections.unmodifiableSortedSet(
            new TreeSet<SpacerState>(Collections.singleton(START)));
    }

    @Override
    public SortedSet<SpacerState> acceptStates() {
        return Collections.unmodifiableSortedSet(
            new TreeSet<SpacerState>(Collections.singleton(accept)));
    }

    @Override
    public SortedSet<SpacerState> currentStates() {
        return Collections.unmodifiableSortedSet(new TreeSet<SpacerState>(current));
    }

    @Override
    public String label(SpacerState state) {
        return state.toString();
    }

    /**
     * The formal relation, including the epsilon move out of the head. The
     * spacer to tail edge leaves every spacer count in <code>[min, max]</code>,
     * as in the simulation. That includes an edge out of
     * <code>spacer:max</code>, which a drawing that stops the tail edges one
     * count short of the maximum would not have.
     */
    @Override
    public SortedMap<Edge<SpacerState>, SortedSet<SpacerState>> transitions() {
        final String head = spec.head;
        final String tail = spec.tail;
        SortedMap<Edge<SpacerState>, SortedSet<SpacerState>> ret =
            new TreeMap<Edge<SpacerState>, SortedSet<SpacerState>>();
        for (int k = 0; k < head.length(); ++k) {
            arc(ret, Edge.on(SpacerState.head(k), head.charAt(k)),
                SpacerState.head(k + 1));
        }
        arc(ret, Edge.epsilon(SpacerState.head(head.length())),
            SpacerState.spacer(0));
        for (int g = 0; g <= spec.maxGap; ++g) {
            SpacerState s = SpacerState.spacer(g);
            if (g < spec.maxGap) {
                for (char a : Bases.symbols()) {
                    arc(ret, Edge.on(s, a), SpacerState.spacer(g + 1));
                }
            }
            if (g >= spec.minGap && tail.length() > 0) {
                arc(ret, Edge.on(s, tail.charAt(0)), SpacerState.tail(1));
            }
        }
        for (int k = 0; k < tail.length(); ++k) {
            arc(ret, Edge.on(SpacerState.tail(k), tail.charAt(k)),
                SpacerState.tail(k + 1));
        }
        return ret;
    }

    private static void arc(SortedMap<Edge<SpacerState>, SortedSet<SpacerState>> m,
            Edge<SpacerState> e, SpacerState ns) {
        SortedSet<SpacerState> set = m.get(e);
        if (set == null) {
            m.put(e, set = new TreeSet<SpacerState>());
        }
        set.add(ns);
    }
}
