/* @LICENSE@
 */
package org.motifa.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Nondeterministic recognizer for a set of literal motifs, e.g.
 * <code>ATG|TAA|TGA</code>.
 * <p>
 * The graph is a trie rooted at <code>Q0</code>, the single initial and
 * accepting state: motifs sharing a prefix share the state reached by that
 * prefix, and the last symbol of every motif returns to <code>Q0</code> on a
 * <em>final-return</em> edge. For <code>ATG|TAA</code>:
 *
 * <pre>
 *   Q0 -A-&gt; Q1 -T-&gt; Q2 -G-&gt; Q0
 *   Q0 -T-&gt; Q3 -A-&gt; Q4 -A-&gt; Q0
 * </pre>
 *
 * During simulation <code>Q0</code> is always implicitly active, so a new
 * attempt starts on every symbol alongside the ones in flight. A step matches
 * when any final-return edge fires.
 */
public final class AlternativesNfa extends MotifAutomaton<Integer> {

    private static final Logger logger = Logger.getLogger("org.motifa.automata");
    private static final Level level = Level.FINEST;

    private static final SortedSet<Integer> Q0 = Collections
        .unmodifiableSortedSet(new TreeSet<Integer>(Collections.singleton(0)));

    private final List<String> alternatives;
    private final SortedMap<Edge<Integer>, SortedSet<Integer>> delta =
        new TreeMap<Edge<Integer>, SortedSet<Integer>>();
    private final Set<Edge<Integer>> finalReturns =
        new LinkedHashSet<Edge<Integer>>();
    private int nextState = 1;

    private SortedSet<Integer> current = new TreeSet<Integer>();

    public AlternativesNfa(String pattern) {
        super(AutomatonStyle.NFA, pattern);
        alternatives = MotifParser.parseAlternatives(pattern);
        build();
        reset();
        if (logger.isLoggable(level)) {
            logger.log(level, "built " + this + ": " + delta
                + Misc.LS + "final returns: " + finalReturns);
        }
    }

    private void build() {
        // state reached after consuming each proper prefix
        Map<String, Integer> prefixToState = new HashMap<String, Integer>();
        prefixToState.put("", 0);
        for (String alt : alternatives) {
            int u = 0;
            for (int i = 0; i < alt.length(); ++i) {
                char c = alt.charAt(i);
                if (i == alt.length() - 1) {
                    addArc(u, c, 0);
                    finalReturns.add(Edge.on(u, c));
                } else {
                    String prefix = alt.substring(0, i + 1);
                    Integer v = prefixToState.get(prefix);
                    if (v == null) {
                        v = nextState++;
                        prefixToState.put(prefix, v);
                    }
                    addArc(u, c, v);
                    u = v;
                }
            }
        }
    }

    private void addArc(int u, char c, int v) {
        Edge<Integer> e = Edge.on(u, c);
        SortedSet<Integer> ns = delta.get(e);
        if (ns == null) {
            delta.put(e, ns = new TreeSet<Integer>());
        }
        ns.add(v);
    }

    /**
     * @return the parsed motifs, in pattern order.
     */
    public List<String> alternatives() {
        return alternatives;
    }

    @Override
    public void reset() {
        current = new TreeSet<Integer>(Q0);
    }

    @Override
    public StepResult<Integer> step(char symbol) {
        final char c = Character.toUpperCase(symbol);
        if (!Bases.isBase(c)) {
            return new StepResult<Integer>(currentStates(), false, ignored(c));
        }
        final SortedSet<Integer> prev = current;
        SortedSet<Integer> candidates = new TreeSet<Integer>(prev);
        candidates.add(0);

        SortedSet<Integer> next = new TreeSet<Integer>();
        boolean match = false;
        for (int u : candidates) {
            Edge<Integer> e = Edge.on(u, c);
            SortedSet<Integer> ns = delta.get(e);
            if (ns == null) continue;
            for (int v : ns) {
                next.add(v);
                if (finalReturns.contains(e) || (v == 0 && u != 0)) {
                    match = true;
                }
            }
        }
        if (next.isEmpty()) {
            next.add(0);
        }
        current = next;

        String desc = "Read '" + c + "': " + Misc.labelsOf(this, prev)
            + " -> " + Misc.labelsOf(this, current);
        if (match) desc += " [MATCH]";
        return new StepResult<Integer>(currentStates(), match, desc);
    }

    /**
     * Drives {@link #step(char)} over the sequence; at each matching position
     * the longest motif ending there gives the start of the interval. Resets
     * before and after the scan.
     */
    @Override
    public List<Interval> findAllMatches(CharSequence sequence) {
        final String s = MotifParser.upper(sequence.toString());
        Set<Integer> lengths = new TreeSet<Integer>(Collections.reverseOrder());
        for (String alt : alternatives) {
            if (alt.length() > 0) lengths.add(alt.length());
        }
        List<Interval> matches = new ArrayList<Interval>();
        reset();
        for (int i = 0; i < s.length(); ++i) {
            if (!step(s.charAt(i)).isMatch()) continue;
            for (int len : lengths) {
                if (i - len + 1 >= 0
                        && alternatives.contains(s.substring(i - len + 1, i + 1))) {
                    matches.add(new Interval(i - len + 1, i));
                    break;
                }
            }
        }
        reset();
        return matches;
    }

    @Override
    public String describe(Set<Integer> states) {
        if (states.isEmpty()) return "No active states";
        if (states.contains(0)) return "Ready (Q0 is accept; looking for start)";
        return "Partial path at Q" + Collections.min(states);
    }

    @Override
    public List<Integer> states() {
        List<Integer> states = new ArrayList<Integer>(nextState);
        for (int i = 0; i < nextState; ++i) states.add(i);
        return states;
    }

    @Override
    public SortedSet<Integer> initialStates() {
        return Q0;
    }

    @Override
    public SortedSet<Integer> acceptStates() {
        return Q0;
    }

    @Override
    public SortedSet<Integer> currentStates() {
        return Collections.unmodifiableSortedSet(new TreeSet<Integer>(current));
    }

    @Override
    public String label(Integer state) {
        return "Q" + state;
    }

    @Override
    public SortedMap<Edge<Integer>, SortedSet<Integer>> transitions() {
        SortedMap<Edge<Integer>, SortedSet<Integer>> ret =
            new TreeMap<Edge<Integer>, SortedSet<Integer>>();
        for (Map.Entry<Edge<Integer>, SortedSet<Integer>> e : delta.entrySet()) {
            ret.put(e.getKey(), new TreeSet<Integer>(e.getValue()));
        }
        return ret;
    }

    /**
     * @return the final-return edges.
     */
    @Override
    public Set<Edge<Integer>> importantRestartEdges() {
        return Collections.unmodifiableSet(finalReturns);
    }
}
