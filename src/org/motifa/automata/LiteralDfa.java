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
 * Deterministic recognizer for a single literal motif, laid out as a linear
 * chain <code>Q0 -p[0]-&gt; Q1 -p[1]-&gt; ... Q(n-1) -p[n-1]-&gt; Q0</code>.
 * <p>
 * <code>Q0</code> is both the initial and the accepting state, so a scan
 * continues straight into the next occurrence without a reset. The last edge
 * of the chain is the <em>final edge</em>: taking it completes a match. Off
 * chain symbols fall back to the longest prefix of the motif that is still in
 * play; for a motif with no self overlap that is <code>Q1</code> when the
 * symbol starts the motif again and <code>Q0</code> otherwise. A motif which
 * does overlap itself (<code>AA</code>, <code>TATA</code>) has its final edge
 * land on the overlapping prefix instead of <code>Q0</code>, so every
 * occurrence is reported, overlapping ones included.
 * <p>
 * The empty motif self loops at <code>Q0</code> and never matches.
 */
public final class LiteralDfa extends MotifAutomaton<Integer> {

    private static final Logger logger = Logger.getLogger("org.motifa.automata");
    private static final Level level = Level.FINEST;

    private static final SortedSet<Integer> Q0 = Collections
        .unmodifiableSortedSet(new TreeSet<Integer>(Collections.singleton(0)));

    /*
     * delta[state][Bases.indexOf(symbol)]
     */
    private final int[][] delta;
    private int state = 0;

    public LiteralDfa(String pattern) {
        super(AutomatonStyle.DFA, MotifParser.parseLiteral(pattern));
        delta = chain(this.pattern);
        if (logger.isLoggable(level)) {
            logger.log(level, "built " + this + Misc.LS + tableString());
        }
    }

    private static int[][] chain(String p) {
        final int n = p.length();
        final int width = Bases.ALPHABET.length();
        if (n == 0) {
            return new int[][] { new int[width] };
        }
        /*
         * border[k]: length of the longest proper prefix of p[0, k) which is
         * also a suffix of it.
         */
        int[] border = new int[n + 1];
        for (int k = 2, b = 0; k <= n; ++k) {
            while (b > 0 && p.charAt(k - 1) != p.charAt(b)) b = border[b];
            if (p.charAt(k - 1) == p.charAt(b)) ++b;
            border[k] = b;
        }
        int[][] delta = new int[n][width];
        for (int i = 0; i < n; ++i) {
            for (int a = 0; a < width; ++a) {
                char c = Bases.ALPHABET.charAt(a);
                if (c == p.charAt(i)) {
                    delta[i][a] = i == n - 1 ? border[n] : i + 1;
                } else {
                    // border[i] < i, so that row is already filled in
                    delta[i][a] = i == 0 ? 0 : delta[border[i]][a];
                }
            }
        }
        return delta;
    }

    @Override
    public void reset() {
        state = 0;
    }

    /**
     * @return the single active state.
     */
    public int state() {
        return state;
    }

    @Override
    public StepResult<Integer> step(char symbol) {
        final char c = Character.toUpperCase(symbol);
        final int a = Bases.indexOf(c);
        final int old = state;
        if (a < 0) {
            return new StepResult<Integer>(currentStates(), false, ignored(c));
        }
        boolean match = isFinalEdge(old, c);
        state = delta[old][a];

        StringBuilder sb = new StringBuilder();
        sb.append("Read '").append(c).append("': Q").append(old)
          .append(" -> Q").append(state);
        if (match) {
            sb.append(" [PATTERN MATCHED!]");
        } else if (state > old) {
            sb.append(" (Matched ").append(state).append('/')
              .append(pattern.length()).append(')');
        } else if (state < old) {
            sb.append(" (Reset/backtrack to start)");
        }
        return new StepResult<Integer>(currentStates(), match, sb.toString());
    }

    private boolean isFinalEdge(int s, char c) {
        final int n = pattern.length();
        return n > 0 && s == n - 1 && c == pattern.charAt(n - 1);
    }

    /**
     * Resets, scans, and resets again: any step-wise simulation in progress is
     * lost.
     */
    @Override
    public List<Interval> findAllMatches(CharSequence sequence) {
        final int n = pattern.length();
        List<Interval> matches = new ArrayList<Interval>();
        reset();
        for (int i = 0; i < sequence.length(); ++i) {
            if (step(sequence.charAt(i)).isMatch()) {
                matches.add(new Interval(i - n + 1, i));
            }
        }
        reset();
        return matches;
    }

    @Override
    public String describe(Set<Integer> states) {
        if (states.isEmpty()) return "No active states";
        int s = Collections.min(states);
        if (s == 0) {
            return "Start State: Looking for pattern start (also accept)";
        }
        return "Partial Match: '" + pattern.substring(0, s)
            + "' (need '" + pattern.substring(s) + "')";
    }

    @Override
    public List<Integer> states() {
        List<Integer> states = new ArrayList<Integer>(delta.length);
        for (int i = 0; i < delta.length; ++i) states.add(i);
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
        return Collections.unmodifiableSortedSet(
            new TreeSet<Integer>(Collections.singleton(state)));
    }

    @Override
    public String label(Integer state) {
        return "Q" + state;
    }

    @Override
    public SortedMap<Edge<Integer>, SortedSet<Integer>> transitions() {
        SortedMap<Edge<Integer>, SortedSet<Integer>> ret =
            new TreeMap<Edge<Integer>, SortedSet<Integer>>();
        for (int s = 0; s < delta.length; ++s) {
            for (int a = 0; a < delta[s].length; ++a) {
                SortedSet<Integer> ns = new TreeSet<Integer>();
                ns.add(delta[s][a]);
                ret.put(Edge.on(s, Bases.ALPHABET.charAt(a)), ns);
            }
        }
        return ret;
    }

    /**
     * @return the final edge, or nothing for the empty motif.
     */
    @Override
    public Set<Edge<Integer>> importantRestartEdges() {
        final int n = pattern.length();
        if (n == 0) return Collections.emptySet();
        return Collections.singleton(Edge.on(n - 1, pattern.charAt(n - 1)));
    }

    private String tableString() {
        StringBuilder sb = new StringBuilder();
        sb.append("     ");
        for (char c : Bases.symbols()) sb.append(c).append("    ");
        for (int s = 0; s < delta.length; ++s) {
            sb.append(Misc.LS).append(String.format("Q%-3d", s));
            for (int ns : delta[s]) sb.append(String.format(" Q%-3d", ns));
        }
        return sb.toString();
    }
}
