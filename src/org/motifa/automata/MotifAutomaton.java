/* @LICENSE@
 */
package org.motifa.automata;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * The simulation contract shared by every motif recognizer. A caller may drive
 * any automaton identically: {@link #reset()}, then {@link #step(char)} once per
 * base, or hand a whole sequence to {@link #findAllMatches(CharSequence)}.
 * <p>
 * The set of implementations is closed: the constructor is package private
 * and instances are obtained from {@link AutomatonStyle}, or by constructing
 * one of {@link LiteralDfa}, {@link AlternativesNfa}, {@link SpacerEnfa} or
 * {@link HairpinPda} directly.
 * <p>
 * Like {@link java.util.regex.Matcher}, instances are <em>not</em> thread
 * safe: <code>step</code> and <code>reset</code> mutate the automaton in
 * place, and it is the responsibility of the client to ensure that the
 * methods of an instance are not re-entered.
 * <p>
 * Symbols outside the alphabet are tolerated: <code>step</code> leaves the
 * active configuration unchanged and reports no match.
 *
 * @param <S> the state type; states have structural equality and a total
 *        order, which fixes the order of every reported state set.
 */
public abstract class MotifAutomaton<S extends Comparable<? super S>> {

    final AutomatonStyle style;
    final String pattern;

    MotifAutomaton(AutomatonStyle style, String pattern) {
        this.style = style;
        this.pattern = pattern == null ? "" : pattern.toUpperCase(Locale.ROOT);
    }

    public final AutomatonStyle style() {
        return style;
    }

    /**
     * @return the upper cased pattern text this automaton was built from.
     */
    public final String pattern() {
        return pattern;
    }

    /**
     * Returns the automaton to its initial configuration.
     */
    public abstract void reset();

    /**
     * Feeds one symbol. Lower case bases are accepted.
     */
    public abstract StepResult<S> step(char symbol);

    /**
     * Batch search over a whole sequence.
     *
     * @return the recognized occurrences, in ascending order.
     */
    public abstract List<Interval> findAllMatches(CharSequence sequence);

    /**
     * A progress summary of the given configuration, for status display.
     */
    public abstract String describe(Set<S> states);

    public final String describeCurrent() {
        return describe(currentStates());
    }

    /*
     * Visualization adapter: the formal structure behind the simulation.
     */

    public abstract List<S> states();

    public abstract SortedSet<S> initialStates();

    public abstract SortedSet<S> acceptStates();

    public abstract SortedSet<S> currentStates();

    public List<Character> symbols() {
        return Bases.symbols();
    }

    /**
     * A short display label, e.g. <code>Q3</code> or <code>head:2</code>.
     */
    public abstract String label(S state);

    /**
     * The full transition relation in <code>(state, symbol) -&gt;
     * states</code> form. Epsilon moves are keyed by
     * {@link Edge#epsilon(Comparable)}.
     */
    public abstract SortedMap<Edge<S>, SortedSet<S>> transitions();

    /**
     * Edges back to the initial state which complete a match, and must stay
     * visible when generic restart edges are filtered out of a diagram.
     */
    public Set<Edge<S>> importantRestartEdges() {
        return Collections.emptySet();
    }

    /*
     * Shared description of an ignored symbol.
     */
    final String ignored(char symbol) {
        return "Read '" + symbol + "': not in alphabet "
            + Bases.ALPHABET + ", no transition";
    }

    @Override
    public final String toString() {
        return style + ": " + doToString();
    }

    protected String doToString() {
        return pattern;
    }
}
