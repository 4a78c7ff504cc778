/* @LICENSE@
 */
package org.motifa.automata;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The outcome of feeding one symbol to a {@link MotifAutomaton}: the active
 * configuration after the step, whether the step completed a match, and a
 * human readable account of the transition.
 *
 * @param <S> the automaton's state type
 */
public final class StepResult<S extends Comparable<? super S>> {

    private final SortedSet<S> states;
    private final boolean match;
    private final String description;

    StepResult(SortedSet<S> states, boolean match, String description) {
        assert !states.isEmpty() : description;
        this.states = Collections.unmodifiableSortedSet(
            new TreeSet<S>(states));
        this.match = match;
        this.description = description;
    }

    /**
     * @return the active configuration after the step; a singleton for the
     *         deterministic automata.
     */
    public SortedSet<S> states() {
        return states;
    }

    /**
     * Convenience for deterministic automata.
     *
     * @return the lowest active state.
     */
    public S state() {
        return states.first();
    }

    public boolean isMatch() {
        return match;
    }

    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return description;
    }
}
