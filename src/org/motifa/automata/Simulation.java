/* @LICENSE@
 */
package org.motifa.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives a {@link MotifAutomaton} over one sequence a base at a time, keeping
 * the transition log and the match results a display needs. Pacing is up to
 * the caller: call {@link #advance()} from a timer, a loop, or a button.
 * <p>
 * Only the exact-match {@link LiteralDfa} reports matches while stepping;
 * every other automaton has its matches computed by
 * {@link MotifAutomaton#findAllMatches(CharSequence)} when the run is
 * {@linkplain #finish() finished}.
 * <p>
 * Not thread safe, like the automaton it drives.
 */
public final class Simulation {

    private static final Logger logger = Logger.getLogger("org.motifa.automata");
    private static final Level level = Level.FINEST;

    private final MotifAutomaton<?> fa;
    private final String sequence;
    private int index = 0;
    private final List<String> log = new ArrayList<String>();
    private final List<Interval> stepMatches = new ArrayList<Interval>();
    private List<Interval> matches = null;

    /**
     * @param sequence
     *            normalised with {@link Bases#normalize(CharSequence)} first.
     * @throws IllegalArgumentException
     *             if the normalised sequence is empty or holds a non-base.
     */
    public Simulation(MotifAutomaton<?> fa, CharSequence sequence) {
        if (fa == null) throw new NullPointerException("automaton");
        String s = Bases.normalize(sequence);
        if (s.length() == 0) {
            throw new IllegalArgumentException("Please enter a DNA sequence.");
        }
        if (!Bases.isValidSequence(s)) {
            throw new IllegalArgumentException(
                "DNA sequence must contain only A, T, G, C bases.");
        }
        this.fa = fa;
        this.sequence = s;
        fa.reset();
    }

    public MotifAutomaton<?> automaton() {
        return fa;
    }

    public String sequence() {
        return sequence;
    }

    /**
     * @return the position of the next base to be read.
     */
    public int index() {
        return index;
    }

    public boolean isComplete() {
        return index >= sequence.length();
    }

    /**
     * Reads the next base.
     *
     * @throws IllegalStateException
     *             if every base has been read.
     */
    public StepResult<?> advance() {
        if (isComplete()) {
            throw new IllegalStateException("Simulation complete.");
        }
        final int i = index++;
        StepResult<?> r = fa.step(sequence.charAt(i));
        log.add(r.description());
        logger.log(level, r.description());
        if (r.isMatch() && fa.style() == AutomatonStyle.DFA) {
            stepMatches.add(new Interval(i - fa.pattern().length() + 1, i));
        }
        return r;
    }

    /**
     * Reads every remaining base, then {@linkplain #finish() finishes}.
     *
     * @return the matches.
     */
    public List<Interval> run() {
        while (!isComplete()) advance();
        return finish();
    }

    /**
     * Computes the batch matches of the whole sequence. For the exact-match
     * and alternatives automata that resets the automaton.
     */
    public List<Interval> finish() {
        matches = Collections.unmodifiableList(
            new ArrayList<Interval>(fa.findAllMatches(sequence)));
        logger.log(Level.FINE, fa + ": " + matches.size() + " match(es) in "
            + sequence.length() + " bases");
        return matches;
    }

    /**
     * Rewinds to the first base, resetting the automaton and dropping the log
     * and all results.
     */
    public void reset() {
        fa.reset();
        index = 0;
        log.clear();
        stepMatches.clear();
        matches = null;
    }

    /**
     * @return the transition descriptions so far, one per base read.
     */
    public List<String> transitionLog() {
        return Collections.unmodifiableList(log);
    }

    /**
     * @return matches reported while stepping; only ever non-empty for
     *         {@link AutomatonStyle#DFA}.
     */
    public List<Interval> stepMatches() {
        return Collections.unmodifiableList(stepMatches);
    }

    /**
     * @return the batch matches, or <code>null</code> before {@link #finish()}.
     */
    public List<Interval> matches() {
        return matches;
    }

    public String currentDescription() {
        return fa.describeCurrent();
    }

    /**
     * A results listing, one line per match:
     *
     * <pre>
     * Total matches found: 2
     * 1. Position 0-2: ATG
     * 2. Position 7-9: ATG
     * </pre>
     *
     * or <code>No matches found.</code>
     *
     * @throws IllegalStateException
     *             before {@link #finish()}.
     */
    public String summary() {
        if (matches == null) {
            throw new IllegalStateException("Simulation not finished.");
        }
        if (matches.isEmpty()) return "No matches found.";
        StringBuilder sb = new StringBuilder();
        sb.append("Total matches found: ").append(matches.size());
        int k = 0;
        for (Interval iv : matches) {
            sb.append(Misc.LS).append(++k).append(". Position ")
              .append(iv.start()).append('-').append(iv.end()).append(": ")
              .append(iv.of(sequence));
        }
        return sb.toString();
    }
}
