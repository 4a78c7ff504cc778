/*
 * @LICENSE@
 */

/**
 * <h3><b>motifa</b> - finite automata for biological motifs.</h3>
 * <p>
 * <h4>Motivation.</h4>
 * <p>
 * <b>motifa</b> recognizes motifs in DNA, sequences over the four bases
 * <code>A, T, G, C</code>, by simulating small automata symbol by symbol. The
 * simulation is meant to be watched: every step reports the active states and
 * a description of the transition taken, and each automaton exposes its
 * formal structure (states, initial and accepting sets, transition relation)
 * for drawing. Whole sequences can also be searched in one call.
 * <p>
 * <h4>The automata.</h4>
 * <p>
 * Four kinds are provided, one per supported pattern shape, and enumerated by
 * {@link org.motifa.automata.AutomatonStyle}:
 * <ul>
 * <li>{@link org.motifa.automata.LiteralDfa} - a literal motif such as the
 * start codon <code>ATG</code>, as a deterministic chain.</li>
 * <li>{@link org.motifa.automata.AlternativesNfa} - any of several literal
 * motifs, e.g. the stop codons <code>TAA|TAG|TGA</code>, as a trie shaped
 * nondeterministic automaton.</li>
 * <li>{@link org.motifa.automata.SpacerEnfa} - a head motif, a spacer of
 * bounded length and a tail motif, <code>TATA{1,10}TATA</code>, as an
 * epsilon-NFA.</li>
 * <li>{@link org.motifa.automata.HairpinPda} - complement palindromes such as
 * <code>GAATTC</code>, found by center expansion, with a push-down stack kept
 * for display.</li>
 * </ul>
 * <p>
 * All of them share the {@link org.motifa.automata.MotifAutomaton} contract:
 * <pre>
 * MotifAutomaton&lt;?&gt; fa = AutomatonStyle.create("NFA", "TAA|TAG|TGA");
 * for (char c : "ATGCCCTAG".toCharArray()) {
 *     System.out.println(fa.step(c).description());
 * }
 * List&lt;Interval&gt; stops = fa.findAllMatches("ATGCCCTAG");  // [[6, 8]]
 * </pre>
 * <p>
 * {@link org.motifa.automata.Simulation} packages the step / log / finish
 * cycle of an interactive display.
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * Construction and simulation are traced through
 * <code>java.util.logging</code> on the <code>org.motifa.automata</code>
 * logger, at <code>FINEST</code> for transition tables and steps and at
 * <code>FINE</code> for search summaries.
 */
package org.motifa.automata;
