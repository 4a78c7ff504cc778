/* @LICENSE@
 */
package org.motifa.automata.test;

import static org.motifa.automata.MotifAssert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeSet;

import org.motifa.automata.AbstractMotifTestCase;
import org.motifa.automata.AlternativesNfa;
import org.motifa.automata.Bases;
import org.motifa.automata.Edge;
import org.motifa.automata.Interval;
import org.motifa.automata.StepResult;

public class AlternativesNfaTestCase extends AbstractMotifTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AlternativesNfaTestCase.class);
    }

    public AlternativesNfaTestCase(String name) {
        super(name);
    }

    private static SortedSet<Integer> set(Integer... states) {
        return new TreeSet<Integer>(Arrays.asList(states));
    }

    public void testTrie() {
        AlternativesNfa fa = new AlternativesNfa("ATG|TAA");
        assertEquals(Arrays.asList(0, 1, 2, 3, 4), fa.states());
        assertEquals(set(0), fa.initialStates());
        assertEquals(set(0), fa.acceptStates());

        SortedMap<Edge<Integer>, SortedSet<Integer>> t = fa.transitions();
        assertEquals(6, t.size());
        assertEquals(set(1), t.get(Edge.on(0, 'A')));
        assertEquals(set(2), t.get(Edge.on(1, 'T')));
        assertEquals(set(0), t.get(Edge.on(2, 'G')));
        assertEquals(set(3), t.get(Edge.on(0, 'T')));
        assertEquals(set(4), t.get(Edge.on(3, 'A')));
        assertEquals(set(0), t.get(Edge.on(4, 'A')));

        assertEquals(new HashSet<Edge<Integer>>(Arrays.asList(
            Edge.on(2, 'G'), Edge.on(4, 'A'))), fa.importantRestartEdges());
    }

    public void testSharedPrefix() {
        AlternativesNfa fa = new AlternativesNfa("ATG|ATA|A");
        assertEquals(Arrays.asList(0, 1, 2), fa.states());
        SortedMap<Edge<Integer>, SortedSet<Integer>> t = fa.transitions();
        assertEquals(set(0, 1), t.get(Edge.on(0, 'A')));
        assertEquals(set(2), t.get(Edge.on(1, 'T')));
        assertEquals(set(0), t.get(Edge.on(2, 'G')));
        assertEquals(set(0), t.get(Edge.on(2, 'A')));
        assertEquals(3, fa.importantRestartEdges().size());
    }

    public void testStep() {
        AlternativesNfa fa = new AlternativesNfa("ATG|TAA");
        StepResult<Integer> r = fa.step('A');
        assertEquals(set(1), r.states());
        assertFalse(r.isMatch());
        assertEquals("Read 'A': {Q0} -> {Q1}", r.description());

        r = fa.step('T');
        assertEquals(set(2, 3), r.states());
        assertEquals("Read 'T': {Q1} -> {Q2, Q3}", r.description());

        r = fa.step('G');
        assertTrue(r.isMatch());
        assertEquals(set(0), r.states());
        assertEquals("Read 'G': {Q2, Q3} -> {Q0} [MATCH]", r.description());
    }

    public void testNeverEmpty() {
        AlternativesNfa fa = new AlternativesNfa("ATG");
        fa.step('A');
        StepResult<Integer> r = fa.step('C');
        assertEquals(set(0), r.states());
        assertFalse(r.isMatch());
        assertMatchFlags(fa, "CCCCATGCC", "......m..");
    }

    public void testLongestAlternative() {
        assertMatches(new AlternativesNfa("AT|CAT"), "CAT", 0, 2);
        assertMatches(new AlternativesNfa("CAT|AT"), "CAT", 0, 2);
        assertMatches(new AlternativesNfa("A|AT"), "AAT", 0, 0, 1, 1, 1, 2);
    }

    public void testStopCodons() {
        AlternativesNfa fa = new AlternativesNfa("TAA|TAG|TGA");
        assertMatches(fa, "ATGCCCTAG", 6, 8);
        assertMatches(fa, "ATGAAATAG", 1, 3, 6, 8);
        assertMatches(fa, "TAATGA", 0, 2, 3, 5);
        assertMatches(fa, "taga", 0, 2);
    }

    public void testAgainstNaiveSearch() {
        Random random = new Random(1018L);
        for (int trial = 0; trial < 300; ++trial) {
            int k = 1 + random.nextInt(4);
            StringBuilder pattern = new StringBuilder();
            List<String> motifs = new ArrayList<String>();
            for (int i = 0; i < k; ++i) {
                String m = Bases.randomSequence(1 + random.nextInt(4), random);
                motifs.add(m);
                pattern.append(i == 0 ? "" : "|").append(m);
            }
            String s = Bases.randomSequence(random.nextInt(60), random);
            assertEquals(pattern + " in " + s, naiveFind(motifs, s),
                new AlternativesNfa(pattern.toString()).findAllMatches(s));
        }
    }

    public void testEmptyPattern() {
        AlternativesNfa fa = new AlternativesNfa("");
        assertEquals(Collections.singletonList(""), fa.alternatives());
        assertEquals(Arrays.asList(0), fa.states());
        assertTrue(fa.transitions().isEmpty());
        assertTrue(fa.importantRestartEdges().isEmpty());
        assertMatchFlags(fa, "ATGC", "....");
        assertMatches(fa, "ATGC");
        assertMatches(new AlternativesNfa("||"), "ATGC");
    }

    public void testIllegalSymbol() {
        AlternativesNfa fa = new AlternativesNfa("ATG");
        fa.step('A');
        StepResult<Integer> r = fa.step('N');
        assertEquals(set(1), r.states());
        assertFalse(r.isMatch());
        fa.step('T');
        assertTrue(fa.step('G').isMatch());
    }

    public void testFindAllResets() {
        AlternativesNfa fa = new AlternativesNfa("ATG|TAA");
        fa.step('A');
        fa.step('T');
        List<Interval> first = fa.findAllMatches("ATGTAA");
        assertEquals(set(0), fa.currentStates());
        assertEquals(first, fa.findAllMatches("ATGTAA"));
        assertEquals(set(0), fa.currentStates());
        assertEquals(ivs(0, 2, 3, 5), first);
        fa.reset();
        fa.reset();
        assertEquals(set(0), fa.currentStates());
    }

    public void testDescribe() {
        AlternativesNfa fa = new AlternativesNfa("ATG|TAA");
        assertEquals("Ready (Q0 is accept; looking for start)", fa.describeCurrent());
        fa.step('A');
        fa.step('T');
        assertEquals("Partial path at Q2", fa.describeCurrent());
        assertEquals("No active states", fa.describe(Collections.<Integer>emptySet()));
        assertEquals("NFA: ATG|TAA", fa.toString());
    }
}
