/* @LICENSE@
 */
package org.motifa.automata.test;

import static org.motifa.automata.MotifAssert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.Random;
import java.util.SortedMap;
import java.util.SortedSet;

import org.motifa.automata.AbstractMotifTestCase;
import org.motifa.automata.Bases;
import org.motifa.automata.Edge;
import org.motifa.automata.LiteralDfa;
import org.motifa.automata.StepResult;

public class LiteralDfaTestCase extends AbstractMotifTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(LiteralDfaTestCase.class);
    }

    public LiteralDfaTestCase(String name) {
        super(name);
    }

    private static void assertArc(LiteralDfa fa, int s, char c, int ns) {
        SortedSet<Integer> targets = fa.transitions().get(Edge.on(s, c));
        assertEquals("(" + s + ", " + c + ")", Collections.singleton(ns), targets);
    }

    public void testChain() {
        LiteralDfa fa = new LiteralDfa("ATG");
        assertEquals(Arrays.asList(0, 1, 2), fa.states());
        assertEquals(Collections.singleton(0), fa.initialStates());
        assertEquals(Collections.singleton(0), fa.acceptStates());
        assertEquals(12, fa.transitions().size());

        assertArc(fa, 0, 'A', 1);
        assertArc(fa, 0, 'T', 0);
        assertArc(fa, 0, 'G', 0);
        assertArc(fa, 0, 'C', 0);

        assertArc(fa, 1, 'T', 2);
        assertArc(fa, 1, 'A', 1);   // restart
        assertArc(fa, 1, 'G', 0);
        assertArc(fa, 1, 'C', 0);

        assertArc(fa, 2, 'G', 0);   // final edge
        assertArc(fa, 2, 'A', 1);   // restart
        assertArc(fa, 2, 'T', 0);
        assertArc(fa, 2, 'C', 0);
    }

    public void testImportantRestartEdges() {
        assertEquals(Collections.singleton(Edge.on(2, 'G')),
            new LiteralDfa("ATG").importantRestartEdges());
        assertEquals(Collections.singleton(Edge.on(0, 'C')),
            new LiteralDfa("C").importantRestartEdges());
        assertTrue(new LiteralDfa("").importantRestartEdges().isEmpty());
    }

    public void testStep() {
        LiteralDfa fa = new LiteralDfa("ATG");
        StepResult<Integer> r = fa.step('A');
        assertEquals(Integer.valueOf(1), r.state());
        assertFalse(r.isMatch());
        assertEquals("Read 'A': Q0 -> Q1 (Matched 1/3)", r.description());

        r = fa.step('T');
        assertEquals(2, fa.state());
        assertEquals("Read 'T': Q1 -> Q2 (Matched 2/3)", r.description());

        r = fa.step('G');
        assertEquals(0, fa.state());
        assertTrue(r.isMatch());
        assertEquals("Read 'G': Q2 -> Q0 [PATTERN MATCHED!]", r.description());

        r = fa.step('A');
        r = fa.step('C');
        assertFalse(r.isMatch());
        assertEquals("Read 'C': Q1 -> Q0 (Reset/backtrack to start)", r.description());

        r = fa.step('C');
        assertEquals("Read 'C': Q0 -> Q0", r.description());
    }

    public void testMatchFlags() {
        assertMatchFlags(new LiteralDfa("ATG"), "CATGATGTTATG", "...m..m....m");
        assertMatchFlags(new LiteralDfa("A"), "ACAA", "m.mm");
    }

    public void testFindAll() {
        assertMatches(new LiteralDfa("ATG"), "CATGATGTTATG", 1, 3, 4, 6, 9, 11);
        assertMatches(new LiteralDfa("ATG"), "catgc", 1, 3);
        assertMatches(new LiteralDfa("atg"), "CATGC", 1, 3);
        assertMatches(new LiteralDfa("ATG"), "");
        assertMatches(new LiteralDfa("ATG"), "AT");
        assertMatches(new LiteralDfa("GATTACA"), "GATTACA", 0, 6);
    }

    public void testOverlapping() {
        assertMatches(new LiteralDfa("AA"), "AAAA", 0, 1, 1, 2, 2, 3);
        assertMatches(new LiteralDfa("TATA"), "TATATATA", 0, 3, 2, 5, 4, 7);
        assertMatches(new LiteralDfa("AAT"), "AAAT", 1, 3);
        assertMatches(new LiteralDfa("ACAC"), "ACACACGACAC", 0, 3, 2, 5, 7, 10);
    }

    public void testSelfOverlapChain() {
        LiteralDfa fa = new LiteralDfa("AA");
        assertArc(fa, 0, 'A', 1);
        assertArc(fa, 1, 'A', 1);   // final edge back onto the overlap
        assertArc(fa, 1, 'T', 0);
        assertEquals(Collections.singleton(Edge.on(1, 'A')), fa.importantRestartEdges());
    }

    public void testAgainstNaiveSearch() {
        Random random = new Random(20261018L);
        for (int trial = 0; trial < 300; ++trial) {
            String motif = Bases.randomSequence(1 + random.nextInt(4), random);
            String s = Bases.randomSequence(random.nextInt(60), random);
            assertEquals(motif + " in " + s,
                naiveFind(motif, s), new LiteralDfa(motif).findAllMatches(s));
        }
    }

    public void testEmptyPattern() {
        LiteralDfa fa = new LiteralDfa("");
        assertEquals(Arrays.asList(0), fa.states());
        SortedMap<Edge<Integer>, SortedSet<Integer>> t = fa.transitions();
        assertEquals(4, t.size());
        for (char c : Bases.symbols()) {
            assertEquals(Collections.singleton(0), t.get(Edge.on(0, c)));
            StepResult<Integer> r = fa.step(c);
            assertEquals(Integer.valueOf(0), r.state());
            assertFalse(r.isMatch());
        }
        assertMatches(fa, "ATGCATGC");
        assertEquals(new LiteralDfa(null).pattern(), fa.pattern());
    }

    public void testIllegalSymbol() {
        LiteralDfa fa = new LiteralDfa("ATG");
        fa.step('A');
        StepResult<Integer> r = fa.step('N');
        assertFalse(r.isMatch());
        assertEquals(1, fa.state());
        assertEquals(Integer.valueOf(1), r.state());
        assertTrue(r.description(), r.description().contains("not in alphabet"));
        fa.step('T');
        assertTrue(fa.step('g').isMatch());
    }

    public void testReset() {
        LiteralDfa fa = new LiteralDfa("ATG");
        fa.step('A');
        fa.step('T');
        fa.reset();
        assertEquals(0, fa.state());
        fa.reset();
        assertEquals(0, fa.state());
        assertEquals(Collections.singleton(0), fa.currentStates());
    }

    public void testFindAllResets() {
        LiteralDfa fa = new LiteralDfa("ATG");
        fa.step('A');
        fa.step('T');
        assertEquals(ivs(0, 2), fa.findAllMatches("ATG"));
        assertEquals(0, fa.state());
        assertEquals(fa.findAllMatches("ATGATG"), fa.findAllMatches("ATGATG"));
        assertEquals(0, fa.state());
    }

    public void testDescribe() {
        LiteralDfa fa = new LiteralDfa("ATG");
        assertEquals("Start State: Looking for pattern start (also accept)",
            fa.describeCurrent());
        fa.step('A');
        assertEquals("Partial Match: 'A' (need 'TG')", fa.describeCurrent());
        assertEquals("Partial Match: 'AT' (need 'G')",
            fa.describe(Collections.singleton(2)));
        assertEquals("No active states",
            fa.describe(Collections.<Integer>emptySet()));
        assertEquals("Q2", fa.label(2));
        assertEquals("DFA: ATG", fa.toString());
    }
}
