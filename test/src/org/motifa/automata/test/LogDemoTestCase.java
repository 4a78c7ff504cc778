/* @LICENSE@
 */
package org.motifa.automata.test;

import java.util.logging.Level;

import org.motifa.automata.AbstractMotifTestCase;
import org.motifa.automata.AutomatonStyle;
import org.motifa.automata.Simulation;

public class LogDemoTestCase extends AbstractMotifTestCase {

    public LogDemoTestCase(String name) {
        super(name);
    }

    @Override
    protected void setUp() throws Exception {
        super.setUp();
        captureLog();
    }

    public void testDFA() {
        AutomatonStyle.create("DFA", "ATG");
        String log = capturedMessages();
        assertTrue(log, log.contains("AutomatonStyle selected: DFA, pattern: ATG"));
        assertTrue(log, log.contains("built DFA: ATG"));
        assertTrue(log, log.contains("Q2   Q1   Q0   Q0   Q0"));
    }

    public void testNFA() {
        AutomatonStyle.create("NFA", "ATG|TAA");
        String log = capturedMessages();
        assertTrue(log, log.contains("final returns: [(2, G), (4, A)]"));
    }

    public void testENFA() {
        AutomatonStyle.create("Epsilon-NFA", "tata{1,10}tata");
        assertTrue(capturedMessages().contains("as TATA{1,10}TATA"));
    }

    public void testSimulation() {
        Simulation sim = new Simulation(AutomatonStyle.create("DFA", "AT"), "GAT");
        sim.run();
        String log = capturedMessages();
        assertTrue(log, log.contains("Read 'T': Q1 -> Q0 [PATTERN MATCHED!]"));
        assertTrue(log, log.contains("DFA: AT: 1 match(es) in 3 bases"));
    }

    public void testCoarseLevel() throws Exception {
        tearDown();
        captureLog(Level.FINE);
        new Simulation(AutomatonStyle.create("PDA", ""), "GAATTC").run();
        assertEquals(1, records.size());
        assertEquals(Level.FINE, records.get(0).getLevel());
    }
}
