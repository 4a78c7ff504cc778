/* @LICENSE@
 */
package org.motifa.automata;

import java.util.Collection;

/**
 * This class implements a handful of miscellaneous static helpers shared by
 * the automata.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * "{Q0, Q3}" style rendering of an active configuration, in the iteration
     * order of the collection (callers pass sorted sets).
     */
    static <S extends Comparable<? super S>> String labelsOf(
            MotifAutomaton<S> fa, Collection<S> states) {
        StringBuilder sb = new StringBuilder();
        sb.append('{');
        for (S s : states) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(fa.label(s));
        }
        return sb.append('}').toString();
    }

    static String stringOf(Collection<Character> symbols) {
        StringBuilder sb = new StringBuilder(symbols.size());
        for (char c : symbols) sb.append(c);
        return sb.toString();
    }
}
