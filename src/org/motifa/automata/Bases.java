/* @LICENSE@
 */
package org.motifa.automata;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * The nucleotide alphabet shared by every automaton, plus the complement
 * pairing and a few sequence utilities.
 * <p>
 * The alphabet is fixed to the four bases <code>A, T, G, C</code>, in that
 * order; that order is also the column order of transition tables and the
 * order in which symbols are reported by {@link MotifAutomaton#symbols()}.
 */
public final class Bases {

    private Bases() {
    } // never instantiated

    /**
     * The bases, in canonical order.
     */
    public static final String ALPHABET = "ATGC";

    /**
     * Returned by {@link #complement(char)} for anything that is not a base;
     * never equal to a base, so it never pairs.
     */
    public static final char NO_COMPLEMENT = '?';

    /**
     * Length of sequences produced by {@link #randomSequence(Random)}.
     */
    public static final int DEFAULT_RANDOM_LENGTH = 80;

    private static final List<Character> SYMBOLS = Collections
        .unmodifiableList(Arrays.asList('A', 'T', 'G', 'C'));

    /**
     * @return the four bases as an unmodifiable list.
     */
    public static List<Character> symbols() {
        return SYMBOLS;
    }

    /**
     * @return the column of <code>c</code> in a transition table, or -1 if
     *         <code>c</code> is not an (upper case) base.
     */
    static int indexOf(char c) {
        return ALPHABET.indexOf(c);
    }

    public static boolean isBase(char c) {
        return indexOf(c) >= 0;
    }

    /**
     * Watson-Crick pairing: A with T, G with C.
     */
    public static char complement(char c) {
        switch (c) {
        case 'A': return 'T';
        case 'T': return 'A';
        case 'G': return 'C';
        case 'C': return 'G';
        default:  return NO_COMPLEMENT;
        }
    }

    /**
     * Upper cases the input and drops all whitespace, the way sequences pasted
     * from FASTA-like text arrive.
     */
    public static String normalize(CharSequence raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); ++i) {
            char c = raw.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(Character.toUpperCase(c));
            }
        }
        return sb.toString();
    }

    /**
     * @return <code>true</code> if every char of <code>csq</code> is a base.
     *         The empty sequence is valid.
     */
    public static boolean isValidSequence(CharSequence csq) {
        for (int i = 0; i < csq.length(); ++i) {
            if (!isBase(csq.charAt(i))) return false;
        }
        return true;
    }

    public static String randomSequence(int length, Random random) {
        if (length < 0) {
            throw new IllegalArgumentException("negative length: " + length);
        }
        char[] cs = new char[length];
        for (int i = 0; i < length; ++i) {
            cs[i] = ALPHABET.charAt(random.nextInt(ALPHABET.length()));
        }
        return new String(cs);
    }

    public static String randomSequence(Random random) {
        return randomSequence(DEFAULT_RANDOM_LENGTH, random);
    }
}
