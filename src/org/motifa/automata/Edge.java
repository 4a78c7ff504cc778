/* @LICENSE@
 */
package org.motifa.automata;

/**
 * The key of the transition relation: a source state and the symbol read, or
 * no symbol at all for an epsilon move. Edges order by source state, with
 * epsilon moves ahead of symbol moves and symbols in {@link Bases#ALPHABET}
 * order.
 *
 * @param <S> the automaton's state type
 */
public final class Edge<S extends Comparable<? super S>>
        implements Comparable<Edge<S>> {

    private final S source;
    private final Character symbol;

    private Edge(S source, Character symbol) {
        if (source == null) throw new NullPointerException("source");
        this.source = source;
        this.symbol = symbol;
    }

    public static <S extends Comparable<? super S>> Edge<S> on(
            S source, char symbol) {
        return new Edge<S>(source, symbol);
    }

    public static <S extends Comparable<? super S>> Edge<S> epsilon(S source) {
        return new Edge<S>(source, null);
    }

    public S source() {
        return source;
    }

    /**
     * @return the symbol, or <code>null</code> for an epsilon move.
     */
    public Character symbol() {
        return symbol;
    }

    public boolean isEpsilon() {
        return symbol == null;
    }

    public int compareTo(Edge<S> that) {
        int c = source.compareTo(that.source);
        if (c != 0) return c;
        return rank(symbol) - rank(that.symbol);
    }

    private static int rank(Character symbol) {
        if (symbol == null) return -1;
        int i = Bases.indexOf(symbol);
        return i >= 0 ? i : Bases.ALPHABET.length() + symbol;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Edge<?>)) return false;
        Edge<?> that = (Edge<?>) obj;
        return source.equals(that.source)
            && (symbol == null ? that.symbol == null : symbol.equals(that.symbol));
    }

    @Override
    public int hashCode() {
        return 31 * source.hashCode() + (symbol == null ? 0 : symbol.hashCode());
    }

    @Override
    public String toString() {
        return "(" + source + ", " + (symbol == null ? "eps" : symbol) + ")";
    }
}
