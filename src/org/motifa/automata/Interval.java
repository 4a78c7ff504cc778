/* @LICENSE@
 */
package org.motifa.automata;

/**
 * A closed range <code>[start, end]</code> of positions in a scanned sequence,
 * denoting one recognized occurrence. Both ends are inclusive and 0-based, so
 * the matched text is <code>sequence.substring(start, end + 1)</code>.
 * <p>
 * Intervals order by start, then by end.
 */
public final class Interval implements Comparable<Interval> {

    private final int start;
    private final int end;

    public Interval(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(
                "bad interval: [" + start + ", " + end + "]");
        }
        this.start = start;
        this.end = end;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    public int length() {
        return end - start + 1;
    }

    /**
     * @return the text of this interval within <code>csq</code>.
     */
    public String of(CharSequence csq) {
        return csq.subSequence(start, end + 1).toString();
    }

    public int compareTo(Interval that) {
        if (start != that.start) return start < that.start ? -1 : 1;
        if (end != that.end) return end < that.end ? -1 : 1;
        return 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Interval)) return false;
        Interval that = (Interval) obj;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
