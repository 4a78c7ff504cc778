/* @LICENSE@
 */
package org.motifa.automata;

/**
 * A parsed <code>HEAD{min,max}TAIL</code> pattern: a head motif, a spacer of
 * any bases whose length lies in <code>[minGap, maxGap]</code>, and a tail
 * motif. Immutable; <code>0 &lt;= minGap &lt;= maxGap</code> always holds.
 */
public final class SpacerPattern {

    final String head;
    final int minGap;
    final int maxGap;
    final String tail;

    SpacerPattern(String head, int minGap, int maxGap, String tail) {
        assert 0 <= minGap && minGap <= maxGap : minGap + "," + maxGap;
        this.head = head;
        this.minGap = minGap;
        this.maxGap = maxGap;
        this.tail = tail;
    }

    public String head() {
        return head;
    }

    public int minGap() {
        return minGap;
    }

    public int maxGap() {
        return maxGap;
    }

    public String tail() {
        return tail;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SpacerPattern)) return false;
        SpacerPattern that = (SpacerPattern) obj;
        return minGap == that.minGap && maxGap == that.maxGap
            && head.equals(that.head) && tail.equals(that.tail);
    }

    @Override
    public int hashCode() {
        int h = head.hashCode();
        h = 31 * h + minGap;
        h = 31 * h + maxGap;
        return 31 * h + tail.hashCode();
    }

    /**
     * @return the canonical text form; the single bound form is used when
     *         <code>minGap == maxGap</code>.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(head).append('{').append(minGap);
        if (maxGap != minGap) sb.append(',').append(maxGap);
        return sb.append('}').append(tail).toString();
    }
}
