/* @LICENSE@
 */
package org.motifa.automata;

/**
 * A state of the {@link SpacerEnfa}: the phase of the motif being read and the
 * progress within it. In the head and tail phases progress counts the motif
 * symbols matched so far; in the spacer phase it counts the spacer bases read.
 * <p>
 * States order by phase (head, spacer, tail), then by progress.
 */
public final class SpacerState implements Comparable<SpacerState> {

    public enum Phase {
        HEAD("head"), SPACER("spacer"), TAIL("tail");

        private final String label;

        Phase(String label) {
            this.label = label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    private final Phase phase;
    private final int progress;

    public SpacerState(Phase phase, int progress) {
        if (phase == null) throw new NullPointerException("phase");
        if (progress < 0) {
            throw new IllegalArgumentException("negative progress: " + progress);
        }
        this.phase = phase;
        this.progress = progress;
    }

    public static SpacerState head(int k) {
        return new SpacerState(Phase.HEAD, k);
    }

    public static SpacerState spacer(int g) {
        return new SpacerState(Phase.SPACER, g);
    }

    public static SpacerState tail(int k) {
        return new SpacerState(Phase.TAIL, k);
    }

    public Phase phase() {
        return phase;
    }

    public int progress() {
        return progress;
    }

    public int compareTo(SpacerState that) {
        int c = phase.compareTo(that.phase);
        if (c != 0) return c;
        return progress < that.progress ? -1 : progress == that.progress ? 0 : 1;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SpacerState)) return false;
        SpacerState that = (SpacerState) obj;
        return phase == that.phase && progress == that.progress;
    }

    @Override
    public int hashCode() {
        return 31 * phase.hashCode() + progress;
    }

    /**
     * @return e.g. <code>head:2</code>
     */
    @Override
    public String toString() {
        return phase + ":" + progress;
    }
}
