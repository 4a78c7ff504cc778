/* @LICENSE@
 */
package org.motifa.automata;

/**
 * Thrown when pattern text cannot be turned into an automaton: a malformed
 * spacer range, a symbol outside the alphabet, or an empty pattern where a
 * motif is required. Modelled on
 * {@link java.util.regex.PatternSyntaxException}.
 */
public class InvalidPatternException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String desc;
    private final String pattern;
    private final int index;

    /**
     * @param desc
     *            a description of the error
     * @param pattern
     *            the offending pattern text
     * @param index
     *            the approximate index of the error, or -1 if not known
     */
    public InvalidPatternException(String desc, String pattern, int index) {
        this.desc = desc;
        this.pattern = pattern;
        this.index = index;
    }

    public InvalidPatternException(String desc, String pattern, int index,
            Throwable cause) {
        this(desc, pattern, index);
        initCause(cause);
    }

    public String getDescription() {
        return desc;
    }

    public String getPattern() {
        return pattern;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(desc);
        if (index >= 0) {
            sb.append(" near index ").append(index);
        }
        sb.append(Misc.LS).append(pattern);
        if (index >= 0 && pattern != null && index <= pattern.length()) {
            sb.append(Misc.LS);
            for (int i = 0; i < index; ++i) sb.append(' ');
            sb.append('^');
        }
        return sb.toString();
    }
}
