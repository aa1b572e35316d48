package eu.virtualparadox.reportparser.position;

/**
 * Half-open span {@code [start, end)} over character offsets of the searched text.
 */
public record MatchSpan(int start, int end) {

    /**
     * Sentinel returned when no marker matched.
     */
    public static final MatchSpan NOT_FOUND = new MatchSpan(-1, -1);

    /**
     * Sentinel for "section starts at the beginning of the text" (no start markers).
     */
    public static final MatchSpan TEXT_START = new MatchSpan(0, 0);

    public boolean isFound() {
        return start >= 0;
    }

    public int length() {
        return end - start;
    }
}
