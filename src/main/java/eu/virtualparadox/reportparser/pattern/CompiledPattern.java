package eu.virtualparadox.reportparser.pattern;

import eu.virtualparadox.reportparser.position.MatchSpan;

import java.util.List;
import java.util.Optional;

/**
 * Engine-neutral compiled expression. Instances are immutable and thread-safe.
 */
public interface CompiledPattern {

    /**
     * @return the expression this pattern was compiled from
     */
    String pattern();

    /**
     * Finds the first match in {@code text}.
     *
     * @param text input text (non-null)
     * @return span of the first match, or empty if nothing matches
     */
    Optional<MatchSpan> findFirst(final String text);

    /**
     * Finds all non-overlapping matches scanning left to right.
     *
     * @param text input text (non-null)
     * @return spans in document order, never {@code null}
     */
    List<MatchSpan> findAll(final String text);

    /**
     * Returns the text of capture group {@code group} of the first match.
     *
     * @param text  input text (non-null)
     * @param group capture group index
     * @return captured text, or empty if nothing matches or the group did not participate
     */
    Optional<String> firstGroup(final String text, final int group);
}
