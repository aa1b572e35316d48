package eu.virtualparadox.reportparser.pattern;

/**
 * Regular-expression capability used by the section engine.
 * <p>Implementations always compile case-insensitively. The boundary code depends only on this
 * interface, so the backing regex library can be swapped without touching the search logic.</p>
 */
public interface PatternEngine {

    /**
     * Compiles a regular expression.
     *
     * @param regex  expression source
     * @param dotAll whether {@code .} also matches line terminators
     * @return compiled pattern
     * @throws eu.virtualparadox.reportparser.section.SectionConfigurationException if the expression is invalid
     */
    CompiledPattern compile(final String regex, final boolean dotAll);

}
