package eu.virtualparadox.reportparser.pattern;

import eu.virtualparadox.reportparser.section.SectionConfigurationException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns an ordered list of marker fragments into a single alternation pattern.
 *
 * <h2>Shape</h2>
 * <pre>
 *     (?:m1|m2|...|mn)          # plain
 *     \b(?:m1|m2|...|mn)\b      # with word boundary
 * </pre>
 * Fragments are regular expressions, not literals. Matching is always case-insensitive.
 * The word-boundary form keeps {@code history} from matching inside {@code clinicalhistory}.
 *
 * <p>Compiled patterns are cached per expression, so marker lists resolved on every extraction are
 * compiled once. The compiler may be shared between threads.</p>
 */
public final class PatternCompiler {

    private final PatternEngine engine;
    private final Map<String, CompiledPattern> cache = new ConcurrentHashMap<>();

    public PatternCompiler(final PatternEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /**
     * Compiles markers into one alternation.
     *
     * @param markers         non-null list of at least one fragment
     * @param useWordBoundary anchor the alternation on word boundaries
     * @return compiled pattern
     * @throws NullPointerException          if {@code markers} is null
     * @throws SectionConfigurationException if {@code markers} is empty or a fragment is invalid
     */
    public CompiledPattern compile(final List<String> markers, final boolean useWordBoundary) {
        return cached(alternation(markers, useWordBoundary), false);
    }

    /**
     * Compiles the keyword lookup form: the alternation captured in group 1, followed by a lazy
     * {@code .*?}, in dot-matches-all mode.
     *
     * @param markers         non-null list of at least one fragment
     * @param useWordBoundary anchor the alternation on word boundaries
     * @return compiled pattern whose group 1 holds the matched keyword
     */
    public CompiledPattern compileKeywordLookup(final List<String> markers, final boolean useWordBoundary) {
        return cached("(" + alternation(markers, useWordBoundary) + ").*?", true);
    }

    public PatternEngine getEngine() {
        return engine;
    }

    private CompiledPattern cached(final String regex, final boolean dotAll) {
        // Invalid expressions throw out of computeIfAbsent and are never cached.
        return cache.computeIfAbsent((dotAll ? "s:" : "n:") + regex, key -> engine.compile(regex, dotAll));
    }

    private static String alternation(final List<String> markers, final boolean useWordBoundary) {
        Objects.requireNonNull(markers, "markers must not be null");
        if (markers.isEmpty()) {
            throw new SectionConfigurationException("markers must have at least one element");
        }
        final String group = "(?:" + String.join("|", markers) + ")";
        return useWordBoundary ? "\\b" + group + "\\b" : group;
    }
}
