package eu.virtualparadox.reportparser.section;

import eu.virtualparadox.reportparser.diagnostic.LoggingDiagnosticSink;
import eu.virtualparadox.reportparser.pattern.JdkPatternEngine;
import eu.virtualparadox.reportparser.pattern.PatternCompiler;
import eu.virtualparadox.reportparser.position.MatchSpan;
import eu.virtualparadox.reportparser.position.PositionFinder;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Extracts a section delimited by start and end markers.
 *
 * <h2>Resolution</h2>
 * <ol>
 *   <li>Find the start marker (first match of any start marker). No match yields an empty result.</li>
 *   <li>Find the end boundary with the configured {@link EMatchStrategy}, searching from the
 *       <em>start</em> of the start-marker match.</li>
 *   <li>Slice from the start of the match (marker included) or its end (marker excluded) up to the
 *       end boundary, and strip surrounding whitespace.</li>
 * </ol>
 * A {@code null} start-marker list starts the section at offset 0; a {@code null} end-marker list
 * runs it to the end of the text.
 *
 * <h2>Thread-safety</h2>
 * Instances are immutable once constructed and can be reused across texts and threads. Every marker
 * pattern is compiled at construction, so configuration mistakes surface before the first text.
 *
 * <h2>Example</h2>
 * <pre>
 *   SectionExtractor findings = new SectionExtractor(
 *           List.of("FINDINGS:"), List.of("IMPRESSION:"), SectionBoundaryOptions.DEFAULTS);
 *   findings.extract("FINDINGS: Normal chest. IMPRESSION: No acute disease.");
 *   // "FINDINGS: Normal chest."
 * </pre>
 */
public final class SectionExtractor {

    private final List<String> startMarkers;
    private final List<String> endMarkers;
    private final SectionBoundaryOptions options;
    private final PositionFinder positionFinder;

    /**
     * Creates an extractor using the JDK regex engine and logging diagnostics.
     *
     * @param startMarkers start markers, or {@code null} for "start of text"
     * @param endMarkers   end markers, or {@code null} for "end of text"
     * @param options      matching options (non-null)
     */
    public SectionExtractor(final List<String> startMarkers,
                            final List<String> endMarkers,
                            final SectionBoundaryOptions options) {
        this(startMarkers, endMarkers, options,
                new PositionFinder(new PatternCompiler(new JdkPatternEngine()), new LoggingDiagnosticSink()));
    }

    /**
     * @param startMarkers   start markers, or {@code null} for "start of text"
     * @param endMarkers     end markers, or {@code null} for "end of text"
     * @param options        matching options (non-null)
     * @param positionFinder finder carrying the regex engine and diagnostic sink
     * @throws SectionConfigurationException if {@code options} is null, a marker list is empty or a
     *                                       fragment does not compile
     */
    public SectionExtractor(final List<String> startMarkers,
                            final List<String> endMarkers,
                            final SectionBoundaryOptions options,
                            final PositionFinder positionFinder) {
        if (options == null) {
            throw new SectionConfigurationException("options must not be null");
        }
        this.startMarkers = startMarkers == null ? null : List.copyOf(startMarkers);
        this.endMarkers = endMarkers == null ? null : List.copyOf(endMarkers);
        this.options = options;
        this.positionFinder = Objects.requireNonNull(positionFinder, "positionFinder must not be null");
        positionFinder.precompile(this.startMarkers, this.endMarkers, options.useWordBoundary());
    }

    /**
     * Builds an extractor from a strategy name, as it arrives from configuration.
     *
     * @throws SectionConfigurationException if {@code matchStrategy} is not {@code greedy} or {@code sequential}
     */
    public static SectionExtractor of(final List<String> startMarkers,
                                      final List<String> endMarkers,
                                      final boolean includeStartMarker,
                                      final boolean useWordBoundary,
                                      final String matchStrategy) {
        return new SectionExtractor(startMarkers, endMarkers,
                new SectionBoundaryOptions(includeStartMarker, useWordBoundary, EMatchStrategy.fromValue(matchStrategy)));
    }

    /**
     * Extracts the first occurrence of the section.
     *
     * @param text input text; {@code null} is treated as empty
     * @return stripped section text, or {@code ""} when the start marker is absent
     */
    public String extract(final String text) {
        final String source = StringUtils.defaultString(text);
        final MatchSpan start = positionFinder.findFirstStart(source, startMarkers, options.useWordBoundary());
        if (!start.isFound()) {
            return "";
        }
        return slice(source, start);
    }

    /**
     * Extracts every occurrence of the section. Each occurrence resolves its own end boundary from
     * its own start, so occurrences may overlap. Occurrences that strip to empty are dropped.
     *
     * @param text input text; {@code null} is treated as empty
     * @return non-empty sections in document order (unmodifiable)
     */
    public List<String> extractAll(final String text) {
        final String source = StringUtils.defaultString(text);
        final List<MatchSpan> starts = positionFinder.findAllStarts(source, startMarkers, options.useWordBoundary());
        if (starts.isEmpty()) {
            return Collections.emptyList();
        }

        final List<String> sections = new ArrayList<>(starts.size());
        for (MatchSpan start : starts) {
            final String section = slice(source, start);
            if (!section.isEmpty()) {
                sections.add(section);
            }
        }
        return Collections.unmodifiableList(sections);
    }

    public List<String> getStartMarkers() {
        return startMarkers;
    }

    public List<String> getEndMarkers() {
        return endMarkers;
    }

    public SectionBoundaryOptions getOptions() {
        return options;
    }

    private String slice(final String text, final MatchSpan start) {
        final int end = positionFinder.findEnd(text, endMarkers, start.start(), options.useWordBoundary(), options.matchStrategy());
        final int from = options.includeStartMarker() ? start.start() : start.end();
        // An end marker inside the start match leaves nothing to extract.
        if (end <= from) {
            return "";
        }
        return text.substring(from, end).strip();
    }

    @Override
    public String toString() {
        return "SectionExtractor{startMarkers=" + startMarkers
                + ", endMarkers=" + endMarkers
                + ", options=" + options + '}';
    }
}
