package eu.virtualparadox.reportparser.position;

import eu.virtualparadox.reportparser.diagnostic.DiagnosticSink;
import eu.virtualparadox.reportparser.diagnostic.MarkerDiagnostic;
import eu.virtualparadox.reportparser.pattern.CompiledPattern;
import eu.virtualparadox.reportparser.pattern.PatternCompiler;
import eu.virtualparadox.reportparser.section.EMatchStrategy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves where sections start and end inside a text.
 *
 * <h2>Start resolution</h2>
 * <ul>
 *   <li>{@link #findFirstStart} returns the first position matching any start marker. Fragments
 *       that match more than once are reported to the {@link DiagnosticSink}.</li>
 *   <li>{@link #findAllStarts} returns every non-overlapping match, left to right.</li>
 *   <li>A {@code null} marker list means the section starts at the beginning of the text.</li>
 * </ul>
 *
 * <h2>End resolution</h2>
 * <ul>
 *   <li><strong>Greedy:</strong> all end markers compete together; the earliest match in the
 *       remaining text wins regardless of list order.</li>
 *   <li><strong>Sequential:</strong> markers are tried in list order; the first marker that matches
 *       anywhere in the remaining text decides the boundary, even if a later marker occurs earlier.</li>
 *   <li>A {@code null} marker list, or no match at all, means the section runs to the end of the text.</li>
 * </ul>
 *
 * <p>The remaining text is the slice starting at {@code fromPos}; anchors and word boundaries see
 * that slice start as the beginning of input. Returned offsets are always absolute.</p>
 *
 * <p>Instances hold no per-call state and may be shared across threads, provided the sink is thread-safe.</p>
 */
public final class PositionFinder {

    private final PatternCompiler compiler;
    private final DiagnosticSink diagnostics;

    public PositionFinder(final PatternCompiler compiler, final DiagnosticSink diagnostics) {
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
    }

    /**
     * Finds the first span matching any of {@code markers}.
     *
     * @param text         input text
     * @param markers      start markers, or {@code null} for "start of text"
     * @param wordBoundary anchor markers on word boundaries
     * @return first span, {@link MatchSpan#TEXT_START} for {@code null} markers,
     *         or {@link MatchSpan#NOT_FOUND} when nothing matches
     */
    public MatchSpan findFirstStart(final String text, final List<String> markers, final boolean wordBoundary) {
        if (markers == null) {
            return MatchSpan.TEXT_START;
        }
        final CompiledPattern pattern = compiler.compile(markers, wordBoundary);

        for (String marker : markers) {
            reportDuplicates(text, marker);
        }

        return pattern.findFirst(text).orElse(MatchSpan.NOT_FOUND);
    }

    /**
     * Finds every non-overlapping span matching any of {@code markers}.
     *
     * @param text         input text
     * @param markers      start markers, or {@code null} for "start of text"
     * @param wordBoundary anchor markers on word boundaries
     * @return spans in document order; {@code [TEXT_START]} for {@code null} markers; empty when nothing matches
     */
    public List<MatchSpan> findAllStarts(final String text, final List<String> markers, final boolean wordBoundary) {
        if (markers == null) {
            return List.of(MatchSpan.TEXT_START);
        }
        return List.copyOf(compiler.compile(markers, wordBoundary).findAll(text));
    }

    /**
     * Start resolution that honours marker priority: the first marker (by list order) that matches
     * anywhere wins, and its first occurrence is returned.
     *
     * @param text         input text
     * @param markers      start markers in priority order, or {@code null}
     * @param wordBoundary anchor markers on word boundaries
     * @return span of the winning marker, {@link MatchSpan#TEXT_START} or {@link MatchSpan#NOT_FOUND}
     */
    public MatchSpan findFirstStartSequential(final String text, final List<String> markers, final boolean wordBoundary) {
        if (markers == null) {
            return MatchSpan.TEXT_START;
        }
        for (String marker : markers) {
            final CompiledPattern pattern = compiler.compile(List.of(marker), wordBoundary);
            final List<MatchSpan> matches = pattern.findAll(text);
            if (!matches.isEmpty()) {
                if (matches.size() >= 2) {
                    diagnostics.report(new MarkerDiagnostic(marker, matches.size()));
                }
                return matches.get(0);
            }
        }
        return MatchSpan.NOT_FOUND;
    }

    /**
     * Collects the matches of each marker individually and merges them into document order.
     * Unlike {@link #findAllStarts}, spans produced by different markers may overlap.
     *
     * @param text         input text
     * @param markers      start markers, or {@code null}
     * @param wordBoundary anchor markers on word boundaries
     * @return spans sorted by start then end; {@code [TEXT_START]} for {@code null} markers
     */
    public List<MatchSpan> findAllStartsSequential(final String text, final List<String> markers, final boolean wordBoundary) {
        if (markers == null) {
            return List.of(MatchSpan.TEXT_START);
        }
        final List<MatchSpan> positions = new ArrayList<>();
        for (String marker : markers) {
            positions.addAll(compiler.compile(List.of(marker), wordBoundary).findAll(text));
        }
        positions.sort(Comparator.comparingInt(MatchSpan::start).thenComparingInt(MatchSpan::end));
        return List.copyOf(positions);
    }

    /**
     * Greedy end resolution.
     *
     * @param text         input text
     * @param endMarkers   end markers, or {@code null} for "end of text"
     * @param fromPos      absolute offset the remaining text starts at
     * @param wordBoundary anchor markers on word boundaries
     * @return absolute offset of the earliest end-marker match, or {@code text.length()}
     */
    public int findEndGreedy(final String text, final List<String> endMarkers, final int fromPos, final boolean wordBoundary) {
        if (endMarkers == null) {
            return text.length();
        }
        final int offset = clamp(fromPos, text.length());
        final Optional<MatchSpan> match = compiler.compile(endMarkers, wordBoundary).findFirst(text.substring(offset));
        return match.map(span -> offset + span.start()).orElse(text.length());
    }

    /**
     * Sequential end resolution.
     *
     * @param text         input text
     * @param endMarkers   end markers in priority order, or {@code null} for "end of text"
     * @param fromPos      absolute offset the remaining text starts at
     * @param wordBoundary anchor markers on word boundaries
     * @return absolute offset of the first match of the highest-priority matching marker, or {@code text.length()}
     */
    public int findEndSequential(final String text, final List<String> endMarkers, final int fromPos, final boolean wordBoundary) {
        if (endMarkers == null) {
            return text.length();
        }
        final int offset = clamp(fromPos, text.length());
        final String remainder = text.substring(offset);

        for (String marker : endMarkers) {
            final Optional<MatchSpan> match = compiler.compile(List.of(marker), wordBoundary).findFirst(remainder);
            if (match.isPresent()) {
                return offset + match.get().start();
            }
        }
        return text.length();
    }

    /**
     * Dispatches to {@link #findEndGreedy} or {@link #findEndSequential}.
     */
    public int findEnd(final String text,
                       final List<String> endMarkers,
                       final int fromPos,
                       final boolean wordBoundary,
                       final EMatchStrategy strategy) {
        return switch (strategy) {
            case GREEDY -> findEndGreedy(text, endMarkers, fromPos, wordBoundary);
            case SEQUENTIAL -> findEndSequential(text, endMarkers, fromPos, wordBoundary);
        };
    }

    /**
     * Returns the marker text of the first keyword occurrence, looked up in dot-matches-all mode.
     *
     * @param text         input text
     * @param markers      markers, or {@code null}
     * @param wordBoundary anchor markers on word boundaries
     * @return the matched keyword text, or empty when {@code markers} is null or nothing matches
     */
    public Optional<String> findFirstKeyword(final String text, final List<String> markers, final boolean wordBoundary) {
        if (markers == null) {
            return Optional.empty();
        }
        return compiler.compileKeywordLookup(markers, wordBoundary).firstGroup(text, 1);
    }

    public DiagnosticSink getDiagnosticSink() {
        return diagnostics;
    }

    /**
     * Compiles every pattern that resolving {@code startMarkers} and {@code endMarkers} can need, so
     * that a bad fragment is reported before any text is processed.
     *
     * @param startMarkers start markers, or {@code null}
     * @param endMarkers   end markers, or {@code null}
     * @param wordBoundary anchor markers on word boundaries
     * @throws eu.virtualparadox.reportparser.section.SectionConfigurationException for an empty list
     *         or an invalid fragment
     */
    public void precompile(final List<String> startMarkers, final List<String> endMarkers, final boolean wordBoundary) {
        if (startMarkers != null) {
            compiler.compile(startMarkers, wordBoundary);
            for (String marker : startMarkers) {
                compiler.compile(List.of(marker), false);
            }
        }
        if (endMarkers != null) {
            compiler.compile(endMarkers, wordBoundary);
            for (String marker : endMarkers) {
                compiler.compile(List.of(marker), wordBoundary);
            }
        }
    }

    private void reportDuplicates(final String text, final String marker) {
        final int count = compiler.compile(List.of(marker), false).findAll(text).size();
        if (count >= 2) {
            diagnostics.report(new MarkerDiagnostic(marker, count));
        }
    }

    private static int clamp(final int value, final int max) {
        return Math.max(0, Math.min(value, max));
    }
}
