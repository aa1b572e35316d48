package eu.virtualparadox.reportparser.position;

import eu.virtualparadox.reportparser.diagnostic.CollectingDiagnosticSink;
import eu.virtualparadox.reportparser.diagnostic.MarkerDiagnostic;
import eu.virtualparadox.reportparser.pattern.JdkPatternEngine;
import eu.virtualparadox.reportparser.pattern.PatternCompiler;
import eu.virtualparadox.reportparser.section.EMatchStrategy;
import eu.virtualparadox.reportparser.section.SectionConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PositionFinderTest {

    private CollectingDiagnosticSink sink;
    private PositionFinder finder;

    @BeforeEach
    void setUp() {
        sink = new CollectingDiagnosticSink();
        finder = new PositionFinder(new PatternCompiler(new JdkPatternEngine()), sink);
    }

    // ---- start resolution ----

    @Test
    @DisplayName("First start marker span is returned")
    void findsSimpleStart() {
        MatchSpan span = finder.findFirstStart("FINDINGS: Normal study", List.of("FINDINGS:"), false);
        assertEquals(new MatchSpan(0, 9), span);
        assertEquals(9, span.length());
    }

    @Test
    @DisplayName("Leftmost match wins across all start markers")
    void leftmostAcrossMarkers() {
        String text = "Clinical History: Patient presents with...";
        MatchSpan span = finder.findFirstStart(text, List.of("History:", "Clinical History:"), false);
        assertEquals(new MatchSpan(0, 17), span);
    }

    @Test
    @DisplayName("Start markers are case-insensitive")
    void caseInsensitiveStart() {
        assertEquals(new MatchSpan(0, 9), finder.findFirstStart("findings: Normal study", List.of("FINDINGS:"), false));
    }

    @Test
    @DisplayName("Null start markers mean start of text")
    void nullStartMarkers() {
        assertEquals(MatchSpan.TEXT_START, finder.findFirstStart("Some text", null, false));
        assertEquals(List.of(MatchSpan.TEXT_START), finder.findAllStarts("Some text", null, false));
        assertEquals(MatchSpan.TEXT_START, finder.findFirstStartSequential("Some text", null, false));
        assertEquals(List.of(MatchSpan.TEXT_START), finder.findAllStartsSequential("Some text", null, true));
    }

    @Test
    @DisplayName("Missing start marker yields NOT_FOUND or an empty list")
    void missingStartMarker() {
        MatchSpan span = finder.findFirstStart("Some text without markers", List.of("FINDINGS:"), false);
        assertEquals(MatchSpan.NOT_FOUND, span);
        assertFalse(span.isFound());
        assertTrue(finder.findAllStarts("Some text without markers", List.of("FINDINGS:"), false).isEmpty());
    }

    @Test
    @DisplayName("Word boundary rejects markers glued to other word characters")
    void wordBoundaryStart() {
        String text = "FINDINGSx: Not a real heading";
        assertEquals(new MatchSpan(0, 8), finder.findFirstStart(text, List.of("FINDINGS"), false));
        assertEquals(MatchSpan.NOT_FOUND, finder.findFirstStart(text, List.of("FINDINGS"), true));
    }

    @Test
    @DisplayName("All starts are returned in document order")
    void findAllStarts() {
        String text = "FINDINGS: First finding\n    FINDINGS: Second finding\n    FINDINGS: Third finding";
        List<MatchSpan> spans = finder.findAllStarts(text, List.of("FINDINGS:"), false);

        assertEquals(3, spans.size());
        for (MatchSpan span : spans) {
            assertEquals("FINDINGS:", text.substring(span.start(), span.end()));
        }
        assertThat(spans).isSortedAccordingTo((a, b) -> Integer.compare(a.start(), b.start()));
    }

    @Test
    @DisplayName("All starts cover every marker variant")
    void findAllStartsMultipleMarkers() {
        String text = "FINDING: First\n    FINDINGS: Second\n    FINDING: Third";
        assertEquals(3, finder.findAllStarts(text, List.of("FINDING:", "FINDINGS:"), false).size());
    }

    @Test
    @DisplayName("Sequential start honours marker priority over position")
    void sequentialStartPriority() {
        MatchSpan span = finder.findFirstStartSequential("AAA BBB", List.of("BBB", "AAA"), false);
        assertEquals(new MatchSpan(4, 7), span);
    }

    @Test
    @DisplayName("Sequential all-starts merges every marker's matches by position")
    void sequentialAllStarts() {
        String text = "AAA: First\n    BBB: Second\n    AAA: Third";
        List<MatchSpan> spans = finder.findAllStartsSequential(text, List.of("BBB:", "AAA:"), false);

        assertEquals(3, spans.size());
        assertEquals(0, spans.get(0).start());
        assertEquals(text.indexOf("BBB:"), spans.get(1).start());
        assertEquals(text.lastIndexOf("AAA:"), spans.get(2).start());
    }

    @Test
    @DisplayName("Empty marker list is a configuration error")
    void emptyStartMarkers() {
        assertThrows(SectionConfigurationException.class, () -> finder.findFirstStart("text", List.of(), false));
    }

    // ---- end resolution ----

    @Test
    @DisplayName("Greedy end takes the earliest match regardless of marker order")
    void greedyEnd() {
        String text = "HISTORY: Patient info FINDINGS: Normal IMPRESSION: Clear";
        assertEquals(22, finder.findEndGreedy(text, List.of("IMPRESSION:", "FINDINGS:"), 0, false));
    }

    @Test
    @DisplayName("End defaults to text length when nothing matches or markers are null")
    void endFallsBackToTextLength() {
        String text = "Some text without markers";
        assertEquals(text.length(), finder.findEndGreedy(text, List.of("FINDINGS:"), 0, false));
        assertEquals(text.length(), finder.findEndGreedy(text, null, 0, false));
        assertEquals(text.length(), finder.findEndSequential(text, List.of("FINDINGS:"), 0, false));
        assertEquals(text.length(), finder.findEndSequential(text, null, 0, false));
    }

    @Test
    @DisplayName("Sequential end follows marker order, not position")
    void sequentialEndOrder() {
        String text = "HISTORY: Info TECHNIQUES: Details FINDINGS: Normal";

        int techniqueFirst = finder.findEndSequential(text, List.of("TECHNIQUES:", "FINDINGS:"), 0, false);
        assertTrue(text.substring(techniqueFirst).startsWith("TECHNIQUES:"));

        int findingsFirst = finder.findEndSequential(text, List.of("FINDINGS:", "TECHNIQUES:"), 0, false);
        assertTrue(text.substring(findingsFirst).startsWith("FINDINGS:"));
    }

    @Test
    @DisplayName("End search skips matches before fromPos and returns absolute offsets")
    void endRespectsFromPos() {
        String text = "IMPRESSION: a FINDINGS: b IMPRESSION: c";
        assertEquals(text.lastIndexOf("IMPRESSION:"), finder.findEndGreedy(text, List.of("IMPRESSION:"), 13, false));
        assertEquals(text.lastIndexOf("IMPRESSION:"), finder.findEndSequential(text, List.of("IMPRESSION:"), 13, false));
        assertEquals(0, finder.findEndGreedy(text, List.of("IMPRESSION:"), 0, false));
    }

    @Test
    @DisplayName("Dispatch picks the strategy's end resolution")
    void findEndDispatch() {
        String text = "HISTORY: a\nIMPRESSION: b\nFINDINGS: c";
        List<String> ends = List.of("FINDINGS:", "IMPRESSION:");
        assertEquals(text.indexOf("IMPRESSION:"), finder.findEnd(text, ends, 0, false, EMatchStrategy.GREEDY));
        assertEquals(text.indexOf("FINDINGS:"), finder.findEnd(text, ends, 0, false, EMatchStrategy.SEQUENTIAL));
    }

    @Test
    @DisplayName("Empty and whitespace texts resolve to their own length")
    void edgeCaseTexts() {
        assertEquals(MatchSpan.NOT_FOUND, finder.findFirstStart("", List.of("TEST:"), false));
        assertEquals(0, finder.findEndGreedy("", List.of("TEST:"), 0, false));
        assertEquals(0, finder.findEndSequential("", List.of("TEST:"), 0, false));

        String whitespace = "   \n\t  ";
        assertEquals(MatchSpan.NOT_FOUND, finder.findFirstStart(whitespace, List.of("TEST:"), false));
        assertEquals(whitespace.length(), finder.findEndGreedy(whitespace, List.of("TEST:"), 0, false));
    }

    @Test
    @DisplayName("fromPos at or past the end of the text returns the text length")
    void fromPosAtEnd() {
        String text = "Some text";
        assertEquals(text.length(), finder.findEndGreedy(text, List.of("TEST:"), text.length(), false));
        assertEquals(text.length(), finder.findEndSequential(text, List.of("TEST:"), text.length(), false));
        assertEquals(text.length(), finder.findEndGreedy(text, List.of("TEST:"), text.length() + 5, false));
    }

    // ---- diagnostics ----

    @Test
    @DisplayName("A fragment matching three times yields one diagnostic and the first position")
    void duplicateStartReported() {
        String text = "History: one\nHistory: two\nhistory: three";
        MatchSpan span = finder.findFirstStart(text, List.of("History"), false);

        assertEquals(new MatchSpan(0, 7), span);
        assertEquals(List.of(new MarkerDiagnostic("History", 3)), sink.getDiagnostics());
        assertEquals("Start pattern History appears 3 times in text, only the first one will be matched.",
                sink.getDiagnostics().get(0).message());
    }

    @Test
    @DisplayName("Each fragment is counted independently")
    void duplicatesPerFragment() {
        finder.findFirstStart("History: a\nFindings: b\nHistory: c", List.of("History", "Findings"), false);
        assertEquals(List.of(new MarkerDiagnostic("History", 2)), sink.getDiagnostics());

        sink.clear();
        finder.findFirstStart("History Findings History Findings", List.of("History", "Findings"), false);
        assertEquals(2, sink.getDiagnostics().size());
    }

    @Test
    @DisplayName("Single occurrences and all-starts lookups emit nothing")
    void noDiagnosticsWhenUnique() {
        finder.findFirstStart("History: once", List.of("History"), false);
        finder.findAllStarts("History: a History: b", List.of("History"), false);
        assertTrue(sink.getDiagnostics().isEmpty());
    }

    @Test
    @DisplayName("Sequential start reports only the winning marker")
    void sequentialDiagnostics() {
        finder.findFirstStartSequential("AAA BBB BBB AAA", List.of("BBB", "AAA"), false);
        assertEquals(List.of(new MarkerDiagnostic("BBB", 2)), sink.getDiagnostics());
    }

    // ---- keyword lookup ----

    @Test
    @DisplayName("Keyword lookup returns the matched heading text")
    void findFirstKeyword() {
        String text = "EXAM\nClinical History: cough";
        assertEquals(Optional.of("Clinical History:"),
                finder.findFirstKeyword(text, List.of("History:", "Clinical History:"), false));
        assertEquals(Optional.empty(), finder.findFirstKeyword(text, List.of("Impression:"), false));
        assertEquals(Optional.empty(), finder.findFirstKeyword(text, null, false));
    }
}
