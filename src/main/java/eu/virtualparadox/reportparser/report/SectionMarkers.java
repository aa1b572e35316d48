package eu.virtualparadox.reportparser.report;

import java.util.List;
import java.util.Objects;

/**
 * Start-marker lists for each canonical heading plus the footer, from which the
 * section table of {@link RadReportExtractor} is derived.
 */
public record SectionMarkers(List<String> history,
                             List<String> technique,
                             List<String> comparison,
                             List<String> findings,
                             List<String> impression,
                             List<String> footer) {

    public SectionMarkers {
        history = List.copyOf(Objects.requireNonNull(history, "history markers must not be null"));
        technique = List.copyOf(Objects.requireNonNull(technique, "technique markers must not be null"));
        comparison = List.copyOf(Objects.requireNonNull(comparison, "comparison markers must not be null"));
        findings = List.copyOf(Objects.requireNonNull(findings, "findings markers must not be null"));
        impression = List.copyOf(Objects.requireNonNull(impression, "impression markers must not be null"));
        footer = List.copyOf(Objects.requireNonNull(footer, "footer markers must not be null"));
    }

    public static SectionMarkers defaults() {
        return new SectionMarkers(
                ReportKeyword.HISTORY.getPatterns(),
                ReportKeyword.TECHNIQUE.getPatterns(),
                ReportKeyword.COMPARISON.getPatterns(),
                ReportKeyword.FINDINGS.getPatterns(),
                ReportKeyword.IMPRESSION.getPatterns(),
                ReportKeyword.FOOTER.getPatterns());
    }

    public SectionMarkers withHistory(final List<String> markers) {
        return new SectionMarkers(markers, technique, comparison, findings, impression, footer);
    }

    public SectionMarkers withTechnique(final List<String> markers) {
        return new SectionMarkers(history, markers, comparison, findings, impression, footer);
    }

    public SectionMarkers withComparison(final List<String> markers) {
        return new SectionMarkers(history, technique, markers, findings, impression, footer);
    }

    public SectionMarkers withFindings(final List<String> markers) {
        return new SectionMarkers(history, technique, comparison, markers, impression, footer);
    }

    public SectionMarkers withImpression(final List<String> markers) {
        return new SectionMarkers(history, technique, comparison, findings, markers, footer);
    }

    public SectionMarkers withFooter(final List<String> markers) {
        return new SectionMarkers(history, technique, comparison, findings, impression, markers);
    }
}
