package eu.virtualparadox.reportparser.report;

import java.util.List;

/**
 * Default heading patterns for the sections commonly found in radiology reports.
 * <p>Every pattern is wrapped in {@code [^\w\n]*} so that surrounding punctuation and markup
 * ({@code **History:**}, {@code - Findings -}) is consumed along with the heading word without
 * crossing a line break. {@code (s?)} accepts singular and plural forms.</p>
 */
public enum ReportKeyword {
    HISTORY(List.of(
            "[^\\w\\n]*History[^\\w\\n]*",
            "[^\\w\\n]*Indication(s?)[^\\w\\n]*",
            "[^\\w\\n]*clinical\\s+history[^\\w\\n]*",
            "[^\\w\\n]*clinical\\s+indication(s?)[^\\w\\n]*")),
    TECHNIQUE(List.of("[^\\w\\n]*Technique(s?)[^\\w\\n]*")),
    COMPARISON(List.of("[^\\w\\n]*Comparison(s?)[^\\w\\n]*")),
    FINDINGS(List.of("[^\\w\\n]*Finding(s?)[^\\w\\n]*")),
    IMPRESSION(List.of("[^\\w\\n]*Impression(s?)[^\\w\\n]*")),
    FOOTER(List.of(
            "[^\\w\\n]*Report Severity[^\\w\\n]*",
            "[^\\w\\n]*Finalized Datetime[^\\w\\n]*",
            "[^\\w\\n]*Preliminary Datetime[^\\w\\n]*"));

    private final List<String> patterns;

    ReportKeyword(final List<String> patterns) {
        this.patterns = patterns;
    }

    public List<String> getPatterns() {
        return patterns;
    }
}
