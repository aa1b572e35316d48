package eu.virtualparadox.reportparser.report;

import eu.virtualparadox.reportparser.position.PositionFinder;
import eu.virtualparadox.reportparser.section.SectionBoundaryOptions;
import eu.virtualparadox.reportparser.section.SectionExtractor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Extracts the canonical sections of a radiology report.
 *
 * <h2>Section table</h2>
 * Each section ends where one of the sections that may follow it begins:
 * <pre>
 *   title       start of text  -> history | technique | comparison | findings | impression
 *   history     history        -> technique | comparison | findings | impression
 *   technique   technique      -> comparison | findings | impression
 *   comparison  comparison     -> technique | findings | impression
 *   findings    findings       -> impression | footer
 *   impression  impression     -> footer
 * </pre>
 * The title has no start marker and ends at whichever other section begins first.
 *
 * <p>One {@link SectionExtractor} is built per section at construction. The instance is immutable
 * and may be shared between threads.</p>
 */
@Slf4j
public final class RadReportExtractor {

    private final SectionMarkers markers;
    private final SectionBoundaryOptions options;
    private final PositionFinder positionFinder;
    private final Map<ESection, SectionConfig> sectionConfigs;
    private final Map<ESection, SectionExtractor> extractors;

    public RadReportExtractor(final SectionMarkers markers,
                              final SectionBoundaryOptions options,
                              final PositionFinder positionFinder) {
        this.markers = Objects.requireNonNull(markers, "markers must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.positionFinder = Objects.requireNonNull(positionFinder, "positionFinder must not be null");
        this.sectionConfigs = buildSectionConfigs(markers);

        final Map<ESection, SectionExtractor> built = new EnumMap<>(ESection.class);
        for (SectionConfig config : sectionConfigs.values()) {
            built.put(config.section(), new SectionExtractor(
                    config.startMarkers(), config.nextSectionMarkers(), options, positionFinder));
        }
        this.extractors = Collections.unmodifiableMap(built);
        log.debug("Report extractor built with options {}", options);
    }

    /**
     * @param options options for every section
     * @return a new extractor sharing this one's markers and finder
     */
    public RadReportExtractor withOptions(final SectionBoundaryOptions options) {
        return new RadReportExtractor(markers, options, positionFinder);
    }

    public String extract(final ESection section, final String text) {
        Objects.requireNonNull(section, "section must not be null");
        return extractors.get(section).extract(text);
    }

    public String extractTitle(final String text) {
        return extract(ESection.TITLE, text);
    }

    public String extractHistory(final String text) {
        return extract(ESection.HISTORY, text);
    }

    public String extractTechnique(final String text) {
        return extract(ESection.TECHNIQUE, text);
    }

    public String extractComparison(final String text) {
        return extract(ESection.COMPARISON, text);
    }

    public String extractFindings(final String text) {
        return extract(ESection.FINDINGS, text);
    }

    public String extractImpression(final String text) {
        return extract(ESection.IMPRESSION, text);
    }

    /**
     * Runs every section extractor against {@code text}.
     *
     * @param text report text; {@code null} is treated as empty
     * @return report whose fields are {@code null} for sections that yielded no text
     */
    public RadReport extractAll(final String text) {
        final Map<ESection, String> values = new EnumMap<>(ESection.class);
        for (ESection section : ESection.values()) {
            final String value = extract(section, text);
            values.put(section, value.isEmpty() ? null : value);
        }
        return new RadReport(
                values.get(ESection.TITLE),
                values.get(ESection.HISTORY),
                values.get(ESection.TECHNIQUE),
                values.get(ESection.COMPARISON),
                values.get(ESection.FINDINGS),
                values.get(ESection.IMPRESSION));
    }

    /**
     * Looks up the heading text that opens {@code section}, e.g. {@code "Clinical History: "}.
     *
     * @return matched heading, or empty for the title (no start marker) or when the section is absent
     */
    public Optional<String> findHeading(final ESection section, final String text) {
        Objects.requireNonNull(section, "section must not be null");
        final SectionConfig config = sectionConfigs.get(section);
        return positionFinder.findFirstKeyword(text == null ? "" : text, config.startMarkers(), options.useWordBoundary());
    }

    public SectionConfig sectionConfig(final ESection section) {
        return sectionConfigs.get(Objects.requireNonNull(section, "section must not be null"));
    }

    public Map<ESection, SectionConfig> sectionConfigs() {
        return sectionConfigs;
    }

    public SectionMarkers getMarkers() {
        return markers;
    }

    public SectionBoundaryOptions getOptions() {
        return options;
    }

    private static Map<ESection, SectionConfig> buildSectionConfigs(final SectionMarkers m) {
        final Map<ESection, SectionConfig> configs = new EnumMap<>(ESection.class);
        configs.put(ESection.TITLE, new SectionConfig(ESection.TITLE, null,
                concat(m.history(), m.technique(), m.comparison(), m.findings(), m.impression())));
        configs.put(ESection.HISTORY, new SectionConfig(ESection.HISTORY, m.history(),
                concat(m.technique(), m.comparison(), m.findings(), m.impression())));
        configs.put(ESection.TECHNIQUE, new SectionConfig(ESection.TECHNIQUE, m.technique(),
                concat(m.comparison(), m.findings(), m.impression())));
        configs.put(ESection.COMPARISON, new SectionConfig(ESection.COMPARISON, m.comparison(),
                concat(m.technique(), m.findings(), m.impression())));
        configs.put(ESection.FINDINGS, new SectionConfig(ESection.FINDINGS, m.findings(),
                concat(m.impression(), m.footer())));
        configs.put(ESection.IMPRESSION, new SectionConfig(ESection.IMPRESSION, m.impression(),
                m.footer()));
        return Collections.unmodifiableMap(configs);
    }

    @SafeVarargs
    private static List<String> concat(final List<String>... lists) {
        final List<String> all = new ArrayList<>();
        for (List<String> list : lists) {
            all.addAll(list);
        }
        return all;
    }
}
