package eu.virtualparadox.reportparser.report;

import java.util.List;

/**
 * One row of the canonical section table.
 *
 * @param section           canonical section
 * @param startMarkers      markers opening the section, {@code null} for "start of text"
 * @param nextSectionMarkers markers of the sections that may follow, {@code null} for "end of text"
 */
public record SectionConfig(ESection section, List<String> startMarkers, List<String> nextSectionMarkers) {

    public SectionConfig {
        startMarkers = startMarkers == null ? null : List.copyOf(startMarkers);
        nextSectionMarkers = nextSectionMarkers == null ? null : List.copyOf(nextSectionMarkers);
    }
}
