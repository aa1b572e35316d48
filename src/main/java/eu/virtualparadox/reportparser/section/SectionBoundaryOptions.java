package eu.virtualparadox.reportparser.section;

/**
 * Matching options shared by start and end resolution.
 *
 * @param includeStartMarker keep the matched start marker in the extracted text
 * @param useWordBoundary    anchor markers on word boundaries
 * @param matchStrategy      end resolution strategy (non-null)
 */
public record SectionBoundaryOptions(boolean includeStartMarker,
                                     boolean useWordBoundary,
                                     EMatchStrategy matchStrategy) {

    public static final SectionBoundaryOptions DEFAULTS = new SectionBoundaryOptions(true, false, EMatchStrategy.GREEDY);

    public SectionBoundaryOptions {
        if (matchStrategy == null) {
            throw new SectionConfigurationException("match strategy must be either 'greedy' or 'sequential', got: null");
        }
    }

    public SectionBoundaryOptions withIncludeStartMarker(final boolean value) {
        return new SectionBoundaryOptions(value, useWordBoundary, matchStrategy);
    }

    public SectionBoundaryOptions withWordBoundary(final boolean value) {
        return new SectionBoundaryOptions(includeStartMarker, value, matchStrategy);
    }

    public SectionBoundaryOptions withMatchStrategy(final EMatchStrategy value) {
        return new SectionBoundaryOptions(includeStartMarker, useWordBoundary, value);
    }
}
