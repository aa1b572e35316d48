package eu.virtualparadox.reportparser.section;

import java.util.Locale;

/**
 * How the end of a section is resolved.
 */
public enum EMatchStrategy {
    /**
     * Earliest textual match among all end markers combined.
     */
    GREEDY,
    /**
     * First end marker, by list order, that matches anywhere in the remaining text.
     */
    SEQUENTIAL;

    /**
     * Parses {@code "greedy"} or {@code "sequential"}, ignoring case and surrounding whitespace.
     *
     * @param value strategy name
     * @return parsed strategy
     * @throws SectionConfigurationException for any other value, including {@code null}
     */
    public static EMatchStrategy fromValue(final String value) {
        if (value != null) {
            final String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (EMatchStrategy strategy : values()) {
                if (strategy.name().equals(normalized)) {
                    return strategy;
                }
            }
        }
        throw new SectionConfigurationException(
                "match strategy must be either 'greedy' or 'sequential', got: " + value);
    }
}
