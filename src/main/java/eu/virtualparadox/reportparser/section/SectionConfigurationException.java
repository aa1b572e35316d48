package eu.virtualparadox.reportparser.section;

/**
 * Raised for invalid extraction configuration: an unknown match strategy or engine,
 * an empty marker list, or a marker fragment the regex engine rejects.
 */
public class SectionConfigurationException extends IllegalArgumentException {

    public SectionConfigurationException(final String message) {
        super(message);
    }

    public SectionConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
