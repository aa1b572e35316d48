package eu.virtualparadox.reportparser.diagnostic;

/**
 * Advisory notice that a single start-marker fragment matched more than once in a text.
 * Only the first overall match is used for extraction; the notice exists for report-quality auditing.
 *
 * @param fragment    the marker fragment as configured
 * @param occurrences number of independent matches of {@code fragment}
 */
public record MarkerDiagnostic(String fragment, int occurrences) {

    public String message() {
        return "Start pattern " + fragment + " appears " + occurrences
                + " times in text, only the first one will be matched.";
    }
}
