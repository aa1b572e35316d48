package eu.virtualparadox.reportparser.diagnostic;

/**
 * Receives advisory diagnostics emitted while resolving section boundaries.
 * <p>Implementations may be called from several threads at once and must tolerate concurrent
 * reports. Reporting never influences extraction results.</p>
 */
@FunctionalInterface
public interface DiagnosticSink {

    void report(final MarkerDiagnostic diagnostic);

    /**
     * @return a sink that drops every diagnostic
     */
    static DiagnosticSink discarding() {
        return diagnostic -> {
        };
    }
}
