package eu.virtualparadox.reportparser.diagnostic;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Append-only sink that keeps diagnostics in memory so callers can inspect them after an extraction.
 * Safe for concurrent writers; no ordering guarantee across threads.
 */
public final class CollectingDiagnosticSink implements DiagnosticSink {

    private final Queue<MarkerDiagnostic> diagnostics = new ConcurrentLinkedQueue<>();

    @Override
    public void report(final MarkerDiagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * @return snapshot of everything reported so far
     */
    public List<MarkerDiagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }

    public void clear() {
        diagnostics.clear();
    }
}
