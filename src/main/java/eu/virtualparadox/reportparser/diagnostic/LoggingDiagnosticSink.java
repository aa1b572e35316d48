package eu.virtualparadox.reportparser.diagnostic;

import lombok.extern.slf4j.Slf4j;

/**
 * Default sink: writes each diagnostic as a WARN line through SLF4J.
 */
@Slf4j
public final class LoggingDiagnosticSink implements DiagnosticSink {

    @Override
    public void report(final MarkerDiagnostic diagnostic) {
        log.warn("Start pattern {} appears {} times in text, only the first one will be matched.",
                diagnostic.fragment(), diagnostic.occurrences());
    }
}
