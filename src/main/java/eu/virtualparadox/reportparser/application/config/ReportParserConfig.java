package eu.virtualparadox.reportparser.application.config;

import eu.virtualparadox.reportparser.diagnostic.DiagnosticSink;
import eu.virtualparadox.reportparser.diagnostic.LoggingDiagnosticSink;
import eu.virtualparadox.reportparser.pattern.ERegexEngine;
import eu.virtualparadox.reportparser.pattern.PatternCompiler;
import eu.virtualparadox.reportparser.pattern.PatternEngine;
import eu.virtualparadox.reportparser.position.PositionFinder;
import eu.virtualparadox.reportparser.report.RadReportExtractor;
import eu.virtualparadox.reportparser.report.SectionMarkers;
import eu.virtualparadox.reportparser.section.EMatchStrategy;
import eu.virtualparadox.reportparser.section.SectionBoundaryOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the section engine from {@link ReportParserProperties}.
 * <p>An application may declare its own {@link PatternEngine} or {@link DiagnosticSink} bean; when
 * present it is used instead of the one derived from properties, whatever the order in which
 * configurations are registered.</p>
 * <p>Invalid engine or strategy names, and invalid marker overrides, fail context startup with a
 * {@link eu.virtualparadox.reportparser.section.SectionConfigurationException}.</p>
 */
@Configuration
@EnableConfigurationProperties(ReportParserProperties.class)
@Slf4j
public class ReportParserConfig {

    @Bean
    public PatternCompiler patternCompiler(final ReportParserProperties props,
                                           final ObjectProvider<PatternEngine> engines) {
        final PatternEngine engine = engines.getIfAvailable(() -> {
            final ERegexEngine configured = ERegexEngine.fromValue(props.getEngine());
            log.info("Using {} regex engine for section markers", configured);
            return configured.create();
        });
        return new PatternCompiler(engine);
    }

    @Bean
    public PositionFinder positionFinder(final PatternCompiler compiler,
                                         final ReportParserProperties props,
                                         final ObjectProvider<DiagnosticSink> sinks) {
        final DiagnosticSink sink = sinks.getIfAvailable(() ->
                props.isDiagnosticsEnabled() ? new LoggingDiagnosticSink() : DiagnosticSink.discarding());
        log.debug("Marker diagnostics go to {}", sink.getClass().getSimpleName());
        return new PositionFinder(compiler, sink);
    }

    @Bean
    public SectionBoundaryOptions sectionBoundaryOptions(final ReportParserProperties props) {
        return new SectionBoundaryOptions(
                props.isIncludeStartMarker(),
                props.isWordBoundary(),
                EMatchStrategy.fromValue(props.getMatchStrategy()));
    }

    @Bean
    public SectionMarkers sectionMarkers(final ReportParserProperties props) {
        final ReportParserProperties.Markers overrides = props.getMarkers();
        SectionMarkers markers = SectionMarkers.defaults();
        if (overrides == null) {
            return markers;
        }
        if (isSet(overrides.getHistory())) markers = markers.withHistory(overrides.getHistory());
        if (isSet(overrides.getTechnique())) markers = markers.withTechnique(overrides.getTechnique());
        if (isSet(overrides.getComparison())) markers = markers.withComparison(overrides.getComparison());
        if (isSet(overrides.getFindings())) markers = markers.withFindings(overrides.getFindings());
        if (isSet(overrides.getImpression())) markers = markers.withImpression(overrides.getImpression());
        if (isSet(overrides.getFooter())) markers = markers.withFooter(overrides.getFooter());
        return markers;
    }

    @Bean
    public RadReportExtractor radReportExtractor(final SectionMarkers markers,
                                                 final SectionBoundaryOptions options,
                                                 final PositionFinder positionFinder) {
        return new RadReportExtractor(markers, options, positionFinder);
    }

    private static boolean isSet(final List<String> markers) {
        return markers != null && !markers.isEmpty();
    }
}
