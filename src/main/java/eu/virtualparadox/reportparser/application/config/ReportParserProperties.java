package eu.virtualparadox.reportparser.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Properties under {@code reportparser.*}.
 * <p>Marker lists left unset fall back to the built-in defaults of
 * {@link eu.virtualparadox.reportparser.report.ReportKeyword}.</p>
 */
@ConfigurationProperties(prefix = "reportparser")
@Getter @Setter
public class ReportParserProperties {

    /**
     * Regex engine name: {@code jdk} or {@code re2j}.
     */
    private String engine = "jdk";

    private boolean includeStartMarker = true;

    private boolean wordBoundary = false;

    /**
     * End resolution strategy name: {@code greedy} or {@code sequential}.
     */
    private String matchStrategy = "greedy";

    /**
     * When false, duplicate-marker diagnostics are dropped instead of logged.
     */
    private boolean diagnosticsEnabled = true;

    private Markers markers = new Markers();

    @Getter @Setter
    public static class Markers {
        private List<String> history;
        private List<String> technique;
        private List<String> comparison;
        private List<String> findings;
        private List<String> impression;
        private List<String> footer;
    }
}
