package eu.virtualparadox.reportparser.pattern;

import eu.virtualparadox.reportparser.section.SectionConfigurationException;

import java.util.Locale;
import java.util.function.Supplier;

public enum ERegexEngine {
    JDK(JdkPatternEngine::new),
    RE2J(Re2jPatternEngine::new);

    private final Supplier<PatternEngine> factory;

    ERegexEngine(final Supplier<PatternEngine> factory) {
        this.factory = factory;
    }

    public PatternEngine create() {
        return factory.get();
    }

    /**
     * Parses an engine name such as {@code "jdk"} or {@code "re2j"}.
     *
     * @param value engine name, case-insensitive
     * @return matching engine
     * @throws SectionConfigurationException if the name is unknown
     */
    public static ERegexEngine fromValue(final String value) {
        if (value != null) {
            for (ERegexEngine engine : values()) {
                if (engine.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                    return engine;
                }
            }
        }
        throw new SectionConfigurationException("Unknown regex engine: " + value + " (expected 'jdk' or 're2j')");
    }
}
