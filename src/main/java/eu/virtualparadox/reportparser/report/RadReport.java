package eu.virtualparadox.reportparser.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sections of one radiology report. A {@code null} field means the section was not found
 * (or was found with no content; both collapse to absent).
 */
public record RadReport(String title,
                        String history,
                        String technique,
                        String comparison,
                        String findings,
                        String impression) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static RadReport empty() {
        return new RadReport(null, null, null, null, null, null);
    }

    public String get(final ESection section) {
        Objects.requireNonNull(section, "section must not be null");
        return switch (section) {
            case TITLE -> title;
            case HISTORY -> history;
            case TECHNIQUE -> technique;
            case COMPARISON -> comparison;
            case FINDINGS -> findings;
            case IMPRESSION -> impression;
        };
    }

    public boolean isPresent(final ESection section) {
        return get(section) != null;
    }

    /**
     * Converts the report to an ordered map keyed by section key ({@code "title"}, {@code "history"}, ...).
     *
     * @param excludeAbsent drop entries whose value is {@code null}
     * @return unmodifiable map in canonical section order
     */
    public Map<String, String> toMap(final boolean excludeAbsent) {
        final Map<String, String> map = new LinkedHashMap<>();
        for (ESection section : ESection.values()) {
            final String value = get(section);
            if (value != null || !excludeAbsent) {
                map.put(section.getKey(), value);
            }
        }
        return Collections.unmodifiableMap(map);
    }

    public String toJson(final boolean excludeAbsent) {
        return toJson(excludeAbsent, false);
    }

    /**
     * Serializes {@link #toMap(boolean)} to JSON.
     *
     * @param excludeAbsent drop absent sections instead of writing {@code null}
     * @param pretty        indent the output
     * @return JSON object text
     * @throws IllegalStateException if serialization fails
     */
    public String toJson(final boolean excludeAbsent, final boolean pretty) {
        try {
            final Map<String, String> map = toMap(excludeAbsent);
            return pretty
                    ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(map)
                    : MAPPER.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report to JSON", e);
        }
    }
}
