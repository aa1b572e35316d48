package eu.virtualparadox.reportparser.report;

public enum ESection {
    TITLE("title"),
    HISTORY("history"),
    TECHNIQUE("technique"),
    COMPARISON("comparison"),
    FINDINGS("findings"),
    IMPRESSION("impression");

    private final String key;

    ESection(final String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
