package com.purchasingpower.docindex.model;

/**
 * Enumeration of external service types for unified logging.
 *
 * @see com.purchasingpower.docindex.util.ExternalCallLogger
 */
public enum ServiceType {
    TIKA("🟣", "Tika"),
    OPENSEARCH("🔵", "OpenSearch");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
