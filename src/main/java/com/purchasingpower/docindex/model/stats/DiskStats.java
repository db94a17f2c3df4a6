package com.purchasingpower.docindex.model.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Eligible-file counts found on disk.
 */
public record DiskStats(
        String root,
        long total,
        @JsonProperty("by_level1") Map<String, Long> byLevel1,
        @JsonProperty("by_level2") Map<String, Long> byLevel2,
        @JsonProperty("by_level1_level2") Map<String, Map<String, Long>> byLevel1Level2
) {
}
