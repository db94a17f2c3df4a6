package com.purchasingpower.docindex.model.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Document counts reported by the index aggregation.
 */
public record IndexStats(
        long total,
        @JsonProperty("by_level1") Map<String, Long> byLevel1,
        @JsonProperty("by_level2") Map<String, Long> byLevel2
) {
}
