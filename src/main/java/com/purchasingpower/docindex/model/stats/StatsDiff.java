package com.purchasingpower.docindex.model.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Disk count minus index count. Positive values mean documents missing from the index,
 * negative values mean the index holds entries no longer on disk.
 */
public record StatsDiff(
        @JsonProperty("total_missing") long totalMissing,
        @JsonProperty("by_level1_missing") Map<String, Long> byLevel1Missing,
        @JsonProperty("by_level2_missing") Map<String, Long> byLevel2Missing
) {

    public static StatsDiff between(DiskStats disk, IndexStats index) {
        return new StatsDiff(
                disk.total() - index.total(),
                diff(disk.byLevel1(), index.byLevel1()),
                diff(disk.byLevel2(), index.byLevel2()));
    }

    static Map<String, Long> diff(Map<String, Long> disk, Map<String, Long> index) {
        TreeSet<String> keys = new TreeSet<>(disk.keySet());
        keys.addAll(index.keySet());
        Map<String, Long> result = new TreeMap<>();
        for (String key : keys) {
            result.put(key, disk.getOrDefault(key, 0L) - index.getOrDefault(key, 0L));
        }
        return result;
    }
}
