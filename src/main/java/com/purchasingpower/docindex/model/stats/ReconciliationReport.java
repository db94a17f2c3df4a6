package com.purchasingpower.docindex.model.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time comparison of the document tree and the index. The two sides are read
 * independently and may observe different instants.
 */
public record ReconciliationReport(
        @JsonProperty("doc_root") String docRoot,
        DiskStats disk,
        IndexStats index,
        StatsDiff diff
) {
}
