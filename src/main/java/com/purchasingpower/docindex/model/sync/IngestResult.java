package com.purchasingpower.docindex.model.sync;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a full ingestion pass.
 */
@Data
@Builder
public class IngestResult {

    private final int filesDiscovered;
    private final int filesIndexed;
    private final int filesFailed;
    private final long totalTimeMs;

    /**
     * Human-readable summary of the pass.
     */
    public String summary() {
        return String.format(
                "%d documents indexed, %d failed, %d discovered in %dms",
                filesIndexed, filesFailed, filesDiscovered, totalTimeMs
        );
    }

    public boolean hadFailures() {
        return filesFailed > 0;
    }
}
