package com.purchasingpower.docindex.service;

import com.purchasingpower.docindex.model.stats.DiskStats;
import com.purchasingpower.docindex.model.stats.IndexStats;
import com.purchasingpower.docindex.model.stats.ReconciliationReport;

/**
 * Compares what is on disk with what the index holds, per category.
 */
public interface ReconciliationService {

    /**
     * Counts eligible documents on disk. A missing root gives empty statistics.
     */
    DiskStats scanDisk();

    /**
     * @throws com.purchasingpower.docindex.exception.UpstreamServiceException if the index
     *         cannot be queried
     */
    IndexStats fetchIndexStats();

    ReconciliationReport reconcile();
}
