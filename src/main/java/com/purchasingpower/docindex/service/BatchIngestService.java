package com.purchasingpower.docindex.service;

import com.purchasingpower.docindex.model.sync.IngestResult;

/**
 * One-shot pass over every eligible document.
 *
 * Files are processed one after another; a file that fails is logged and skipped. Nothing
 * is persisted between runs: a new pass starts from the beginning, which is safe because
 * indexing is idempotent.
 */
public interface BatchIngestService {

    IngestResult ingestAll();
}
