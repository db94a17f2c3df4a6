package com.purchasingpower.docindex.service;

import com.purchasingpower.docindex.model.document.ClassifiedFile;
import com.purchasingpower.docindex.model.document.DocumentRecord;

import java.io.IOException;

/**
 * Single write path into the index for both the batch pass and the watcher.
 *
 * Records are keyed by content hash, so indexing the same bytes again overwrites the
 * existing entry instead of adding one.
 */
public interface DocumentIndexer {

    /**
     * Checks (and if needed creates) the target index. Runs once per process.
     *
     * @throws com.purchasingpower.docindex.exception.IndexConfigurationException if the
     *         index cannot be verified or created
     */
    void ensureIndexReady();

    /**
     * Hashes, stats and extracts the file. Extraction failures degrade to a title-only record.
     *
     * @throws IOException if the file cannot be read
     */
    DocumentRecord buildRecord(ClassifiedFile file) throws IOException;

    /**
     * Builds the record and upserts it.
     *
     * @throws IOException if the file cannot be read
     * @throws com.purchasingpower.docindex.exception.UpstreamServiceException if the upsert
     *         keeps failing
     */
    DocumentRecord index(ClassifiedFile file) throws IOException;
}
