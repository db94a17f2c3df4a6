package com.purchasingpower.docindex.service.impl;

import com.purchasingpower.docindex.model.document.ClassifiedFile;
import com.purchasingpower.docindex.model.sync.IngestResult;
import com.purchasingpower.docindex.service.BatchIngestService;
import com.purchasingpower.docindex.service.DocumentClassifier;
import com.purchasingpower.docindex.service.DocumentIndexer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Iterator;
import java.util.stream.Stream;

@Slf4j
@Service
public class BatchIngestServiceImpl implements BatchIngestService {

    /** Every one of the first files is logged, then one in {@link #PROGRESS_EVERY}. */
    static final int PROGRESS_FIRST = 10;
    static final int PROGRESS_EVERY = 50;

    private final DocumentClassifier classifier;
    private final DocumentIndexer indexer;

    public BatchIngestServiceImpl(DocumentClassifier classifier, DocumentIndexer indexer) {
        this.classifier = classifier;
        this.indexer = indexer;
    }

    @Override
    public IngestResult ingestAll() {
        long startTime = System.currentTimeMillis();
        log.info("Starting initial indexing of {}", classifier.root());

        indexer.ensureIndexReady();

        int discovered = 0;
        int indexed = 0;
        int failed = 0;

        try (Stream<ClassifiedFile> files = classifier.discover()) {
            Iterator<ClassifiedFile> it = files.iterator();
            while (it.hasNext()) {
                ClassifiedFile file = it.next();
                discovered++;
                try {
                    indexer.index(file);
                    indexed++;
                    if (indexed <= PROGRESS_FIRST || indexed % PROGRESS_EVERY == 0) {
                        log.info("Indexed: {} (last: {})", indexed, file.fileName());
                    }
                } catch (IOException | RuntimeException e) {
                    // one bad file must not stop the pass
                    failed++;
                    log.error("Failed to index {}: {}", file.path(), e.getMessage());
                    log.debug("Failure details for {}", file.path(), e);
                }
            }
        }

        IngestResult result = IngestResult.builder()
                .filesDiscovered(discovered)
                .filesIndexed(indexed)
                .filesFailed(failed)
                .totalTimeMs(System.currentTimeMillis() - startTime)
                .build();
        log.info("Initial indexing finished: {}", result.summary());
        return result;
    }
}
