package com.purchasingpower.docindex.service.impl;

import com.purchasingpower.docindex.client.OpenSearchClient;
import com.purchasingpower.docindex.model.document.ClassifiedFile;
import com.purchasingpower.docindex.model.stats.DiskStats;
import com.purchasingpower.docindex.model.stats.IndexStats;
import com.purchasingpower.docindex.model.stats.ReconciliationReport;
import com.purchasingpower.docindex.model.stats.StatsDiff;
import com.purchasingpower.docindex.service.DocumentClassifier;
import com.purchasingpower.docindex.service.ReconciliationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Disk-vs-index statistics. The disk scan and the index query are separate reads, so the
 * report is an approximation when documents are being added meanwhile.
 *
 * Negative differences are the only signal for documents deleted from disk; nothing here
 * removes them from the index.
 */
@Slf4j
@Service
public class ReconciliationServiceImpl implements ReconciliationService {

    private final DocumentClassifier classifier;
    private final OpenSearchClient openSearchClient;

    public ReconciliationServiceImpl(DocumentClassifier classifier, OpenSearchClient openSearchClient) {
        this.classifier = classifier;
        this.openSearchClient = openSearchClient;
    }

    @Override
    public DiskStats scanDisk() {
        String root = classifier.root().toString();
        long total = 0;
        Map<String, Long> byLevel1 = new TreeMap<>();
        Map<String, Long> byLevel2 = new TreeMap<>();
        Map<String, Map<String, Long>> byLevel1Level2 = new TreeMap<>();

        try (Stream<ClassifiedFile> files = classifier.discoverAll()) {
            Iterator<ClassifiedFile> it = files.iterator();
            while (it.hasNext()) {
                ClassifiedFile file = it.next();
                total++;
                byLevel1.merge(file.level1(), 1L, Long::sum);
                byLevel2.merge(file.level2(), 1L, Long::sum);
                byLevel1Level2.computeIfAbsent(file.level1(), k -> new TreeMap<>())
                        .merge(file.level2(), 1L, Long::sum);
            }
        }
        return new DiskStats(root, total, byLevel1, byLevel2, byLevel1Level2);
    }

    @Override
    public IndexStats fetchIndexStats() {
        return openSearchClient.aggregateCategoryCounts();
    }

    @Override
    public ReconciliationReport reconcile() {
        DiskStats disk = scanDisk();
        IndexStats index = fetchIndexStats();
        StatsDiff diff = StatsDiff.between(disk, index);
        log.info("Reconciliation: disk={}, index={}, missing={}", disk.total(), index.total(), diff.totalMissing());
        return new ReconciliationReport(disk.root(), disk, index, diff);
    }
}
