package com.purchasingpower.docindex.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.docindex.model.stats.ReconciliationReport;
import com.purchasingpower.docindex.model.sync.IngestResult;
import com.purchasingpower.docindex.service.BatchIngestService;
import com.purchasingpower.docindex.service.DocumentIndexer;
import com.purchasingpower.docindex.service.DocumentWatchService;
import com.purchasingpower.docindex.service.ReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line entry point.
 *
 * <pre>
 *   --initial[=true|false]   full pass over the document tree (default true, --no-initial to skip)
 *   --watch[=true|false]     keep indexing new and modified files until interrupted (default false)
 *   --stats                  log the disk-vs-index report as JSON at the end
 * </pre>
 *
 * The watcher is started before the initial pass so files written during the pass are not
 * missed. Without --watch the process exits when the pass is done.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class IngestCommandRunner implements ApplicationRunner {

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "on");

    private final DocumentIndexer indexer;
    private final BatchIngestService batchIngestService;
    private final DocumentWatchService watchService;
    private final ReconciliationService reconciliationService;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        boolean initial = option(args, "initial", true);
        boolean watch = option(args, "watch", false);
        boolean stats = option(args, "stats", false);

        if (!initial && !watch && !stats) {
            log.info("Nothing to do (neither --initial nor --watch)");
            return;
        }

        indexer.ensureIndexReady();

        if (watch) {
            watchService.start();
        }

        if (initial) {
            IngestResult result = batchIngestService.ingestAll();
            log.info("Initial indexing: {} documents", result.getFilesIndexed());
        }

        if (stats) {
            ReconciliationReport report = reconciliationService.reconcile();
            log.info("Index statistics:\n{}",
                    objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        }

        if (watch) {
            log.info("Watching for changes, interrupt to stop");
        }
    }

    /**
     * Reads a boolean switch: {@code --name}, {@code --name=value} or {@code --no-name}.
     */
    static boolean option(ApplicationArguments args, String name, boolean defaultValue) {
        if (args.containsOption("no-" + name)) {
            return false;
        }
        if (!args.containsOption(name)) {
            return defaultValue;
        }
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return true;
        }
        String value = values.get(values.size() - 1).trim().toLowerCase(Locale.ROOT);
        return value.isEmpty() || TRUE_VALUES.contains(value);
    }
}
