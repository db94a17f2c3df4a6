package com.purchasingpower.docindex.service.impl;

import com.purchasingpower.docindex.model.document.ClassifiedFile;
import com.purchasingpower.docindex.service.DocumentClassifier;
import com.purchasingpower.docindex.service.DocumentIndexer;
import com.purchasingpower.docindex.service.DocumentWatchService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Recursive watcher on top of the JDK {@link WatchService}.
 *
 * <p>Every directory under the root is registered for create and modify events. A directory
 * created later is registered when its event arrives, and the files already inside it are
 * indexed, since they may have been written before the registration took effect.
 *
 * <p>Events are not debounced: a file saved twice is indexed twice under the same content
 * hash, which leaves a single entry in the index.
 */
@Slf4j
@Service
public class DocumentWatchServiceImpl implements DocumentWatchService {

    static final long POLL_INTERVAL_MS = 500;
    static final long STOP_TIMEOUT_SECONDS = 60;

    private final DocumentClassifier classifier;
    private final DocumentIndexer indexer;
    private final AsyncTaskExecutor watchExecutor;

    private final AtomicBoolean running = new AtomicBoolean();
    private final Map<WatchKey, Path> watchedDirectories = new ConcurrentHashMap<>();

    private volatile WatchService watchService;
    private volatile Future<?> eventLoop;

    public DocumentWatchServiceImpl(
            DocumentClassifier classifier,
            DocumentIndexer indexer,
            @Qualifier("watchExecutor") AsyncTaskExecutor watchExecutor) {
        this.classifier = classifier;
        this.indexer = indexer;
        this.watchExecutor = watchExecutor;
    }

    @Override
    public synchronized void start() {
        if (running.get()) {
            log.warn("Watcher already running on {}", classifier.root());
            return;
        }
        Path root = classifier.root();
        if (!Files.isDirectory(root)) {
            throw new IllegalStateException("Cannot watch missing document root: " + root);
        }

        try {
            watchService = root.getFileSystem().newWatchService();
            registerTree(root, false);
        } catch (IOException e) {
            closeWatchService();
            throw new UncheckedIOException("Cannot watch " + root, e);
        }

        running.set(true);
        eventLoop = watchExecutor.submit(this::runEventLoop);
        log.info("Watch mode ON: {} ({} directories)", root, watchedDirectories.size());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping watcher on {}", classifier.root());
        Future<?> loop = eventLoop;
        if (loop == null) {
            closeWatchService();
            return;
        }
        try {
            loop.get(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.error("Watcher terminated abnormally", e.getCause());
        } catch (TimeoutException e) {
            log.warn("Watcher still busy after {}s, releasing the subscription", STOP_TIMEOUT_SECONDS);
            closeWatchService();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    void shutdown() {
        stop();
    }

    private void runEventLoop() {
        try {
            while (running.get()) {
                WatchKey key = watchService.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (key == null) {
                    continue;
                }
                Path dir = watchedDirectories.get(key);
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (!running.get()) {
                        break;
                    }
                    handleEvent(dir, event);
                }
                if (!key.reset()) {
                    watchedDirectories.remove(key);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            log.debug("Watch service closed");
        } catch (RuntimeException e) {
            log.error("Watcher failed on {}", classifier.root(), e);
        } finally {
            running.set(false);
            closeWatchService();
            log.info("Watcher stopped");
        }
    }

    private void handleEvent(Path dir, WatchEvent<?> event) {
        WatchEvent.Kind<?> kind = event.kind();
        if (kind == StandardWatchEventKinds.OVERFLOW) {
            log.warn("Too many filesystem events under {}, some changes were missed", dir);
            return;
        }
        if (dir == null) {
            return;
        }
        Path child = dir.resolve((Path) event.context());
        if (Files.isDirectory(child)) {
            if (kind == StandardWatchEventKinds.ENTRY_CREATE) {
                try {
                    registerTree(child, true);
                } catch (IOException e) {
                    log.warn("Cannot watch new directory {}: {}", child, e.getMessage());
                }
            }
            return;
        }
        indexIfEligible(child);
    }

    void indexIfEligible(Path file) {
        Optional<ClassifiedFile> classified = classifier.classify(file);
        if (classified.isEmpty()) {
            log.debug("Ignoring {}", file);
            return;
        }
        try {
            indexer.index(classified.get());
            log.info("Indexed: {}", file);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to index {}: {}", file, e.getMessage());
            log.debug("Failure details for {}", file, e);
        }
    }

    private void registerTree(Path start, boolean indexExisting) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(classifier.root()) && dir.getFileName().toString().startsWith(".")) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                WatchKey key = dir.register(watchService,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY);
                watchedDirectories.put(key, dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (indexExisting && attrs.isRegularFile()) {
                    indexIfEligible(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Cannot watch {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void closeWatchService() {
        WatchService service = watchService;
        if (service == null) {
            return;
        }
        try {
            service.close();
        } catch (IOException e) {
            log.warn("Failed to close watch service: {}", e.getMessage());
        }
        watchedDirectories.clear();
    }
}
