package com.purchasingpower.docindex.service;

import com.purchasingpower.docindex.model.document.ClassifiedFile;

import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Finds the documents under the root and derives their two category levels from the path.
 *
 * <p>A document is eligible when it sits at least three segments below the root
 * ({@code category_1/category_2/.../file}), no segment of its relative path is hidden, its
 * name is not an office lock file and its extension is allowed. Category allow-lists prune
 * whole directories during traversal.
 */
public interface DocumentClassifier {

    /**
     * The absolute, normalized document root.
     */
    Path root();

    /**
     * Lazily walks the root, applying the allow-lists and the document cap.
     * Each call starts a new walk. Callers must close the stream.
     */
    Stream<ClassifiedFile> discover();

    /**
     * Every eligible document under the root, ignoring the category allow-lists and the
     * document cap. The index holds documents from earlier runs with other filters, so
     * disk-side counts compared against it must cover the whole tree.
     */
    Stream<ClassifiedFile> discoverAll();

    /**
     * Classifies a single path, e.g. one reported by the filesystem watcher.
     *
     * @return empty when the path is not an eligible document
     */
    Optional<ClassifiedFile> classify(Path file);
}
