package com.purchasingpower.docindex.service.impl;

import com.purchasingpower.docindex.configuration.AppProperties;
import com.purchasingpower.docindex.model.document.ClassificationFilter;
import com.purchasingpower.docindex.model.document.ClassifiedFile;
import com.purchasingpower.docindex.service.DocumentClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Filesystem classifier.
 *
 * <p>Level-1 and level-2 directories are listed lazily and filtered by the allow-lists before
 * anything below them is read. Each level-2 directory is then walked as a unit when the stream
 * reaches it, skipping hidden directories and unreadable entries.
 */
@Slf4j
@Service
public class DocumentClassifierImpl implements DocumentClassifier {

    static final String HIDDEN_PREFIX = ".";
    static final String LOCK_PREFIX = "~$";

    private final Path root;
    private final ClassificationFilter filter;

    @Autowired
    public DocumentClassifierImpl(AppProperties props, ClassificationFilter filter) {
        this(Path.of(props.getDocuments().getRoot()), filter);
    }

    public DocumentClassifierImpl(Path root, ClassificationFilter filter) {
        this.root = root.toAbsolutePath().normalize();
        this.filter = filter;
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public Stream<ClassifiedFile> discover() {
        Stream<ClassifiedFile> files = walk(true);
        return filter.isCapped() ? files.limit(filter.maxDocs()) : files;
    }

    @Override
    public Stream<ClassifiedFile> discoverAll() {
        return walk(false);
    }

    private Stream<ClassifiedFile> walk(boolean applyAllowLists) {
        if (!Files.isDirectory(root)) {
            log.warn("Document root {} does not exist or is not a directory", root);
            return Stream.empty();
        }
        return subdirectories(root)
                .filter(level1Dir -> !applyAllowLists || filter.allowsLevel1(name(level1Dir)))
                .flatMap(level1Dir -> subdirectories(level1Dir)
                        .filter(level2Dir -> !applyAllowLists || filter.allowsLevel2(name(level2Dir)))
                        .flatMap(level2Dir -> walkCategory(name(level1Dir), level2Dir).stream()));
    }

    @Override
    public Optional<ClassifiedFile> classify(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        if (!absolute.startsWith(root) || !Files.isRegularFile(absolute)) {
            return Optional.empty();
        }
        Path relative = root.relativize(absolute);
        int depth = relative.getNameCount();
        if (depth < 3) {
            return Optional.empty();
        }
        for (Path segment : relative) {
            if (isHidden(segment)) {
                return Optional.empty();
            }
        }
        String level1 = relative.getName(0).toString();
        String level2 = relative.getName(1).toString();
        if (!filter.allowsLevel1(level1) || !filter.allowsLevel2(level2)) {
            return Optional.empty();
        }
        String subpath = depth > 3 ? relative.subpath(2, depth - 1).toString() : "";
        return toClassified(absolute, level1, level2, subpath);
    }

    private List<ClassifiedFile> walkCategory(String level1, Path level2Dir) {
        String level2 = name(level2Dir);
        List<ClassifiedFile> files = new ArrayList<>();
        try {
            Files.walkFileTree(level2Dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(level2Dir) && isHidden(dir.getFileName())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        String subpath = level2Dir.relativize(file.getParent()).toString();
                        toClassified(file, level1, level2, subpath).ifPresent(files::add);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Failed to walk {}: {}", level2Dir, e.getMessage());
        }
        return files;
    }

    private Optional<ClassifiedFile> toClassified(Path file, String level1, String level2, String subpath) {
        String fileName = file.getFileName().toString();
        if (fileName.startsWith(HIDDEN_PREFIX) || fileName.startsWith(LOCK_PREFIX)) {
            return Optional.empty();
        }
        String extension = extension(fileName);
        if (!filter.allowsExtension(extension)) {
            return Optional.empty();
        }
        return Optional.of(new ClassifiedFile(file, fileName, extension, level1, level2, subpath));
    }

    private Stream<Path> subdirectories(Path dir) {
        try {
            return Files.list(dir)
                    .filter(Files::isDirectory)
                    .filter(child -> !isHidden(child.getFileName()));
        } catch (IOException e) {
            log.warn("Failed to list {}: {}", dir, e.getMessage());
            return Stream.empty();
        }
    }

    static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static boolean isHidden(Path segment) {
        return segment != null && segment.toString().startsWith(HIDDEN_PREFIX);
    }

    private static String name(Path dir) {
        return dir.getFileName().toString();
    }
}
