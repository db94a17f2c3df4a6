package com.purchasingpower.docindex.service.impl;

import com.purchasingpower.docindex.client.ExtractionClient;
import com.purchasingpower.docindex.client.OpenSearchClient;
import com.purchasingpower.docindex.exception.UpstreamServiceException;
import com.purchasingpower.docindex.model.document.ClassifiedFile;
import com.purchasingpower.docindex.model.document.DocumentRecord;
import com.purchasingpower.docindex.model.document.ExtractionResult;
import com.purchasingpower.docindex.service.DocumentIndexer;
import com.purchasingpower.docindex.util.ContentHasher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.LinkedHashSet;
import java.util.Set;

@Slf4j
@Service
public class DocumentIndexerImpl implements DocumentIndexer {

    private final ExtractionClient extractionClient;
    private final OpenSearchClient openSearchClient;

    private final Object indexCheckLock = new Object();
    private volatile boolean indexReady;

    public DocumentIndexerImpl(ExtractionClient extractionClient, OpenSearchClient openSearchClient) {
        this.extractionClient = extractionClient;
        this.openSearchClient = openSearchClient;
    }

    @Override
    public void ensureIndexReady() {
        if (indexReady) {
            return;
        }
        synchronized (indexCheckLock) {
            if (!indexReady) {
                openSearchClient.ensureIndex();
                indexReady = true;
            }
        }
    }

    @Override
    public DocumentRecord buildRecord(ClassifiedFile file) throws IOException {
        Path path = file.path();
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
        String sha256 = ContentHasher.sha256Hex(path);
        ExtractionResult extraction = extract(file, attrs.size());

        String title = extraction.title() == null || extraction.title().isBlank()
                ? file.stem()
                : extraction.title();

        Set<String> suggest = new LinkedHashSet<>();
        addIfPresent(suggest, file.level1());
        addIfPresent(suggest, file.level2());
        addIfPresent(suggest, title);

        return DocumentRecord.builder()
                .id(sha256)
                .path(path.toString())
                .fileName(file.fileName())
                .level1(file.level1())
                .level2(file.level2())
                .title(title)
                .content(extraction.content() == null ? "" : extraction.content())
                .mediaType(extraction.mediaType() == null ? "" : extraction.mediaType())
                .extension(file.extension())
                .modifiedAt(attrs.lastModifiedTime().toInstant().toString())
                .sizeBytes(attrs.size())
                .sha256(sha256)
                .suggest(suggest)
                .build();
    }

    @Override
    public DocumentRecord index(ClassifiedFile file) throws IOException {
        ensureIndexReady();
        DocumentRecord record = buildRecord(file);
        openSearchClient.upsert(record);
        log.debug("Upserted {} as {}", file.path(), record.getId());
        return record;
    }

    private ExtractionResult extract(ClassifiedFile file, long sizeBytes) {
        try {
            return extractionClient.extract(file.path(), sizeBytes);
        } catch (UpstreamServiceException | IOException e) {
            // the document stays searchable by name and category
            log.warn("Extraction failed for {}, indexing without content: {}", file.path(), e.getMessage());
            return ExtractionResult.titleOnly(file.stem());
        }
    }

    private static void addIfPresent(Set<String> terms, String term) {
        if (term != null && !term.isBlank()) {
            terms.add(term);
        }
    }
}
