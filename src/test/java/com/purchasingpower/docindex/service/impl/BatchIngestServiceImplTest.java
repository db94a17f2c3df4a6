package com.purchasingpower.docindex.service.impl;

import com.purchasingpower.docindex.client.ExtractionClient;
import com.purchasingpower.docindex.client.OpenSearchClient;
import com.purchasingpower.docindex.exception.IndexConfigurationException;
import com.purchasingpower.docindex.exception.UpstreamServiceException;
import com.purchasingpower.docindex.model.ServiceType;
import com.purchasingpower.docindex.model.document.ClassificationFilter;
import com.purchasingpower.docindex.model.document.DocumentRecord;
import com.purchasingpower.docindex.model.document.ExtractionResult;
import com.purchasingpower.docindex.model.sync.IngestResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("Batch ingestion")
class BatchIngestServiceImplTest {

    private static final Set<String> OFFICE = Set.of("pdf", "doc", "docx", "xls", "xlsx");

    @Mock
    private ExtractionClient extractionClient;

    @Mock
    private OpenSearchClient openSearchClient;

    @TempDir
    Path root;

    /** What the index holds, keyed by document id. */
    private final Map<String, DocumentRecord> index = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws Exception {
        when(extractionClient.extract(any(), anyLong()))
                .thenAnswer(inv -> ExtractionResult.titleOnly(inv.getArgument(0, Path.class).getFileName().toString()));
        doAnswer(inv -> {
            DocumentRecord record = inv.getArgument(0);
            index.put(record.getId(), record);
            return null;
        }).when(openSearchClient).upsert(any(DocumentRecord.class));
    }

    private BatchIngestServiceImpl service(int maxDocs) {
        DocumentClassifierImpl classifier = new DocumentClassifierImpl(root,
                new ClassificationFilter(OFFICE, Set.of(), Set.of(), maxDocs));
        return new BatchIngestServiceImpl(classifier, new DocumentIndexerImpl(extractionClient, openSearchClient));
    }

    private void file(String relative, String content) throws IOException {
        Path path = root.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
    }

    @Test
    @DisplayName("Should index every eligible file")
    void ingestAll_shouldIndexEligibleFiles() throws Exception {
        file("A/B/1.pdf", "one");
        file("A/B/sub/2.docx", "two");
        file("C/D/3.xlsx", "three");
        file("C/notes.txt", "ignored");

        IngestResult result = service(0).ingestAll();

        assertThat(result.getFilesDiscovered()).isEqualTo(3);
        assertThat(result.getFilesIndexed()).isEqualTo(3);
        assertThat(result.getFilesFailed()).isZero();
        assertThat(result.hadFailures()).isFalse();
        assertThat(index).hasSize(3);
        verify(openSearchClient).ensureIndex();
    }

    @Test
    @DisplayName("Should leave the index unchanged when run twice")
    void ingestAll_twice_shouldBeIdempotent() throws Exception {
        file("A/B/1.pdf", "one");
        file("A/C/2.pdf", "two");
        BatchIngestServiceImpl service = service(0);

        service.ingestAll();
        Map<String, DocumentRecord> afterFirst = Map.copyOf(index);
        service.ingestAll();

        assertThat(index).containsOnlyKeys(afterFirst.keySet());
        assertThat(index).isEqualTo(afterFirst);
    }

    @Test
    @DisplayName("Should keep a single entry for duplicated content")
    void ingestAll_duplicateContent_shouldShareOneEntry() throws Exception {
        file("A/B/original.pdf", "same");
        file("C/D/copy.pdf", "same");

        IngestResult result = service(0).ingestAll();

        assertThat(result.getFilesIndexed()).isEqualTo(2);
        assertThat(index).hasSize(1);
    }

    @Test
    @DisplayName("Should continue after a file fails")
    void ingestAll_whenOneUpsertFails_shouldContinue() throws Exception {
        file("A/B/bad.pdf", "bad");
        file("A/B/good1.pdf", "good1");
        file("A/C/good2.pdf", "good2");
        doThrow(new UpstreamServiceException(ServiceType.OPENSEARCH, "rejected", 400, null))
                .when(openSearchClient).upsert(argThat(r -> r != null && "bad.pdf".equals(r.getFileName())));

        IngestResult result = service(0).ingestAll();

        assertThat(result.getFilesDiscovered()).isEqualTo(3);
        assertThat(result.getFilesIndexed()).isEqualTo(2);
        assertThat(result.getFilesFailed()).isEqualTo(1);
        assertThat(result.hadFailures()).isTrue();
        assertThat(index.values()).extracting(DocumentRecord::getFileName)
                .containsExactlyInAnyOrder("good1.pdf", "good2.pdf");
    }

    @Test
    @DisplayName("Should stop after the configured number of documents")
    void ingestAll_withCap_shouldIndexAtMostMaxDocs() throws Exception {
        for (int i = 0; i < 6; i++) {
            file("A/B/f" + i + ".pdf", "content " + i);
        }

        IngestResult result = service(4).ingestAll();

        assertThat(result.getFilesDiscovered()).isEqualTo(4);
        assertThat(index).hasSize(4);
    }

    @Test
    @DisplayName("Should abort before reading files when the index cannot be prepared")
    void ingestAll_whenIndexMisconfigured_shouldFail() throws Exception {
        file("A/B/1.pdf", "one");
        doThrow(new IndexConfigurationException("Unexpected status 401"))
                .when(openSearchClient).ensureIndex();

        assertThatThrownBy(() -> service(0).ingestAll()).isInstanceOf(IndexConfigurationException.class);
        verify(openSearchClient, never()).upsert(any());
    }

    @Test
    void ingestAll_emptyTree_shouldReportNothing() {
        IngestResult result = service(0).ingestAll();

        assertThat(result.getFilesDiscovered()).isZero();
        assertThat(result.summary()).startsWith("0 documents indexed");
    }
}
