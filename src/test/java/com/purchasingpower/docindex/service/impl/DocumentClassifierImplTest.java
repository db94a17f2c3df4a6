package com.purchasingpower.docindex.service.impl;

import com.purchasingpower.docindex.model.document.ClassificationFilter;
import com.purchasingpower.docindex.model.document.ClassifiedFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Document classifier")
class DocumentClassifierImplTest {

    private static final Set<String> OFFICE = Set.of("pdf", "doc", "docx", "xls", "xlsx");

    @TempDir
    Path root;

    private DocumentClassifierImpl classifier(Set<String> level1, Set<String> level2, int maxDocs) {
        return new DocumentClassifierImpl(root, new ClassificationFilter(OFFICE, level1, level2, maxDocs));
    }

    private DocumentClassifierImpl classifier() {
        return classifier(Set.of(), Set.of(), 0);
    }

    private Path file(String relative) throws IOException {
        Path path = root.resolve(relative);
        Files.createDirectories(path.getParent());
        return Files.writeString(path, relative);
    }

    private static List<ClassifiedFile> collect(Stream<ClassifiedFile> files) {
        try (files) {
            return files.toList();
        }
    }

    @Test
    @DisplayName("Should only classify files at least two directories deep")
    void discover_shouldRequireTwoCategoryLevels() throws Exception {
        file("loose.pdf");
        file("A/shallow.pdf");
        Path deep = file("A/B/f.pdf");

        List<ClassifiedFile> files = collect(classifier().discover());

        assertThat(files).hasSize(1);
        ClassifiedFile f = files.get(0);
        assertThat(f.path()).isEqualTo(deep.toAbsolutePath().normalize());
        assertThat(f.level1()).isEqualTo("A");
        assertThat(f.level2()).isEqualTo("B");
        assertThat(f.relativeSubpath()).isEmpty();
        assertThat(f.extension()).isEqualTo("pdf");
        assertThat(f.stem()).isEqualTo("f");
    }

    @Test
    @DisplayName("Should keep nested directories as subpath of the level-2 category")
    void discover_nestedFile_shouldCarrySubpath() throws Exception {
        file("A/B/2024/mars/f.docx");

        List<ClassifiedFile> files = collect(classifier().discover());

        assertThat(files).singleElement().satisfies(f -> {
            assertThat(f.level1()).isEqualTo("A");
            assertThat(f.level2()).isEqualTo("B");
            assertThat(f.relativeSubpath()).isEqualTo(Path.of("2024", "mars").toString());
        });
    }

    @Test
    @DisplayName("Should skip hidden entries, lock files and other extensions")
    void discover_shouldSkipIneligibleFiles() throws Exception {
        file("A/B/.hidden.pdf");
        file("A/B/~$lock.docx");
        file("A/B/.cache/f.pdf");
        file(".git/B/f.pdf");
        file("A/.trash/f.pdf");
        file("A/B/notes.txt");
        file("A/B/noext");
        file("A/B/Scan.PDF");

        List<ClassifiedFile> files = collect(classifier().discover());

        assertThat(files).extracting(ClassifiedFile::fileName).containsExactly("Scan.PDF");
        assertThat(files.get(0).extension()).isEqualTo("pdf");
    }

    @Test
    @DisplayName("Should apply the category allow-lists")
    void discover_withFilters_shouldKeepAllowedCategories() throws Exception {
        file("A/x/1.pdf");
        file("A/y/2.pdf");
        file("B/x/3.pdf");

        assertThat(collect(classifier(Set.of("A"), Set.of(), 0).discover()))
                .extracting(ClassifiedFile::fileName).containsExactlyInAnyOrder("1.pdf", "2.pdf");
        assertThat(collect(classifier(Set.of(), Set.of("x"), 0).discover()))
                .extracting(ClassifiedFile::fileName).containsExactlyInAnyOrder("1.pdf", "3.pdf");
        assertThat(collect(classifier(Set.of("A"), Set.of("x"), 0).discover()))
                .extracting(ClassifiedFile::fileName).containsExactly("1.pdf");
    }

    @Test
    @DisplayName("Should ignore the category allow-lists in the full scan")
    void discoverAll_shouldIgnoreAllowLists() throws Exception {
        file("A/x/1.pdf");
        file("B/y/2.pdf");
        file("B/y/notes.txt");
        DocumentClassifierImpl filtered = classifier(Set.of("A"), Set.of("x"), 0);

        assertThat(collect(filtered.discover()))
                .extracting(ClassifiedFile::fileName).containsExactly("1.pdf");
        assertThat(collect(filtered.discoverAll()))
                .extracting(ClassifiedFile::fileName).containsExactlyInAnyOrder("1.pdf", "2.pdf");
    }

    @Test
    @DisplayName("Should cap discovery but not the full scan")
    void discover_withCap_shouldStopEarly() throws Exception {
        for (int i = 0; i < 5; i++) {
            file("A/B/f" + i + ".pdf");
        }
        DocumentClassifierImpl capped = classifier(Set.of(), Set.of(), 2);

        assertThat(collect(capped.discover())).hasSize(2);
        assertThat(collect(capped.discoverAll())).hasSize(5);
    }

    @Test
    @DisplayName("Should start over on every call")
    void discover_shouldBeRestartable() throws Exception {
        file("A/B/1.pdf");
        file("A/C/2.xls");
        DocumentClassifierImpl classifier = classifier();

        assertThat(collect(classifier.discover())).hasSize(2);
        assertThat(collect(classifier.discover())).hasSize(2);
    }

    @Test
    void discover_missingRoot_shouldBeEmpty() {
        DocumentClassifierImpl classifier = new DocumentClassifierImpl(root.resolve("missing"),
                new ClassificationFilter(OFFICE, Set.of(), Set.of(), 0));

        assertThat(collect(classifier.discover())).isEmpty();
    }

    @Test
    @DisplayName("Should classify a single path with the same rules as discovery")
    void classify_shouldMatchDiscoveryRules() throws Exception {
        Path eligible = file("A/B/sub/f.xlsx");
        Path shallow = file("A/f.pdf");
        Path hidden = file("A/.B/f.pdf");
        Path wrongExtension = file("A/B/f.txt");
        Path outside = Files.writeString(Files.createTempFile("outside", ".pdf"), "x");

        Optional<ClassifiedFile> classified = classifier().classify(eligible);
        assertThat(classified).isPresent();
        assertThat(classified.get().relativeSubpath()).isEqualTo("sub");

        assertThat(classifier().classify(shallow)).isEmpty();
        assertThat(classifier().classify(hidden)).isEmpty();
        assertThat(classifier().classify(wrongExtension)).isEmpty();
        assertThat(classifier().classify(outside)).isEmpty();
        assertThat(classifier().classify(root.resolve("A/B"))).isEmpty();
        assertThat(classifier(Set.of("Z"), Set.of(), 0).classify(eligible)).isEmpty();

        Files.delete(outside);
    }

    @Test
    void extension_shouldLowerCaseAndIgnoreDotfiles() {
        assertThat(DocumentClassifierImpl.extension("Report.DocX")).isEqualTo("docx");
        assertThat(DocumentClassifierImpl.extension("archive.tar.pdf")).isEqualTo("pdf");
        assertThat(DocumentClassifierImpl.extension(".pdf")).isEmpty();
        assertThat(DocumentClassifierImpl.extension("trailing.")).isEmpty();
        assertThat(DocumentClassifierImpl.extension("none")).isEmpty();
    }
}
