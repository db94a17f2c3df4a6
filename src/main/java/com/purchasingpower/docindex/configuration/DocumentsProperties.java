package com.purchasingpower.docindex.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Where the documents live and which of them are eligible for indexing.
 */
@Data
public class DocumentsProperties {

    @NotBlank(message = "Document root path is required")
    private String root = "data/Note de frais";

    @NotEmpty
    private List<String> allowedExtensions = new ArrayList<>(List.of("pdf", "doc", "docx", "xls", "xlsx"));

    /** Allowed first-level categories. Empty means every category. */
    private List<String> filterLevel1 = new ArrayList<>();

    /** Allowed second-level categories. Empty means every category. */
    private List<String> filterLevel2 = new ArrayList<>();

    /** Stop discovery after this many documents. 0 disables the cap. */
    @PositiveOrZero
    private int maxDocs;

    /** Files above this size (MB) are indexed without calling the extraction service. */
    @Positive
    private int maxExtractMb = 30;
}
