package com.purchasingpower.docindex.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.time.Duration;

@Data
public class OpenSearchProperties {

    @NotBlank
    private String baseUrl = "http://localhost:9200";

    @NotBlank
    private String indexName = "ndf-docs";

    @NotBlank
    private String mappingLocation = "classpath:opensearch-index.json";

    @NotNull
    private Duration existsTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration upsertTimeout = Duration.ofSeconds(60);

    @NotNull
    private Duration statsTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration settingsTimeout = Duration.ofSeconds(5);

    @Positive
    private long highlightMaxAnalyzedOffset = 5_000_000L;
}
