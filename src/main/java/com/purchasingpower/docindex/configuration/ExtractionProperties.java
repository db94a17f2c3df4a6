package com.purchasingpower.docindex.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.time.Duration;

@Data
public class ExtractionProperties {

    @NotBlank
    private String baseUrl = "http://localhost:9998";

    @NotNull
    private Duration metaTimeout = Duration.ofSeconds(120);

    @NotNull
    private Duration textTimeout = Duration.ofSeconds(300);

    @Positive
    private int maxInMemoryMb = 64;
}
