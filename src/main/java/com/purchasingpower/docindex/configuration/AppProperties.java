package com.purchasingpower.docindex.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private DocumentsProperties documents = new DocumentsProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ExtractionProperties extraction = new ExtractionProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private OpenSearchProperties opensearch = new OpenSearchProperties();
}
