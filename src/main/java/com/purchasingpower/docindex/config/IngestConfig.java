package com.purchasingpower.docindex.config;

import com.purchasingpower.docindex.client.RetryPolicy;
import com.purchasingpower.docindex.configuration.AppProperties;
import com.purchasingpower.docindex.model.document.ClassificationFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Turns the bound properties into the immutable values handed to the pipeline components.
 */
@Slf4j
@Configuration
public class IngestConfig {

    @Bean
    public ClassificationFilter classificationFilter(AppProperties props) {
        ClassificationFilter filter = ClassificationFilter.from(props.getDocuments());
        log.info("Classification: extensions={}, level1={}, level2={}, maxDocs={}",
                filter.allowedExtensions(), filter.level1(), filter.level2(), filter.maxDocs());
        return filter;
    }

    @Bean
    public RetryPolicy retryPolicy(GlobalRetryConfig retryConfig) {
        return retryConfig.toPolicy();
    }
}
