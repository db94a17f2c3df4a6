package com.purchasingpower.docindex.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.docindex.configuration.AppProperties;
import com.purchasingpower.docindex.configuration.OpenSearchProperties;
import com.purchasingpower.docindex.exception.IndexConfigurationException;
import com.purchasingpower.docindex.exception.UpstreamServiceException;
import com.purchasingpower.docindex.model.CallContext;
import com.purchasingpower.docindex.model.ServiceType;
import com.purchasingpower.docindex.model.document.DocumentRecord;
import com.purchasingpower.docindex.model.stats.IndexStats;
import com.purchasingpower.docindex.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * Client for the OpenSearch REST API: index bootstrap, document upserts and the
 * category aggregation used for reconciliation.
 */
@Slf4j
@Component
public class OpenSearchClient {

    static final String FALLBACK_MAPPING = "{\"mappings\":{\"properties\":{\"content\":{\"type\":\"text\"}}}}";

    private static final int LEVEL1_BUCKETS = 500;
    private static final int LEVEL2_BUCKETS = 1000;

    private final WebClient openSearchWebClient;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final ResourceLoader resourceLoader;
    private final OpenSearchProperties props;

    public OpenSearchClient(
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper,
            RetryPolicy retryPolicy,
            ResourceLoader resourceLoader,
            AppProperties appProperties) {
        this.props = appProperties.getOpensearch();
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
        this.resourceLoader = resourceLoader;
        this.openSearchWebClient = webClientBuilder
                .baseUrl(props.getBaseUrl())
                .build();
    }

    /**
     * Makes sure the index exists, creating it from the mapping file when it does not.
     *
     * @throws IndexConfigurationException when the existence check answers anything but
     *                                     200 or 404, or when the index cannot be created
     */
    public void ensureIndex() {
        String index = props.getIndexName();
        CallContext call = ExternalCallLogger.startCall(ServiceType.OPENSEARCH, "index-exists", log);
        call.logRequest(index);

        Integer status;
        try {
            status = openSearchWebClient.get()
                    .uri("/{index}", index)
                    .exchangeToMono(response -> response.releaseBody()
                            .thenReturn(response.statusCode().value()))
                    .timeout(props.getExistsTimeout())
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            call.logError("Index check failed: " + cause, cause);
            throw new IndexConfigurationException("Cannot check index '" + index + "': " + cause, cause);
        }
        call.logResponse("status " + status);

        if (status == null) {
            throw new IndexConfigurationException("No answer while checking index '" + index + "'");
        } else if (status == 200) {
            log.info("Index '{}' exists", index);
        } else if (status == 404) {
            createIndex(index);
        } else {
            throw new IndexConfigurationException(
                    "Unexpected status " + status + " while checking index '" + index + "'");
        }

        raiseHighlightLimit(index);
    }

    private void createIndex(String index) {
        String mapping = loadMapping();
        CallContext call = ExternalCallLogger.startCall(ServiceType.OPENSEARCH, "create-index", log);
        call.logRequest(index);
        try {
            openSearchWebClient.put()
                    .uri("/{index}", index)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(mapping)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(props.getExistsTimeout())
                    .block();
            call.logResponse("created");
            log.info("Created index '{}'", index);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (alreadyExists(cause)) {
                log.info("Index '{}' was created concurrently", index);
                return;
            }
            call.logError("Index creation failed: " + cause, cause);
            throw new IndexConfigurationException("Cannot create index '" + index + "': " + cause, cause);
        }
    }

    /**
     * Lets the search side highlight long documents. The index works without it, so a
     * failure here is only a warning.
     */
    private void raiseHighlightLimit(String index) {
        Map<String, Object> settings = Map.of(
                "index.highlight.max_analyzed_offset", props.getHighlightMaxAnalyzedOffset());
        try {
            openSearchWebClient.put()
                    .uri("/{index}/_settings", index)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(toJson(settings))
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(props.getSettingsTimeout())
                    .block();
        } catch (RuntimeException e) {
            log.warn("Could not raise highlight limit on '{}', continuing without it: {}",
                    index, Exceptions.unwrap(e).toString());
        }
    }

    /**
     * Writes the record under its content hash, replacing any previous version.
     *
     * @throws UpstreamServiceException if every attempt failed
     */
    public void upsert(DocumentRecord record) {
        String id = record.getId();
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Document record has no id: " + record.getPath());
        }
        String body = toJson(record);
        CallContext call = ExternalCallLogger.startCall(ServiceType.OPENSEARCH, "upsert", log);
        call.logRequest(id + " " + record.getPath());
        try {
            openSearchWebClient.put()
                    .uri("/{index}/_doc/{id}", props.getIndexName(), id)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(props.getUpsertTimeout())
                    .retryWhen(retryPolicy.toRetrySpec(call))
                    .block();
            call.logResponse(id);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            call.logError("Upsert failed for " + record.getPath() + ": " + cause, cause);
            throw new UpstreamServiceException(ServiceType.OPENSEARCH,
                    "upsert failed for " + id, statusOf(cause), cause);
        }
    }

    /**
     * Document counts per first- and second-level category, as seen by the index.
     *
     * @throws UpstreamServiceException if the aggregation query fails
     */
    public IndexStats aggregateCategoryCounts() {
        Map<String, Object> query = Map.of(
                "size", 0,
                "aggs", Map.of(
                        "by_level1", Map.of("terms", Map.of("field", "level1", "size", LEVEL1_BUCKETS)),
                        "by_level2", Map.of("terms", Map.of("field", "level2", "size", LEVEL2_BUCKETS))));
        CallContext call = ExternalCallLogger.startCall(ServiceType.OPENSEARCH, "aggregate", log);
        call.logRequest(props.getIndexName());

        String body;
        try {
            body = openSearchWebClient.post()
                    .uri("/{index}/_search", props.getIndexName())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(toJson(query))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(props.getStatsTimeout())
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            call.logError("Aggregation failed: " + cause, cause);
            throw new UpstreamServiceException(ServiceType.OPENSEARCH,
                    "aggregation failed: " + cause.getMessage(), statusOf(cause), cause);
        }

        try {
            JsonNode root = objectMapper.readTree(body == null ? "{}" : body);
            IndexStats stats = new IndexStats(
                    totalHits(root.path("hits").path("total")),
                    buckets(root.path("aggregations").path("by_level1")),
                    buckets(root.path("aggregations").path("by_level2")));
            call.logResponse(stats.total() + " documents");
            return stats;
        } catch (JsonProcessingException e) {
            throw new UpstreamServiceException(ServiceType.OPENSEARCH,
                    "unreadable aggregation response", e);
        }
    }

    private static long totalHits(JsonNode total) {
        // OpenSearch answers {"value": n, "relation": ...}; legacy clusters a bare number
        return total.isNumber() ? total.asLong() : total.path("value").asLong(0);
    }

    private static Map<String, Long> buckets(JsonNode aggregation) {
        Map<String, Long> counts = new TreeMap<>();
        for (JsonNode bucket : aggregation.path("buckets")) {
            counts.put(bucket.path("key").asText(), bucket.path("doc_count").asLong());
        }
        return counts;
    }

    String loadMapping() {
        Resource resource = resourceLoader.getResource(props.getMappingLocation());
        if (!resource.exists()) {
            log.warn("Mapping file {} not found, creating index with a minimal mapping",
                    props.getMappingLocation());
            return FALLBACK_MAPPING;
        }
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Mapping file {} unreadable, creating index with a minimal mapping: {}",
                    props.getMappingLocation(), e.getMessage());
            return FALLBACK_MAPPING;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize OpenSearch request", e);
        }
    }

    private static boolean alreadyExists(Throwable cause) {
        return cause instanceof WebClientResponseException webEx
                && webEx.getStatusCode().value() == 400
                && webEx.getResponseBodyAsString().contains("resource_already_exists_exception");
    }

    private static int statusOf(Throwable cause) {
        return cause instanceof WebClientResponseException webEx ? webEx.getStatusCode().value() : -1;
    }
}
