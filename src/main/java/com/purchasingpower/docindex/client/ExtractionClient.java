package com.purchasingpower.docindex.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.docindex.configuration.AppProperties;
import com.purchasingpower.docindex.configuration.ExtractionProperties;
import com.purchasingpower.docindex.exception.UpstreamServiceException;
import com.purchasingpower.docindex.model.CallContext;
import com.purchasingpower.docindex.model.ServiceType;
import com.purchasingpower.docindex.model.document.ExtractionResult;
import com.purchasingpower.docindex.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Client for an Apache Tika server.
 *
 * <p>Each extraction sends the raw file twice: to {@code /meta} for the metadata (JSON) and to
 * {@code /tika} for the plain text. Both calls must succeed; a failure of either one retries
 * the pair according to the {@link RetryPolicy}. Files above the configured size are not sent
 * at all.
 */
@Slf4j
@Component
public class ExtractionClient {

    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final WebClient tikaWebClient;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final ExtractionProperties props;
    private final long maxExtractBytes;

    public ExtractionClient(
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper,
            RetryPolicy retryPolicy,
            AppProperties appProperties) {
        this.props = appProperties.getExtraction();
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
        this.maxExtractBytes = appProperties.getDocuments().getMaxExtractMb() * BYTES_PER_MB;
        this.tikaWebClient = webClientBuilder
                .baseUrl(props.getBaseUrl())
                .codecs(configurer -> configurer.defaultCodecs()
                        .maxInMemorySize((int) (props.getMaxInMemoryMb() * BYTES_PER_MB)))
                .build();
    }

    /**
     * Whether a file of this size goes through the extraction service.
     */
    public boolean shouldExtract(long sizeBytes) {
        return sizeBytes <= maxExtractBytes;
    }

    /**
     * Extracts title, text and media type of a file.
     *
     * <p>Above the size threshold the service is not called and the result only carries the
     * file name stem as title.
     *
     * @throws IOException              if the file cannot be read
     * @throws UpstreamServiceException if the service keeps failing after all retries
     */
    public ExtractionResult extract(Path file, long sizeBytes) throws IOException {
        String fileName = file.getFileName().toString();
        String stem = stem(fileName);
        if (!shouldExtract(sizeBytes)) {
            log.info("Skipping extraction for {} ({} bytes above {} MB)",
                    fileName, sizeBytes, maxExtractBytes / BYTES_PER_MB);
            return ExtractionResult.titleOnly(stem);
        }

        byte[] bytes = Files.readAllBytes(file);
        CallContext call = ExternalCallLogger.startCall(ServiceType.TIKA, "extract", log);
        call.logRequest(fileName + " (" + bytes.length + " bytes)");

        Mono<JsonNode> metadata = tikaWebClient.put()
                .uri("/meta")
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(bytes)
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .timeout(props.getMetaTimeout())
                .map(this::parseMetadata);

        Mono<String> text = tikaWebClient.put()
                .uri("/tika")
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .accept(MediaType.TEXT_PLAIN)
                .bodyValue(bytes)
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .timeout(props.getTextTimeout());

        try {
            ExtractionResult result = metadata
                    .flatMap(meta -> text.map(content -> toResult(meta, content, stem)))
                    .retryWhen(retryPolicy.toRetrySpec(call))
                    .block();
            call.logResponse("title='" + ExternalCallLogger.truncate(result.title(), 80)
                    + "', " + result.content().length() + " chars");
            return result;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            call.logError("Extraction failed for " + fileName + ": " + cause, cause);
            throw new UpstreamServiceException(ServiceType.TIKA,
                    "extraction failed for " + fileName, statusOf(cause), cause);
        }
    }

    private ExtractionResult toResult(JsonNode meta, String content, String stem) {
        String title = firstText(meta, "title", "dc:title");
        String mediaType = firstText(meta, "Content-Type", "Content-Type-Parsed");
        return new ExtractionResult(
                title.isEmpty() ? stem : title,
                content,
                mediaType,
                true);
    }

    private JsonNode parseMetadata(String body) {
        if (body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Unreadable Tika metadata, ignoring it: {}", e.getOriginalMessage());
            return objectMapper.createObjectNode();
        }
    }

    /**
     * First non-blank value among the keys. Multi-valued entries use their first element.
     */
    static String firstText(JsonNode meta, String... keys) {
        for (String key : keys) {
            JsonNode value = meta.path(key);
            if (value.isArray()) {
                value = value.path(0);
            }
            if (value.isValueNode()) {
                String text = value.asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return "";
    }

    static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static int statusOf(Throwable cause) {
        return cause instanceof WebClientResponseException webEx ? webEx.getStatusCode().value() : -1;
    }
}
