package com.purchasingpower.docindex.model.document;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Data;

import java.util.Set;

/**
 * The indexed representation of one file.
 *
 * The id is the SHA-256 of the file bytes, so identical content always maps to the same
 * index entry whatever its path. JSON names follow the index mapping
 * ({@code opensearch-index.json}).
 */
@Data
@Builder
@JsonPropertyOrder({"id", "path", "file_name", "level1", "level2", "title", "content",
        "media_type", "ext", "modified_at", "size_bytes", "sha256", "suggest"})
public class DocumentRecord {

    private final String id;

    private final String path;

    @JsonProperty("file_name")
    private final String fileName;

    private final String level1;

    private final String level2;

    private final String title;

    private final String content;

    @JsonProperty("media_type")
    private final String mediaType;

    @JsonProperty("ext")
    private final String extension;

    /** ISO-8601 instant, UTC. */
    @JsonProperty("modified_at")
    private final String modifiedAt;

    @JsonProperty("size_bytes")
    private final long sizeBytes;

    private final String sha256;

    /** Autocomplete terms: categories and title, deduplicated. */
    private final Set<String> suggest;
}
