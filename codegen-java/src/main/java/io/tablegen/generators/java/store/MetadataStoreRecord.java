package io.tablegen.generators.java.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.tablegen.core.model.TableMetadata;

import java.time.Instant;

/**
 * Last accepted generation of one table. {@code generatedAt} is fixed at first creation;
 * {@code updatedAt} moves with every accepted regeneration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MetadataStoreRecord(
    String checksum,
    TableMetadata metadata,
    Instant generatedAt,
    Instant updatedAt
) {
    @JsonCreator
    public MetadataStoreRecord(
        @JsonProperty("checksum") String checksum,
        @JsonProperty("metadata") TableMetadata metadata,
        @JsonProperty("generatedAt") Instant generatedAt,
        @JsonProperty("updatedAt") Instant updatedAt
    ) {
        this.checksum = checksum;
        this.metadata = metadata;
        this.generatedAt = generatedAt;
        this.updatedAt = updatedAt;
    }
}
