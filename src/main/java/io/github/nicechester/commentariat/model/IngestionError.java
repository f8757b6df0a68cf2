package io.github.nicechester.commentariat.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.nicechester.commentariat.exception.ErrorKind;

/**
 * A record rejected during ingestion, with the reason it was rejected.
 */
public record IngestionError(
    String location,
    @JsonProperty("raw_entry") String rawEntry,
    ErrorKind kind,
    String reason
) {
}
