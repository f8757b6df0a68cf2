package io.github.nicechester.commentariat.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of ingesting one manifest.
 */
@Data
@Builder(toBuilder = true)
public class IngestionReport {

    /**
     * Slug of the ingested commentary
     */
    private String slug;

    /**
     * Entries written to the store
     */
    private int inserted;

    /**
     * Records rejected during validation
     */
    private int skipped;

    /**
     * Whether previous entries of the slug were replaced
     */
    private boolean replaced;

    private List<IngestionError> errors;

    /**
     * Time taken in milliseconds
     */
    private long elapsedMs;
}
