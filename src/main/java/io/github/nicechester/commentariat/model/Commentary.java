package io.github.nicechester.commentariat.model;

import lombok.Builder;

/**
 * Metadata of one commentary source. Replaced as a whole on re-ingestion.
 */
@Builder(toBuilder = true)
public record Commentary(
    /**
     * Unique, URL-safe identifier (e.g., "mhc" for Matthew Henry's Commentary)
     */
    String slug,

    /**
     * Display name
     */
    String name,

    String description,

    /**
     * Where the text was taken from
     */
    String source,

    String license,

    /**
     * Language code (e.g., "en")
     */
    String language
) {
}
