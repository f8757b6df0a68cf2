package io.github.nicechester.commentariat.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A commentary entry as returned by the API.
 */
public record EntryResult(
    @JsonProperty("verse_start") int verseStart,
    @JsonProperty("verse_end") int verseEnd,
    String text
) {

    public static EntryResult from(Entry entry) {
        return new EntryResult(entry.verseStart(), entry.verseEnd(), entry.text());
    }
}
