package io.github.nicechester.commentariat.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response for a chapter or verse lookup.
 */
@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PassageResponse {

    private Commentary commentary;

    /**
     * Canonical book name (e.g., "Genesis"), whatever spelling was requested
     */
    private String book;

    private Integer chapter;

    /**
     * Requested verse; absent for chapter lookups
     */
    private Integer verse;

    /**
     * Number of entries returned
     */
    private Integer count;

    /**
     * Matching entries ordered by verse_start, then verse_end
     */
    private List<EntryResult> entries;

    public static PassageResponse of(Commentary commentary, CanonicalBook book, int chapter, Integer verse,
                                     List<Entry> entries) {
        List<EntryResult> results = entries.stream().map(EntryResult::from).toList();
        return PassageResponse.builder()
            .commentary(commentary)
            .book(book.displayName())
            .chapter(chapter)
            .verse(verse)
            .count(results.size())
            .entries(results)
            .build();
    }
}
