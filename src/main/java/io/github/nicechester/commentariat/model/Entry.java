package io.github.nicechester.commentariat.model;

import java.util.Objects;

/**
 * One stored commentary excerpt. Immutable once created by ingestion.
 */
public record Entry(
    String commentarySlug,
    CanonicalBook book,
    int chapter,
    VerseRange range,
    String text
) {

    public Entry {
        Objects.requireNonNull(commentarySlug, "commentarySlug");
        Objects.requireNonNull(book, "book");
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(text, "text");
    }

    public int verseStart() {
        return range.start();
    }

    public int verseEnd() {
        return range.end();
    }

    /**
     * Reference string such as "Romans 8:1-3".
     */
    public String reference() {
        return book.displayName() + " " + chapter + ":" + range;
    }
}
