package io.github.nicechester.commentariat.model;

import io.github.nicechester.commentariat.exception.ErrorKind;
import io.github.nicechester.commentariat.exception.ReferenceException;

/**
 * Inclusive range of verse numbers within one chapter.
 * A single verse has {@code start == end}.
 */
public record VerseRange(int start, int end) {

    public VerseRange {
        if (start <= 0 || end <= 0) {
            throw new ReferenceException(ErrorKind.OUT_OF_RANGE, start + "-" + end,
                "chapter and verses must be positive");
        }
        if (end < start) {
            throw new ReferenceException(ErrorKind.INVALID_RANGE, start + "-" + end,
                "verse_end must be >= verse_start");
        }
    }

    public static VerseRange single(int verse) {
        return new VerseRange(verse, verse);
    }

    public boolean contains(int verse) {
        return start <= verse && verse <= end;
    }

    public int span() {
        return end - start;
    }

    @Override
    public String toString() {
        return start == end ? Integer.toString(start) : start + "-" + end;
    }
}
