package io.github.nicechester.commentariat.model;

/**
 * Raw verse anchor of an entry as found in a manifest record.
 *
 * <p>Values are left as they were supplied (a {@link Number}, a {@link String}, or
 * {@code null} when the field is absent) so the resolver can report the original text.
 */
public record VerseSpec(Object verseStart, Object verseEnd, Object verse) {

    public static VerseSpec of(Object verse) {
        return new VerseSpec(null, null, verse);
    }

    public static VerseSpec explicit(Object verseStart, Object verseEnd) {
        return new VerseSpec(verseStart, verseEnd, null);
    }

    public boolean hasExplicitBounds() {
        return verseStart != null || verseEnd != null;
    }
}
