package io.github.nicechester.commentariat.exception;

/**
 * Failure categories surfaced by resolution, lookup and ingestion.
 */
public enum ErrorKind {
    UNKNOWN_BOOK,
    MALFORMED_VERSE_EXPRESSION,
    INVALID_RANGE,
    OUT_OF_RANGE,
    MISSING_VERSE,
    MISSING_CHAPTER,
    MISSING_TEXT,
    NOT_FOUND,
    STRUCTURAL_MANIFEST_ERROR,
    DUPLICATE_COMMENTARY
}
