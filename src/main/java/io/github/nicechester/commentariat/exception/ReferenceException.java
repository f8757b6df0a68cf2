package io.github.nicechester.commentariat.exception;

import lombok.Getter;

/**
 * A book, chapter or verse expression that could not be resolved.
 * Carries the offending raw text for diagnostics.
 */
@Getter
public class ReferenceException extends CommentariatException {

    private final String rawValue;

    public ReferenceException(ErrorKind kind, String rawValue, String message) {
        super(kind, message);
        this.rawValue = rawValue;
    }
}
