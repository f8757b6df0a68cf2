package io.github.nicechester.commentariat.exception;

import lombok.Getter;

/**
 * Base type for failures that carry an {@link ErrorKind}.
 */
@Getter
public abstract class CommentariatException extends RuntimeException {

    private final ErrorKind kind;

    protected CommentariatException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected CommentariatException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
