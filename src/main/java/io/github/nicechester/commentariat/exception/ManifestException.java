package io.github.nicechester.commentariat.exception;

/**
 * Structural problem with a manifest, or a slug conflict. Aborts the whole ingestion
 * before the store is touched.
 */
public class ManifestException extends CommentariatException {

    public ManifestException(String message) {
        super(ErrorKind.STRUCTURAL_MANIFEST_ERROR, message);
    }

    public ManifestException(String message, Throwable cause) {
        super(ErrorKind.STRUCTURAL_MANIFEST_ERROR, message, cause);
    }

    public ManifestException(ErrorKind kind, String message) {
        super(kind, message);
    }
}
