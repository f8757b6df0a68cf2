package io.github.nicechester.commentariat.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions from all controllers to a JSON error body.
 *
 * <p>Client input errors (unknown book, non-positive chapter) are 400, unknown
 * commentaries are 404. Spring MVC's own exceptions (unknown route, wrong method) keep the
 * status Spring assigns them. Anything else is logged with its stack trace and returned as 500.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(ReferenceException.class)
    public ResponseEntity<Object> handleReference(ReferenceException ex, WebRequest request) {
        log.warn("Rejected reference '{}': {}", ex.getRawValue(), ex.getMessage());
        return buildErrorResponse(ex.getMessage(), ex.getKind(), HttpStatus.BAD_REQUEST, request);
    }

    @ExceptionHandler(CommentaryNotFoundException.class)
    public ResponseEntity<Object> handleNotFound(CommentaryNotFoundException ex, WebRequest request) {
        log.warn("{}", ex.getMessage());
        return buildErrorResponse("Commentary not found", ex.getKind(), HttpStatus.NOT_FOUND, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Object> handleTypeMismatch(MethodArgumentTypeMismatchException ex, WebRequest request) {
        String detail = ex.getName() + " must be an integer: " + ex.getValue();
        log.warn("Rejected path variable: {}", detail);
        return buildErrorResponse(detail, ErrorKind.MALFORMED_VERSE_EXPRESSION, HttpStatus.BAD_REQUEST, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleAllUncaughtException(Exception ex, WebRequest request) {
        log.error("Unexpected error:", ex);
        return buildErrorResponse("Internal server error", null, HttpStatus.INTERNAL_SERVER_ERROR, request);
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(Exception ex, Object body, HttpHeaders headers,
                                                             HttpStatusCode statusCode, WebRequest request) {
        String detail = body instanceof ProblemDetail problem && problem.getDetail() != null
            ? problem.getDetail()
            : ex.getMessage();
        if (statusCode.is5xxServerError()) {
            log.error("Request failed:", ex);
        } else {
            log.warn("Rejected request: {}", detail);
        }
        return buildErrorResponse(detail, null, statusCode, headers, request);
    }

    private ResponseEntity<Object> buildErrorResponse(String detail, ErrorKind kind, HttpStatusCode status,
                                                      WebRequest request) {
        return buildErrorResponse(detail, kind, status, HttpHeaders.EMPTY, request);
    }

    private ResponseEntity<Object> buildErrorResponse(String detail, ErrorKind kind, HttpStatusCode status,
                                                      HttpHeaders headers, WebRequest request) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", LocalDateTime.now());
        body.put("status", status.value());
        body.put("error", resolved != null ? resolved.getReasonPhrase() : status.toString());
        if (kind != null) {
            body.put("kind", kind.name());
        }
        body.put("detail", detail);
        body.put("path", request.getDescription(false).replace("uri=", ""));

        return new ResponseEntity<>(body, headers, status);
    }
}
