package io.github.nicechester.commentariat.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class CommentaryNotFoundException extends CommentariatException {

    public CommentaryNotFoundException(String key) {
        super(ErrorKind.NOT_FOUND, "Commentary not found: " + key);
    }
}
