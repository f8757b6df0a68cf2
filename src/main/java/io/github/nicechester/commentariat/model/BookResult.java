package io.github.nicechester.commentariat.model;

import java.util.List;

/**
 * One canonical book in the book listing.
 */
public record BookResult(
    String canonical,
    Testament testament,
    int position,
    List<String> aliases
) {

    public static BookResult from(CanonicalBook book) {
        return new BookResult(book.displayName(), book.testament(), book.position(), List.copyOf(book.aliases()));
    }
}
