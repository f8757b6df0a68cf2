package io.github.nicechester.commentariat.service;

import io.github.nicechester.commentariat.exception.CommentaryNotFoundException;
import io.github.nicechester.commentariat.model.BookResult;
import io.github.nicechester.commentariat.model.CanonicalBook;
import io.github.nicechester.commentariat.model.Commentary;
import io.github.nicechester.commentariat.model.Entry;
import io.github.nicechester.commentariat.model.PassageResponse;
import io.github.nicechester.commentariat.store.EntryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of the API: resolves the requested reference and queries the entry store.
 *
 * <p>Checks run in a fixed order: chapter/verse positivity, then the commentary, then the
 * book. An unknown book is therefore reported as a client error even for a commentary that
 * has no data for it, and a recognised book with no entries gives an empty result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommentaryService {

    private final EntryStore entryStore;
    private final ReferenceResolver referenceResolver;

    public List<BookResult> listBooks() {
        return CanonTable.listCanonicalBooks().stream()
            .map(BookResult::from)
            .toList();
    }

    public List<Commentary> listCommentaries() {
        return entryStore.listCommentaries();
    }

    public Commentary getCommentary(String slugOrName) {
        return entryStore.getCommentary(slugOrName)
            .orElseThrow(() -> new CommentaryNotFoundException(slugOrName));
    }

    public PassageResponse getChapter(String slugOrName, String book, int chapter) {
        referenceResolver.requirePositive(chapter, "chapter");
        Commentary commentary = getCommentary(slugOrName);
        CanonicalBook canonicalBook = referenceResolver.resolveBook(book);

        List<Entry> entries = entryStore.queryChapter(commentary.slug(), canonicalBook, chapter);
        log.debug("{} {} {}: {} entries", commentary.slug(), canonicalBook, chapter, entries.size());
        return PassageResponse.of(commentary, canonicalBook, chapter, null, entries);
    }

    public PassageResponse getVerse(String slugOrName, String book, int chapter, int verse) {
        referenceResolver.requirePositive(chapter, "chapter");
        referenceResolver.requirePositive(verse, "verse");
        Commentary commentary = getCommentary(slugOrName);
        CanonicalBook canonicalBook = referenceResolver.resolveBook(book);

        List<Entry> entries = entryStore.queryVerse(commentary.slug(), canonicalBook, chapter, verse);
        log.debug("{} {} {}:{}: {} entries", commentary.slug(), canonicalBook, chapter, verse, entries.size());
        return PassageResponse.of(commentary, canonicalBook, chapter, verse, entries);
    }
}
