package io.github.nicechester.commentariat.store;

import io.github.nicechester.commentariat.model.CanonicalBook;
import io.github.nicechester.commentariat.model.Commentary;
import io.github.nicechester.commentariat.model.Entry;

import java.util.List;
import java.util.Optional;

/**
 * Storage for commentaries and their range-keyed entries.
 *
 * <p>Entries are only ever written by {@link #bulkLoad}; reads are side-effect free and may
 * run concurrently with each other and with a load. Query results are ordered by
 * {@code verse_start} ascending, then {@code verse_end} ascending.
 */
public interface EntryStore extends AutoCloseable {

    /**
     * Stores a commentary and its entries.
     *
     * <p>In replace mode the previous entries and metadata of the slug are discarded and the new
     * set takes their place as one atomic step; if the write fails the prior data stays intact.
     * Without replace, a slug that is already stored is rejected before anything is written.
     *
     * @return number of entries inserted
     * @throws io.github.nicechester.commentariat.exception.ManifestException
     *         with {@code DUPLICATE_COMMENTARY} when the slug exists and {@code replace} is false
     */
    int bulkLoad(Commentary commentary, List<Entry> entries, boolean replace);

    /**
     * All entries of one chapter. Empty when the commentary, book or chapter has none.
     */
    List<Entry> queryChapter(String slug, CanonicalBook book, int chapter);

    /**
     * Entries whose range contains {@code verse}, not only exact matches.
     */
    List<Entry> queryVerse(String slug, CanonicalBook book, int chapter, int verse);

    /**
     * All commentaries ordered by name.
     */
    List<Commentary> listCommentaries();

    /**
     * Looks a commentary up by exact slug, then by case-insensitive slug or name.
     */
    Optional<Commentary> getCommentary(String slugOrName);

    boolean hasCommentary(String slug);

    long countEntries();

    long countEntries(String slug);

    @Override
    default void close() {
    }
}
