package io.github.nicechester.commentariat.store;

import io.github.nicechester.commentariat.exception.ErrorKind;
import io.github.nicechester.commentariat.exception.ManifestException;
import io.github.nicechester.commentariat.model.CanonicalBook;
import io.github.nicechester.commentariat.model.Commentary;
import io.github.nicechester.commentariat.model.Entry;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry store held entirely in memory.
 *
 * <p>Each commentary is an immutable {@link CommentaryIndex}. A load builds the new index
 * first and then swaps it in, so readers see either the old set or the new one, never a mix.
 * Loads are serialized; reads take no lock.
 */
@Slf4j
public class InMemoryEntryStore implements EntryStore {

    private final Map<String, CommentaryIndex> commentaries = new ConcurrentHashMap<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    @Override
    public int bulkLoad(Commentary commentary, List<Entry> entries, boolean replace) {
        writeLock.lock();
        try {
            if (!replace && commentaries.containsKey(commentary.slug())) {
                throw new ManifestException(ErrorKind.DUPLICATE_COMMENTARY,
                    "Commentary already exists: " + commentary.slug() + " (use replace)");
            }
            CommentaryIndex index = CommentaryIndex.build(commentary, entries);
            commentaries.put(commentary.slug(), index);
            log.debug("Indexed {} entries for commentary {}", entries.size(), commentary.slug());
            return entries.size();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<Entry> queryChapter(String slug, CanonicalBook book, int chapter) {
        CommentaryIndex index = commentaries.get(slug);
        return index == null ? List.of() : index.chapter(book, chapter);
    }

    @Override
    public List<Entry> queryVerse(String slug, CanonicalBook book, int chapter, int verse) {
        CommentaryIndex index = commentaries.get(slug);
        return index == null ? List.of() : index.verse(book, chapter, verse);
    }

    @Override
    public List<Commentary> listCommentaries() {
        return commentaries.values().stream()
            .map(CommentaryIndex::commentary)
            .sorted(Comparator.comparing(Commentary::name))
            .toList();
    }

    @Override
    public Optional<Commentary> getCommentary(String slugOrName) {
        if (slugOrName == null) {
            return Optional.empty();
        }
        CommentaryIndex exact = commentaries.get(slugOrName);
        if (exact != null) {
            return Optional.of(exact.commentary());
        }
        return commentaries.values().stream()
            .map(CommentaryIndex::commentary)
            .filter(c -> c.slug().equalsIgnoreCase(slugOrName) || c.name().equalsIgnoreCase(slugOrName))
            .min(Comparator.comparing(Commentary::slug));
    }

    @Override
    public boolean hasCommentary(String slug) {
        return commentaries.containsKey(slug);
    }

    @Override
    public long countEntries() {
        return commentaries.values().stream().mapToLong(CommentaryIndex::entryCount).sum();
    }

    @Override
    public long countEntries(String slug) {
        CommentaryIndex index = commentaries.get(slug);
        return index == null ? 0 : index.entryCount();
    }
}
