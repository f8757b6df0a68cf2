package io.github.nicechester.commentariat.store;

import io.github.nicechester.commentariat.model.CanonicalBook;
import io.github.nicechester.commentariat.model.Commentary;
import io.github.nicechester.commentariat.model.Entry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of one commentary: its metadata and its entries grouped per (book, chapter).
 * Never modified after construction; a re-ingestion builds a new snapshot.
 */
final class CommentaryIndex {

    private record ChapterKey(CanonicalBook book, int chapter) {}

    private final Commentary commentary;
    private final Map<ChapterKey, ChapterIndex> chapters;
    private final long entryCount;

    private CommentaryIndex(Commentary commentary, Map<ChapterKey, ChapterIndex> chapters, long entryCount) {
        this.commentary = commentary;
        this.chapters = chapters;
        this.entryCount = entryCount;
    }

    static CommentaryIndex build(Commentary commentary, List<Entry> entries) {
        Map<ChapterKey, List<Entry>> grouped = new HashMap<>();
        for (Entry entry : entries) {
            grouped.computeIfAbsent(new ChapterKey(entry.book(), entry.chapter()), k -> new ArrayList<>())
                .add(entry);
        }

        Map<ChapterKey, ChapterIndex> chapters = new HashMap<>(grouped.size() * 2);
        grouped.forEach((key, group) -> chapters.put(key, ChapterIndex.of(group)));
        return new CommentaryIndex(commentary, Map.copyOf(chapters), entries.size());
    }

    Commentary commentary() {
        return commentary;
    }

    long entryCount() {
        return entryCount;
    }

    List<Entry> chapter(CanonicalBook book, int chapter) {
        ChapterIndex index = chapters.get(new ChapterKey(book, chapter));
        return index == null ? List.of() : index.all();
    }

    List<Entry> verse(CanonicalBook book, int chapter, int verse) {
        ChapterIndex index = chapters.get(new ChapterKey(book, chapter));
        return index == null ? List.of() : index.covering(verse);
    }
}
