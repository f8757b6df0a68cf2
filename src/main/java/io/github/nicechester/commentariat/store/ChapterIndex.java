package io.github.nicechester.commentariat.store;

import io.github.nicechester.commentariat.model.Entry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable, sorted entries of one (commentary, book, chapter) group.
 *
 * <p>Entries are sorted by {@code verse_start}, then {@code verse_end}, and the index keeps
 * the widest span {@code w} of any entry. An entry can only contain verse {@code v} if its
 * start lies in {@code [v - w, v]}, so a verse lookup binary-searches the lower bound and
 * scans forward until the start passes {@code v}: O(log n + k) for the k candidates in
 * that window.
 */
final class ChapterIndex {

    static final Comparator<Entry> ORDER = Comparator
        .comparingInt(Entry::verseStart)
        .thenComparingInt(Entry::verseEnd);

    private final List<Entry> entries;
    private final int[] starts;
    private final int widestSpan;

    private ChapterIndex(List<Entry> sorted) {
        this.entries = List.copyOf(sorted);
        this.starts = new int[sorted.size()];
        int widest = 0;
        for (int i = 0; i < sorted.size(); i++) {
            Entry entry = sorted.get(i);
            starts[i] = entry.verseStart();
            widest = Math.max(widest, entry.range().span());
        }
        this.widestSpan = widest;
    }

    static ChapterIndex of(Collection<Entry> entries) {
        List<Entry> sorted = new ArrayList<>(entries);
        sorted.sort(ORDER);
        return new ChapterIndex(sorted);
    }

    List<Entry> all() {
        return entries;
    }

    int size() {
        return entries.size();
    }

    List<Entry> covering(int verse) {
        List<Entry> result = new ArrayList<>();
        for (int i = firstStartAtLeast(verse - widestSpan); i < starts.length && starts[i] <= verse; i++) {
            Entry entry = entries.get(i);
            if (entry.verseEnd() >= verse) {
                result.add(entry);
            }
        }
        return result;
    }

    private int firstStartAtLeast(int key) {
        int low = 0;
        int high = starts.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (starts[mid] < key) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}
