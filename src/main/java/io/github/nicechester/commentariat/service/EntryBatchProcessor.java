package io.github.nicechester.commentariat.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.nicechester.commentariat.exception.ErrorKind;
import io.github.nicechester.commentariat.exception.ReferenceException;
import io.github.nicechester.commentariat.model.CanonicalBook;
import io.github.nicechester.commentariat.model.Entry;
import io.github.nicechester.commentariat.model.IngestionError;
import io.github.nicechester.commentariat.model.RawEntry;
import io.github.nicechester.commentariat.model.VerseRange;
import io.github.nicechester.commentariat.model.VerseSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw manifest records into entries.
 *
 * <p>{@link #process} has no side effects: every record ends up either in
 * {@link BatchResult#accepted()} or, with its reason, in {@link BatchResult#rejected()}. A bad
 * record never stops the rest of the batch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntryBatchProcessor {

    private final ReferenceResolver referenceResolver;

    /**
     * Accumulated outcome of one batch.
     */
    public record BatchResult(List<Entry> accepted, List<IngestionError> rejected) {

        public int total() {
            return accepted.size() + rejected.size();
        }
    }

    public BatchResult process(String slug, List<RawEntry> records) {
        List<Entry> accepted = new ArrayList<>(records.size());
        List<IngestionError> rejected = new ArrayList<>();

        for (RawEntry record : records) {
            try {
                accepted.add(toEntry(slug, record));
            } catch (ReferenceException e) {
                log.debug("Rejected {} ({}): {}", record.location(), e.getKind(), e.getMessage());
                rejected.add(new IngestionError(record.location(), record.rawText(), e.getKind(), e.getMessage()));
            }
        }

        return new BatchResult(List.copyOf(accepted), List.copyOf(rejected));
    }

    Entry toEntry(String slug, RawEntry record) {
        if (record.node() == null) {
            throw new ReferenceException(ErrorKind.MALFORMED_VERSE_EXPRESSION, record.rawText(), record.parseError());
        }
        JsonNode node = record.node();
        if (!node.isObject()) {
            throw new ReferenceException(ErrorKind.MALFORMED_VERSE_EXPRESSION, record.rawText(),
                "entry must be a JSON object");
        }

        JsonNode bookNode = node.get("book");
        if (bookNode == null || !bookNode.isTextual()) {
            throw new ReferenceException(ErrorKind.UNKNOWN_BOOK, String.valueOf(bookNode), "entry.book must be a string");
        }
        CanonicalBook book = referenceResolver.resolveBook(bookNode.asText());
        int chapter = referenceResolver.resolveChapter(scalar(node.get("chapter")));
        VerseRange range = referenceResolver.resolveRange(new VerseSpec(
            scalar(node.get("verse_start")),
            scalar(node.get("verse_end")),
            scalar(node.get("verse"))));

        JsonNode textNode = node.get("text");
        if (textNode == null || !textNode.isTextual() || textNode.asText().isBlank()) {
            throw new ReferenceException(ErrorKind.MISSING_TEXT, String.valueOf(textNode), "entry.text is required");
        }

        return new Entry(slug, book, chapter, range, textNode.asText().strip());
    }

    /**
     * Unwraps a JSON value for the resolver: integers as numbers, strings as text, absent or
     * null as {@code null}, anything else (fractions, booleans, arrays) as its JSON text.
     */
    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.toString();
    }
}
