package io.github.nicechester.commentariat.service;

import io.github.nicechester.commentariat.exception.ErrorKind;
import io.github.nicechester.commentariat.exception.ReferenceException;
import io.github.nicechester.commentariat.model.CanonicalBook;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Alias registry for the 66 canonical books.
 *
 * <p>Built once when the class is initialized and never mutated afterwards, so lookups are
 * safe from any thread without locking.
 *
 * <p>Normalization applied to both aliases and input:
 * <ol>
 *   <li>trim and collapse internal whitespace</li>
 *   <li>lower-case</li>
 *   <li>rewrite a leading ordinal token ("I", "First", "1st", ...) to its digit</li>
 *   <li>drop everything that is not a letter or digit</li>
 * </ol>
 * So "I Sam.", "First Samuel", "1samuel" and "1 SAMUEL" all resolve to {@code 1 Samuel}.
 * There is no fuzzy matching: anything not in the table is {@link ErrorKind#UNKNOWN_BOOK}.
 */
public final class CanonTable {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Longest alternatives first; \b keeps "Isaiah" from being read as "I saiah"
    private static final Pattern ORDINAL_PREFIX = Pattern.compile(
        "^(first|second|third|1st|2nd|3rd|iii|ii|i|1|2|3)\\b[\\s.]*");

    private static final Map<String, String> ORDINALS = Map.ofEntries(
        Map.entry("first", "1"), Map.entry("1st", "1"), Map.entry("i", "1"), Map.entry("1", "1"),
        Map.entry("second", "2"), Map.entry("2nd", "2"), Map.entry("ii", "2"), Map.entry("2", "2"),
        Map.entry("third", "3"), Map.entry("3rd", "3"), Map.entry("iii", "3"), Map.entry("3", "3")
    );

    private static final List<CanonicalBook> CANONICAL_ORDER =
        Collections.unmodifiableList(Arrays.asList(CanonicalBook.values()));

    private static final Map<String, CanonicalBook> ALIAS_TO_BOOK = buildAliasMap();

    private CanonTable() {
    }

    /**
     * Resolves any accepted spelling to its canonical book.
     *
     * @throws ReferenceException with {@link ErrorKind#UNKNOWN_BOOK} for blank or unknown input
     */
    public static CanonicalBook canonicalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ReferenceException(ErrorKind.UNKNOWN_BOOK, raw, "Book name is required");
        }
        CanonicalBook book = ALIAS_TO_BOOK.get(normalize(raw));
        if (book == null) {
            throw new ReferenceException(ErrorKind.UNKNOWN_BOOK, raw, "Unknown book: " + raw);
        }
        return book;
    }

    /**
     * All 66 books in canonical Scripture order.
     */
    public static List<CanonicalBook> listCanonicalBooks() {
        return CANONICAL_ORDER;
    }

    static String normalize(String raw) {
        String text = WHITESPACE.matcher(raw.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);

        Matcher ordinal = ORDINAL_PREFIX.matcher(text);
        if (ordinal.find() && ordinal.end() < text.length()) {
            text = ORDINALS.get(ordinal.group(1)) + text.substring(ordinal.end());
        }

        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static Map<String, CanonicalBook> buildAliasMap() {
        Map<String, CanonicalBook> aliases = new HashMap<>();
        for (CanonicalBook book : CanonicalBook.values()) {
            register(aliases, book.displayName(), book);
            for (String alias : book.aliases()) {
                register(aliases, alias, book);
            }
        }
        return Map.copyOf(aliases);
    }

    private static void register(Map<String, CanonicalBook> aliases, String alias, CanonicalBook book) {
        String key = normalize(alias);
        CanonicalBook previous = aliases.putIfAbsent(key, book);
        if (previous != null && previous != book) {
            throw new IllegalStateException(
                "Alias '" + alias + "' claimed by both " + previous.displayName() + " and " + book.displayName());
        }
    }
}
