package io.github.nicechester.commentariat.service;

import io.github.nicechester.commentariat.exception.ErrorKind;
import io.github.nicechester.commentariat.exception.ReferenceException;
import io.github.nicechester.commentariat.model.CanonicalBook;
import io.github.nicechester.commentariat.model.VerseRange;
import io.github.nicechester.commentariat.model.VerseSpec;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Stateless parser for scripture references: book names, chapters and verse ranges.
 *
 * <p>Verse anchors are read in this order of precedence:
 * <ol>
 *   <li>explicit {@code verse_start} / {@code verse_end} ({@code verse_end} defaults to the start)</li>
 *   <li>a {@code verse} string of the form {@code "<int>-<int>"}</li>
 *   <li>a single {@code verse} integer or numeric string</li>
 * </ol>
 * Nothing is clamped or truncated: every failure is a {@link ReferenceException}.
 */
@Service
public class ReferenceResolver {

    // numeric strings are bare digits in every form; "+3" and "-3" are malformed
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    public CanonicalBook resolveBook(String raw) {
        return CanonTable.canonicalize(raw);
    }

    public int resolveChapter(Object raw) {
        if (raw == null) {
            throw new ReferenceException(ErrorKind.MISSING_CHAPTER, null, "Missing chapter");
        }
        return parsePositive(raw, "chapter");
    }

    public VerseRange resolveRange(VerseSpec spec) {
        if (spec.hasExplicitBounds()) {
            if (spec.verseStart() == null) {
                throw new ReferenceException(ErrorKind.MISSING_VERSE, String.valueOf(spec.verseEnd()),
                    "verse_end given without verse_start");
            }
            int start = parsePositive(spec.verseStart(), "verse_start");
            int end = spec.verseEnd() == null ? start : parsePositive(spec.verseEnd(), "verse_end");
            return new VerseRange(start, end);
        }

        Object verse = spec.verse();
        if (verse == null) {
            throw new ReferenceException(ErrorKind.MISSING_VERSE, null, "Missing verse or verse_start/verse_end");
        }
        if (verse instanceof String text && text.contains("-")) {
            return parseRangeExpression(text);
        }
        return VerseRange.single(parsePositive(verse, "verse"));
    }

    /**
     * Validates a chapter or verse number that already arrived as an integer (path variables).
     */
    public int requirePositive(int value, String label) {
        if (value <= 0) {
            throw new ReferenceException(ErrorKind.OUT_OF_RANGE, Integer.toString(value), label + " must be positive");
        }
        return value;
    }

    private VerseRange parseRangeExpression(String text) {
        int dash = text.indexOf('-');
        String startText = text.substring(0, dash).trim();
        String endText = text.substring(dash + 1).trim();
        if (!isUnsignedInteger(startText) || !isUnsignedInteger(endText)) {
            throw new ReferenceException(ErrorKind.MALFORMED_VERSE_EXPRESSION, text, "Invalid verse: " + text);
        }
        return new VerseRange(parsePositive(startText, "verse"), parsePositive(endText, "verse"));
    }

    private int parsePositive(Object raw, String label) {
        long value;
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            value = ((Number) raw).longValue();
        } else if (raw instanceof BigInteger big) {
            value = big.bitLength() < 63 ? big.longValue() : Long.MAX_VALUE;
        } else if (raw instanceof String text && isUnsignedInteger(text.trim())) {
            value = parseLongSaturated(text.trim());
        } else {
            // fractions, booleans and non-numeric text are never rounded or guessed
            throw new ReferenceException(ErrorKind.MALFORMED_VERSE_EXPRESSION, String.valueOf(raw),
                "Invalid " + label + ": " + raw);
        }

        if (value <= 0) {
            throw new ReferenceException(ErrorKind.OUT_OF_RANGE, String.valueOf(raw), label + " must be positive");
        }
        if (value > Integer.MAX_VALUE) {
            throw new ReferenceException(ErrorKind.OUT_OF_RANGE, String.valueOf(raw), label + " is too large: " + raw);
        }
        return (int) value;
    }

    private static long parseLongSaturated(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }

    private static boolean isUnsignedInteger(String text) {
        return DIGITS.matcher(text).matches();
    }
}
