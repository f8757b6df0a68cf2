package io.github.nicechester.commentariat.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.nicechester.commentariat.exception.ErrorKind;
import io.github.nicechester.commentariat.exception.ReferenceException;
import io.github.nicechester.commentariat.model.CanonicalBook;
import io.github.nicechester.commentariat.model.Testament;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class CanonTableTest {

    @Test
    void everyDisplayNameAndAliasResolvesToItsBook() {
        for (CanonicalBook book : CanonicalBook.values()) {
            assertThat(CanonTable.canonicalize(book.displayName())).isEqualTo(book);
            for (String alias : book.aliases()) {
                assertThat(CanonTable.canonicalize(alias)).as(alias).isEqualTo(book);
            }
        }
    }

    @Test
    void aliasSetsAreDisjointAfterNormalization() {
        Set<String> seen = new HashSet<>();
        for (CanonicalBook book : CanonicalBook.values()) {
            Set<String> own = new HashSet<>();
            own.add(CanonTable.normalize(book.displayName()));
            book.aliases().forEach(alias -> own.add(CanonTable.normalize(alias)));
            for (String key : own) {
                assertThat(seen.add(key)).as("alias %s of %s", key, book).isTrue();
            }
        }
    }

    @ParameterizedTest
    @CsvSource({
        "Gen, Genesis",
        "GEN, Genesis",
        "gn, Genesis",
        "Jn, John",
        "jhn, John",
        "rev, Revelation",
        "1cor, 1 Corinthians",
        "1 cor, 1 Corinthians",
        "I Corinthians, 1 Corinthians",
        "First Corinthians, 1 Corinthians",
        "1st Corinthians, 1 Corinthians",
        "firstcorinthians, 1 Corinthians",
        "II Kings, 2 Kings",
        "Second Kings, 2 Kings",
        "2nd kgs, 2 Kings",
        "III John, 3 John",
        "Third John, 3 John",
        "I Sam., 1 Samuel",
        "'  song   of  solomon ', Song of Solomon",
        "Song of Songs, Song of Solomon",
        "Isaiah, Isaiah",
        "Is, Isaiah",
        "ps, Psalms",
        "Phil, Philippians",
        "Phlm, Philemon"
    })
    void resolvesSpellingVariants(String raw, String expected) {
        assertThat(CanonTable.canonicalize(raw).displayName()).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"NotABook", "Genesys", "I", "First", "4 John", "Maccabees", "Jn3"})
    void unknownSpellingsFailWithoutGuessing(String raw) {
        assertThatThrownBy(() -> CanonTable.canonicalize(raw))
            .isInstanceOf(ReferenceException.class)
            .hasMessageContaining("Unknown book")
            .extracting(e -> ((ReferenceException) e).getKind())
            .isEqualTo(ErrorKind.UNKNOWN_BOOK);
    }

    @Test
    void blankBookNameIsRequired() {
        assertThatThrownBy(() -> CanonTable.canonicalize("  "))
            .isInstanceOf(ReferenceException.class)
            .hasMessage("Book name is required");
        assertThatThrownBy(() -> CanonTable.canonicalize(null))
            .isInstanceOf(ReferenceException.class)
            .hasMessage("Book name is required");
    }

    @Test
    void listsSixtySixBooksInCanonicalOrder() {
        List<CanonicalBook> books = CanonTable.listCanonicalBooks();

        assertThat(books).hasSize(66);
        assertThat(books.get(0)).isEqualTo(CanonicalBook.GENESIS);
        assertThat(books.get(38)).isEqualTo(CanonicalBook.MALACHI);
        assertThat(books.get(39)).isEqualTo(CanonicalBook.MATTHEW);
        assertThat(books.get(65)).isEqualTo(CanonicalBook.REVELATION);
        assertThat(books).filteredOn(b -> b.testament() == Testament.OLD).hasSize(39);
        assertThat(CanonicalBook.REVELATION.position()).isEqualTo(66);
    }

    @Test
    void normalizationCollapsesOrdinalsAndPunctuation() {
        assertThat(CanonTable.normalize("First  Samuel")).isEqualTo("1samuel");
        assertThat(CanonTable.normalize("II. Tim")).isEqualTo("2tim");
        assertThat(CanonTable.normalize("Isaiah")).isEqualTo("isaiah");
    }
}
