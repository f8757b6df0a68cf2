package io.github.nicechester.commentariat.controller;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.github.nicechester.commentariat.exception.GlobalExceptionHandler;
import io.github.nicechester.commentariat.model.CanonicalBook;
import io.github.nicechester.commentariat.model.Commentary;
import io.github.nicechester.commentariat.model.Entry;
import io.github.nicechester.commentariat.model.VerseRange;
import io.github.nicechester.commentariat.service.CommentaryService;
import io.github.nicechester.commentariat.service.ReferenceResolver;
import io.github.nicechester.commentariat.store.InMemoryEntryStore;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class CommentaryControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        InMemoryEntryStore store = new InMemoryEntryStore();
        Commentary commentary = Commentary.builder()
            .slug("test-comm")
            .name("Test Commentary")
            .description("A test")
            .source("test")
            .license("PD")
            .language("en")
            .build();
        store.bulkLoad(commentary, List.of(
            new Entry("test-comm", CanonicalBook.GENESIS, 1, new VerseRange(1, 1), "In the beginning."),
            new Entry("test-comm", CanonicalBook.GENESIS, 1, new VerseRange(2, 3), "Formless and void."),
            new Entry("test-comm", CanonicalBook.JOHN, 3, new VerseRange(16, 16), "For God so loved.")
        ), false);

        CommentaryService service = new CommentaryService(store, new ReferenceResolver());
        mockMvc = MockMvcBuilders.standaloneSetup(new CommentaryController(service))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void healthz() throws Exception {
        mockMvc.perform(get("/healthz"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void listsBooks() throws Exception {
        mockMvc.perform(get("/books"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.books.length()").value(66))
            .andExpect(jsonPath("$.books[0].canonical").value("Genesis"))
            .andExpect(jsonPath("$.books[0].testament").value("OLD"))
            .andExpect(jsonPath("$.books[0].position").value(1))
            .andExpect(jsonPath("$.books[42].canonical").value("John"))
            .andExpect(jsonPath("$.books[42].aliases", hasItem("jn")));
    }

    @Test
    void listsCommentaries() throws Exception {
        mockMvc.perform(get("/commentaries"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.commentaries.length()").value(1))
            .andExpect(jsonPath("$.commentaries[0].slug").value("test-comm"))
            .andExpect(jsonPath("$.commentaries[0].name").value("Test Commentary"));
    }

    @Test
    void getsCommentaryBySlugOrName() throws Exception {
        mockMvc.perform(get("/commentaries/test-comm"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.license").value("PD"));
        mockMvc.perform(get("/commentaries/Test Commentary"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.slug").value("test-comm"));
    }

    @Test
    void unknownCommentaryIs404() throws Exception {
        mockMvc.perform(get("/commentaries/nonexistent"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.kind").value("NOT_FOUND"))
            .andExpect(jsonPath("$.detail").value("Commentary not found"));
        mockMvc.perform(get("/commentaries/nonexistent/Genesis/1"))
            .andExpect(status().isNotFound());
    }

    @Test
    void chapterLookupAcceptsAnyBookSpelling() throws Exception {
        mockMvc.perform(get("/commentaries/test-comm/Gen/1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.book").value("Genesis"))
            .andExpect(jsonPath("$.chapter").value(1))
            .andExpect(jsonPath("$.verse").doesNotExist())
            .andExpect(jsonPath("$.count").value(2))
            .andExpect(jsonPath("$.entries[0].verse_start").value(1))
            .andExpect(jsonPath("$.entries[1].verse_start").value(2))
            .andExpect(jsonPath("$.entries[1].verse_end").value(3));
    }

    @Test
    void verseLookupReturnsCoveringEntries() throws Exception {
        mockMvc.perform(get("/commentaries/test-comm/genesis/1/3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.verse").value(3))
            .andExpect(jsonPath("$.count").value(1))
            .andExpect(jsonPath("$.entries[0].text").value("Formless and void."));
        mockMvc.perform(get("/commentaries/test-comm/jn/3/16"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.book").value("John"))
            .andExpect(jsonPath("$.entries[0].text").value("For God so loved."));
    }

    @Test
    void knownBookWithoutEntriesIsEmpty() throws Exception {
        mockMvc.perform(get("/commentaries/test-comm/Exodus/1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(0))
            .andExpect(jsonPath("$.entries").isEmpty());
    }

    @Test
    void unknownBookIs400() throws Exception {
        mockMvc.perform(get("/commentaries/test-comm/NotABook/1"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("UNKNOWN_BOOK"))
            .andExpect(jsonPath("$.detail").value("Unknown book: NotABook"))
            .andExpect(jsonPath("$.path").value("/commentaries/test-comm/NotABook/1"));
    }

    @Test
    void nonPositiveChapterOrVerseIs400() throws Exception {
        mockMvc.perform(get("/commentaries/test-comm/Genesis/0"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("OUT_OF_RANGE"))
            .andExpect(jsonPath("$.detail").value("chapter must be positive"));
        mockMvc.perform(get("/commentaries/test-comm/Genesis/1/-2"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail").value("verse must be positive"));
    }

    @Test
    void nonNumericChapterIs400() throws Exception {
        mockMvc.perform(get("/commentaries/test-comm/Genesis/abc"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("MALFORMED_VERSE_EXPRESSION"))
            .andExpect(jsonPath("$.detail", containsString("chapter")));
    }
}
