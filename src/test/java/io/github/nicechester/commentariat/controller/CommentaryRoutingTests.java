package io.github.nicechester.commentariat.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = "commentariat.store.type=memory")
@AutoConfigureMockMvc
class CommentaryRoutingTests {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void unknownRouteIs404() throws Exception {
        mockMvc.perform(get("/no/such/route/at/all/x"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.status").value(404))
            .andExpect(jsonPath("$.path").value("/no/such/route/at/all/x"));
    }

    @Test
    void wrongMethodIs405() throws Exception {
        mockMvc.perform(post("/books"))
            .andExpect(status().isMethodNotAllowed())
            .andExpect(jsonPath("$.status").value(405))
            .andExpect(jsonPath("$.error").value("Method Not Allowed"));
    }

    @Test
    void unknownCommentaryIs404WithKind() throws Exception {
        mockMvc.perform(get("/commentaries/nonexistent"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }

    @Test
    void knownRouteStillServes() throws Exception {
        mockMvc.perform(get("/healthz"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }
}
