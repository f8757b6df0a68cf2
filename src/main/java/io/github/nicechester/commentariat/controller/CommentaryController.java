package io.github.nicechester.commentariat.controller;

import io.github.nicechester.commentariat.model.Commentary;
import io.github.nicechester.commentariat.model.PassageResponse;
import io.github.nicechester.commentariat.service.CommentaryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for commentary lookups.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class CommentaryController {

    private final CommentaryService commentaryService;

    /**
     * Health check endpoint.
     *
     * GET /healthz
     */
    @GetMapping("/healthz")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * Canonical books in Scripture order with their accepted aliases.
     *
     * GET /books
     */
    @GetMapping("/books")
    public ResponseEntity<Map<String, Object>> books() {
        return ResponseEntity.ok(Map.of("books", commentaryService.listBooks()));
    }

    /**
     * GET /commentaries
     */
    @GetMapping("/commentaries")
    public ResponseEntity<Map<String, Object>> commentaries() {
        return ResponseEntity.ok(Map.of("commentaries", commentaryService.listCommentaries()));
    }

    /**
     * Commentary metadata by slug or name.
     *
     * GET /commentaries/{slug}
     */
    @GetMapping("/commentaries/{slug}")
    public ResponseEntity<Commentary> commentary(@PathVariable String slug) {
        return ResponseEntity.ok(commentaryService.getCommentary(slug));
    }

    /**
     * All entries of a chapter. The book may be any accepted spelling.
     *
     * GET /commentaries/mhc/jn/3
     */
    @GetMapping("/commentaries/{slug}/{book}/{chapter}")
    public ResponseEntity<PassageResponse> chapter(
            @PathVariable String slug,
            @PathVariable String book,
            @PathVariable int chapter) {

        log.info("Chapter lookup: {} {} {}", slug, book, chapter);
        return ResponseEntity.ok(commentaryService.getChapter(slug, book, chapter));
    }

    /**
     * Entries whose verse range contains the requested verse.
     *
     * GET /commentaries/mhc/rom/8/2
     */
    @GetMapping("/commentaries/{slug}/{book}/{chapter}/{verse}")
    public ResponseEntity<PassageResponse> verse(
            @PathVariable String slug,
            @PathVariable String book,
            @PathVariable int chapter,
            @PathVariable int verse) {

        log.info("Verse lookup: {} {} {}:{}", slug, book, chapter, verse);
        return ResponseEntity.ok(commentaryService.getVerse(slug, book, chapter, verse));
    }
}
