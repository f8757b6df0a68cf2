package io.github.nicechester.commentariat.config;

import io.github.nicechester.commentariat.exception.CommentariatException;
import io.github.nicechester.commentariat.model.IngestionReport;
import io.github.nicechester.commentariat.service.IngestionService;
import io.github.nicechester.commentariat.store.EntryStore;
import io.github.nicechester.commentariat.store.EntryStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Ingests the manifests listed in {@code commentariat.ingest.seed-manifests} when the
 * application starts with an empty store. A manifest that fails is logged and skipped; the
 * server still starts.
 */
@Slf4j
@Component
public class SeedIngestionRunner implements ApplicationRunner {

    private final IngestionService ingestionService;
    private final EntryStore entryStore;
    private final List<Path> seedManifests;
    private final boolean replace;

    public SeedIngestionRunner(
            IngestionService ingestionService,
            EntryStore entryStore,
            @Value("${commentariat.ingest.seed-manifests:}") String seedManifests,
            @Value("${commentariat.ingest.replace-on-seed:false}") boolean replace) {

        this.ingestionService = ingestionService;
        this.entryStore = entryStore;
        this.seedManifests = parseManifestList(seedManifests);
        this.replace = replace;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (seedManifests.isEmpty()) {
            return;
        }

        long entryCount = entryStore.countEntries();
        log.info("Current entry count: {}", entryCount);
        if (entryCount > 0) {
            log.info("Store has entries, skipping seed ingestion");
            return;
        }

        log.info("No entries found - ingesting {} seed manifests", seedManifests.size());
        for (Path manifest : seedManifests) {
            if (!Files.exists(manifest)) {
                log.warn("Seed manifest not found: {}", manifest);
                continue;
            }
            try {
                IngestionReport report = ingestionService.ingest(manifest, replace);
                log.info("Ingested {}: {} entries ({} skipped)", report.getSlug(), report.getInserted(),
                    report.getSkipped());
            } catch (CommentariatException | EntryStoreException e) {
                log.error("Failed to ingest {}: {}", manifest, e.getMessage());
            }
        }

        log.info("Seed ingestion complete! Total entries: {}", entryStore.countEntries());
    }

    List<Path> getSeedManifests() {
        return seedManifests;
    }

    static List<Path> parseManifestList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(Path::of)
            .toList();
    }
}
