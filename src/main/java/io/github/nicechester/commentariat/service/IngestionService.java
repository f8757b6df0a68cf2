package io.github.nicechester.commentariat.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.nicechester.commentariat.exception.ErrorKind;
import io.github.nicechester.commentariat.exception.ManifestException;
import io.github.nicechester.commentariat.model.Commentary;
import io.github.nicechester.commentariat.model.IngestionReport;
import io.github.nicechester.commentariat.model.Manifest;
import io.github.nicechester.commentariat.service.EntryBatchProcessor.BatchResult;
import io.github.nicechester.commentariat.store.EntryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Loads a commentary manifest into the entry store.
 *
 * <p>Fails fast on the manifest itself (metadata, entries source, slug conflict) and fails
 * soft on individual records: bad records are listed in the report and the valid ones are
 * still stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    private final ManifestReader manifestReader;
    private final EntryBatchProcessor batchProcessor;
    private final EntryStore entryStore;

    public IngestionReport ingest(Path manifestPath, boolean replace) {
        log.info("Starting ingestion from {} (replace={})", manifestPath, replace);
        return ingest(manifestReader.read(manifestPath), replace);
    }

    public IngestionReport ingest(JsonNode manifest, Path baseDir, boolean replace) {
        return ingest(manifestReader.fromJson(manifest, baseDir), replace);
    }

    public IngestionReport ingest(Manifest manifest, boolean replace) {
        long startTime = System.currentTimeMillis();
        Commentary commentary = manifest.commentary();

        if (!replace && entryStore.hasCommentary(commentary.slug())) {
            throw new ManifestException(ErrorKind.DUPLICATE_COMMENTARY,
                "Commentary already exists: " + commentary.slug() + " (use replace)");
        }

        BatchResult batch = batchProcessor.process(commentary.slug(), manifest.entries());
        if (!batch.rejected().isEmpty()) {
            log.warn("Skipping {} of {} records of {}", batch.rejected().size(), batch.total(), commentary.slug());
        }

        int inserted = entryStore.bulkLoad(commentary, batch.accepted(), replace);

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("Ingestion complete: {} entries inserted, {} skipped for {} in {}ms",
            inserted, batch.rejected().size(), commentary.slug(), elapsed);

        return IngestionReport.builder()
            .slug(commentary.slug())
            .inserted(inserted)
            .skipped(batch.rejected().size())
            .replaced(replace)
            .errors(batch.rejected())
            .elapsedMs(elapsed)
            .build();
    }
}
