package io.github.nicechester.commentariat.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.nicechester.commentariat.exception.CommentariatException;
import io.github.nicechester.commentariat.model.IngestionError;
import io.github.nicechester.commentariat.model.IngestionReport;
import io.github.nicechester.commentariat.service.EntryBatchProcessor;
import io.github.nicechester.commentariat.service.IngestionService;
import io.github.nicechester.commentariat.service.ManifestReader;
import io.github.nicechester.commentariat.service.ReferenceResolver;
import io.github.nicechester.commentariat.store.EntryStoreException;
import io.github.nicechester.commentariat.store.SqliteEntryStore;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Standalone tool to create the commentary database and ingest manifests into it, without
 * starting the web server.
 *
 * <p>Usage:
 * <pre>
 * mvn exec:java -Dexec.mainClass="io.github.nicechester.commentariat.tool.CommentaryIngestTool" \
 *     -Dexec.args="ingest-json data/mhc/manifest.json --replace"
 * </pre>
 *
 * <p>The database path is taken from {@code --db <path>}, then the {@code DATABASE_PATH}
 * environment variable, then {@value #DEFAULT_DB_PATH}.
 */
public class CommentaryIngestTool {

    static final String DEFAULT_DB_PATH = "data/commentariat.db";
    private static final int MAX_ERRORS_SHOWN = 20;

    private final PrintStream out;
    private final PrintStream err;

    public CommentaryIngestTool(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new CommentaryIngestTool(System.out, System.err).run(args);
        System.exit(exitCode);
    }

    public int run(String[] args) {
        String dbPath = null;
        boolean replace = false;
        List<String> positional = new ArrayList<>();

        // Parse arguments
        for (int i = 0; i < args.length; i++) {
            if ("--db".equals(args[i]) && i + 1 < args.length) {
                dbPath = args[++i];
            } else if ("--replace".equals(args[i])) {
                replace = true;
            } else if ("--help".equals(args[i])) {
                printHelp();
                return 0;
            } else {
                positional.add(args[i]);
            }
        }

        if (positional.isEmpty()) {
            printHelp();
            return 2;
        }
        if (dbPath == null) {
            String env = System.getenv("DATABASE_PATH");
            dbPath = env != null && !env.isBlank() ? env : DEFAULT_DB_PATH;
        }

        String command = positional.get(0);
        switch (command) {
            case "init-db":
                return initDb(dbPath);
            case "ingest-json":
                if (positional.size() != 2) {
                    err.println("ingest-json needs exactly one manifest path");
                    return 2;
                }
                return ingestJson(dbPath, Path.of(positional.get(1)), replace);
            default:
                err.println("Unknown command: " + command);
                printHelp();
                return 2;
        }
    }

    private void printHelp() {
        out.println("Usage: CommentaryIngestTool [--db <path>] <command>");
        out.println();
        out.println("Commands:");
        out.println("  init-db                        Create the database schema");
        out.println("  ingest-json <manifest> [--replace]");
        out.println("                                 Ingest a commentary from a JSON manifest");
        out.println("                                 (inline entries or an NDJSON entries_file)");
        out.println();
        out.println("Options:");
        out.println("  --db <path>   SQLite database file");
        out.println("                Default: $DATABASE_PATH or " + DEFAULT_DB_PATH);
        out.println("  --replace     Delete existing entries for this commentary before import");
        out.println("  --help        Show this help message");
    }

    private int initDb(String dbPath) {
        try (SqliteEntryStore store = new SqliteEntryStore(dbPath)) {
            out.println("Database initialized: " + dbPath + " (" + store.countEntries() + " entries)");
            return 0;
        } catch (EntryStoreException e) {
            err.println("Failed to initialize database: " + e.getMessage());
            return 1;
        }
    }

    private int ingestJson(String dbPath, Path manifest, boolean replace) {
        ObjectMapper mapper = new ObjectMapper();

        try (SqliteEntryStore store = new SqliteEntryStore(dbPath)) {
            IngestionService ingestionService = new IngestionService(
                new ManifestReader(mapper),
                new EntryBatchProcessor(new ReferenceResolver()),
                store);

            IngestionReport report = ingestionService.ingest(manifest, replace);
            printReport(report);
            return 0;

        } catch (CommentariatException | EntryStoreException e) {
            err.println("Ingest failed: " + e.getMessage());
            return 1;
        }
    }

    private void printReport(IngestionReport report) {
        out.println("Inserted " + report.getInserted() + " entries");
        if (report.getSkipped() == 0) {
            return;
        }

        out.println("Skipped " + report.getSkipped() + " records:");
        List<IngestionError> errors = report.getErrors();
        for (int i = 0; i < Math.min(errors.size(), MAX_ERRORS_SHOWN); i++) {
            IngestionError error = errors.get(i);
            out.printf("  %s [%s] %s%n", error.location(), error.kind(), error.reason());
        }
        if (errors.size() > MAX_ERRORS_SHOWN) {
            out.println("  ... and " + (errors.size() - MAX_ERRORS_SHOWN) + " more");
        }
    }
}
