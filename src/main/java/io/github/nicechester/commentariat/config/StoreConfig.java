package io.github.nicechester.commentariat.config;

import io.github.nicechester.commentariat.store.EntryStore;
import io.github.nicechester.commentariat.store.InMemoryEntryStore;
import io.github.nicechester.commentariat.store.SqliteEntryStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the entry store.
 *
 * Store selection ({@code commentariat.store.type}):
 * 1. sqlite (default) - durable file, entries cached in memory on startup
 * 2. memory - nothing persisted, for development and tests
 *
 * The SQLite file comes from {@code DATABASE_URL} when it has the {@code sqlite:///path}
 * form, otherwise from {@code DATABASE_PATH}.
 */
@Slf4j
@Configuration
public class StoreConfig {

    static final String SQLITE_URL_PREFIX = "sqlite:///";

    @Value("${commentariat.store.type:sqlite}")
    private String storeType;

    @Value("${commentariat.database.url:}")
    private String databaseUrl;

    @Value("${commentariat.database.path:data/commentariat.db}")
    private String databasePath;

    // Track which store is in use (logged at startup)
    @Getter
    private String loadedFrom;

    @Bean
    public EntryStore entryStore() {
        if ("memory".equalsIgnoreCase(storeType)) {
            log.info("Using in-memory entry store (nothing is persisted)");
            loadedFrom = "memory";
            return new InMemoryEntryStore();
        }

        String path = resolveDatabasePath(databaseUrl, databasePath);
        long startTime = System.currentTimeMillis();
        SqliteEntryStore store = new SqliteEntryStore(path);
        loadedFrom = "sqlite:" + path;

        log.info("Opened SQLite entry store {} with {} entries in {}ms",
            path, store.countEntries(), System.currentTimeMillis() - startTime);
        return store;
    }

    /**
     * {@code sqlite:///data/x.db} wins over the plain path; other URL schemes are ignored.
     */
    static String resolveDatabasePath(String databaseUrl, String databasePath) {
        String url = databaseUrl == null ? "" : databaseUrl.trim();
        if (url.startsWith(SQLITE_URL_PREFIX)) {
            return url.substring(SQLITE_URL_PREFIX.length());
        }
        if (!url.isEmpty()) {
            log.warn("Ignoring unsupported DATABASE_URL '{}', using {}", url, databasePath);
        }
        return databasePath;
    }
}
