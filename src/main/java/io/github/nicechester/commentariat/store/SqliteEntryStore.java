package io.github.nicechester.commentariat.store;

import io.github.nicechester.commentariat.exception.ErrorKind;
import io.github.nicechester.commentariat.exception.ManifestException;
import io.github.nicechester.commentariat.exception.ReferenceException;
import io.github.nicechester.commentariat.model.CanonicalBook;
import io.github.nicechester.commentariat.model.Commentary;
import io.github.nicechester.commentariat.model.Entry;
import io.github.nicechester.commentariat.model.VerseRange;
import io.github.nicechester.commentariat.service.CanonTable;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.*;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite-backed entry store.
 *
 * <p>The database file is the durable copy; queries are answered from an in-memory
 * {@link InMemoryEntryStore} that is loaded once on open and updated after every committed
 * load. A load runs the metadata upsert, the delete of the previous entries and the insert
 * of the new ones in one transaction, so a failed insert leaves the old data in place.
 *
 * <p>Schema:
 * <ul>
 *   <li>{@code commentaries(id, slug UNIQUE, name, description, source, license, language)}</li>
 *   <li>{@code entries(id, commentary_id, book, chapter, verse_start, verse_end, text)},
 *       indexed on {@code (commentary_id, book, chapter, verse_start, verse_end)}</li>
 * </ul>
 */
@Slf4j
public class SqliteEntryStore implements EntryStore {

    private static final String CREATE_COMMENTARIES_SQL = """
        CREATE TABLE IF NOT EXISTS commentaries (
            id INTEGER PRIMARY KEY,
            slug TEXT NOT NULL UNIQUE,
            name TEXT NOT NULL,
            description TEXT,
            source TEXT,
            license TEXT,
            language TEXT
        )
        """;

    private static final String CREATE_ENTRIES_SQL = """
        CREATE TABLE IF NOT EXISTS entries (
            id INTEGER PRIMARY KEY,
            commentary_id INTEGER NOT NULL,
            book TEXT NOT NULL,
            chapter INTEGER NOT NULL,
            verse_start INTEGER NOT NULL,
            verse_end INTEGER NOT NULL,
            text TEXT NOT NULL,
            FOREIGN KEY (commentary_id) REFERENCES commentaries (id) ON DELETE CASCADE
        )
        """;

    private static final String CREATE_INDEX_SQL = """
        CREATE INDEX IF NOT EXISTS idx_entries_lookup
            ON entries(commentary_id, book, chapter, verse_start, verse_end)
        """;

    private static final String SELECT_COMMENTARY_ID_SQL = """
        SELECT id FROM commentaries WHERE slug = ?
        """;

    private static final String INSERT_COMMENTARY_SQL = """
        INSERT INTO commentaries (slug, name, description, source, license, language)
        VALUES (?, ?, ?, ?, ?, ?)
        """;

    private static final String UPDATE_COMMENTARY_SQL = """
        UPDATE commentaries
        SET name = ?, description = ?, source = ?, license = ?, language = ?
        WHERE id = ?
        """;

    private static final String DELETE_ENTRIES_SQL = """
        DELETE FROM entries WHERE commentary_id = ?
        """;

    private static final String INSERT_ENTRY_SQL = """
        INSERT INTO entries (commentary_id, book, chapter, verse_start, verse_end, text)
        VALUES (?, ?, ?, ?, ?, ?)
        """;

    private static final String SELECT_COMMENTARIES_SQL = """
        SELECT id, slug, name, description, source, license, language FROM commentaries
        """;

    private static final String SELECT_ENTRIES_SQL = """
        SELECT book, chapter, verse_start, verse_end, text
        FROM entries
        WHERE commentary_id = ?
        ORDER BY book, chapter, verse_start, verse_end
        """;

    private static final int BATCH_SIZE = 1000;

    private final String dbPath;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final InMemoryEntryStore cache = new InMemoryEntryStore();
    private Connection connection;

    /**
     * Opens (creating if needed) the database file and loads its contents into memory.
     *
     * @param dbPath Path to the SQLite database file
     */
    public SqliteEntryStore(String dbPath) {
        this.dbPath = dbPath;
        initializeDatabase();
        loadCache();
    }

    private void initializeDatabase() {
        try {
            Path parent = Path.of(dbPath).toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath + "?busy_timeout=30000");

            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
            }
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA foreign_keys=ON");
            }
            try (Statement stmt = connection.createStatement()) {
                stmt.execute(CREATE_COMMENTARIES_SQL);
            }
            try (Statement stmt = connection.createStatement()) {
                stmt.execute(CREATE_ENTRIES_SQL);
            }
            try (Statement stmt = connection.createStatement()) {
                stmt.execute(CREATE_INDEX_SQL);
            }

            log.info("SQLite entry store initialized: {}", dbPath);
        } catch (SQLException | IOException e) {
            throw new EntryStoreException("Failed to initialize SQLite database: " + dbPath, e);
        }
    }

    private void loadCache() {
        long startTime = System.currentTimeMillis();
        long loaded = 0;

        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(SELECT_COMMENTARIES_SQL)) {

            while (rs.next()) {
                long id = rs.getLong("id");
                Commentary commentary = Commentary.builder()
                    .slug(rs.getString("slug"))
                    .name(rs.getString("name"))
                    .description(rs.getString("description"))
                    .source(rs.getString("source"))
                    .license(rs.getString("license"))
                    .language(rs.getString("language"))
                    .build();

                List<Entry> entries = readEntries(id, commentary.slug());
                cache.bulkLoad(commentary, entries, true);
                loaded += entries.size();
            }

        } catch (SQLException e) {
            throw new EntryStoreException("Failed to load entries from SQLite", e);
        }

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("Loaded {} entries of {} commentaries into cache in {}ms",
            loaded, cache.listCommentaries().size(), elapsed);
    }

    private List<Entry> readEntries(long commentaryId, String slug) throws SQLException {
        List<Entry> entries = new ArrayList<>();
        try (PreparedStatement pstmt = connection.prepareStatement(SELECT_ENTRIES_SQL)) {
            pstmt.setLong(1, commentaryId);
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    String bookName = rs.getString("book");
                    try {
                        CanonicalBook book = CanonTable.canonicalize(bookName);
                        VerseRange range = new VerseRange(rs.getInt("verse_start"), rs.getInt("verse_end"));
                        entries.add(new Entry(slug, book, rs.getInt("chapter"), range, rs.getString("text")));
                    } catch (ReferenceException e) {
                        log.warn("Skipping stored entry of {} with bad reference {} {}: {}",
                            slug, bookName, rs.getInt("chapter"), e.getMessage());
                    }
                }
            }
        }
        return entries;
    }

    @Override
    public int bulkLoad(Commentary commentary, List<Entry> entries, boolean replace) {
        writeLock.lock();
        try {
            if (!replace && cache.hasCommentary(commentary.slug())) {
                throw new ManifestException(ErrorKind.DUPLICATE_COMMENTARY,
                    "Commentary already exists: " + commentary.slug() + " (use replace)");
            }

            int inserted = writeTransaction(commentary, entries);
            cache.bulkLoad(commentary, entries, true);
            return inserted;
        } finally {
            writeLock.unlock();
        }
    }

    private int writeTransaction(Commentary commentary, List<Entry> entries) {
        try {
            connection.setAutoCommit(false);

            long commentaryId = upsertCommentary(commentary);
            try (PreparedStatement delete = connection.prepareStatement(DELETE_ENTRIES_SQL)) {
                delete.setLong(1, commentaryId);
                int removed = delete.executeUpdate();
                if (removed > 0) {
                    log.info("Removed {} previous entries of {}", removed, commentary.slug());
                }
            }

            int inserted = 0;
            try (PreparedStatement insert = connection.prepareStatement(INSERT_ENTRY_SQL)) {
                for (Entry entry : entries) {
                    insert.setLong(1, commentaryId);
                    insert.setString(2, entry.book().displayName());
                    insert.setInt(3, entry.chapter());
                    insert.setInt(4, entry.verseStart());
                    insert.setInt(5, entry.verseEnd());
                    insert.setString(6, entry.text());
                    insert.addBatch();

                    if (++inserted % BATCH_SIZE == 0) {
                        insert.executeBatch();
                    }
                }
                insert.executeBatch();
            }

            connection.commit();
            connection.setAutoCommit(true);

            log.debug("Stored {} entries for {}", inserted, commentary.slug());
            return inserted;

        } catch (SQLException e) {
            rollback();
            throw new EntryStoreException("Failed to store entries for " + commentary.slug(), e);
        } catch (RuntimeException e) {
            rollback();
            throw e;
        }
    }

    private void rollback() {
        try {
            connection.rollback();
            // autocommit is restored only after the rollback, enabling it commits pending work
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            log.error("Failed to rollback transaction", e);
        }
    }

    private long upsertCommentary(Commentary commentary) throws SQLException {
        try (PreparedStatement select = connection.prepareStatement(SELECT_COMMENTARY_ID_SQL)) {
            select.setString(1, commentary.slug());
            try (ResultSet rs = select.executeQuery()) {
                if (rs.next()) {
                    long id = rs.getLong(1);
                    try (PreparedStatement update = connection.prepareStatement(UPDATE_COMMENTARY_SQL)) {
                        update.setString(1, commentary.name());
                        update.setString(2, commentary.description());
                        update.setString(3, commentary.source());
                        update.setString(4, commentary.license());
                        update.setString(5, commentary.language());
                        update.setLong(6, id);
                        update.executeUpdate();
                    }
                    log.info("Updated existing commentary: {} (id={})", commentary.slug(), id);
                    return id;
                }
            }
        }

        try (PreparedStatement insert = connection.prepareStatement(INSERT_COMMENTARY_SQL,
                Statement.RETURN_GENERATED_KEYS)) {
            insert.setString(1, commentary.slug());
            insert.setString(2, commentary.name());
            insert.setString(3, commentary.description());
            insert.setString(4, commentary.source());
            insert.setString(5, commentary.license());
            insert.setString(6, commentary.language());
            insert.executeUpdate();

            try (ResultSet keys = insert.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for commentary " + commentary.slug());
                }
                long id = keys.getLong(1);
                log.info("Created new commentary: {} (id={})", commentary.slug(), id);
                return id;
            }
        }
    }

    @Override
    public List<Entry> queryChapter(String slug, CanonicalBook book, int chapter) {
        return cache.queryChapter(slug, book, chapter);
    }

    @Override
    public List<Entry> queryVerse(String slug, CanonicalBook book, int chapter, int verse) {
        return cache.queryVerse(slug, book, chapter, verse);
    }

    @Override
    public List<Commentary> listCommentaries() {
        return cache.listCommentaries();
    }

    @Override
    public Optional<Commentary> getCommentary(String slugOrName) {
        return cache.getCommentary(slugOrName);
    }

    @Override
    public boolean hasCommentary(String slug) {
        return cache.hasCommentary(slug);
    }

    @Override
    public long countEntries() {
        return cache.countEntries();
    }

    @Override
    public long countEntries(String slug) {
        return cache.countEntries(slug);
    }

    public String getDbPath() {
        return dbPath;
    }

    /**
     * Closes the database connection.
     */
    @Override
    public void close() {
        try {
            if (connection != null && !connection.isClosed()) {
                connection.close();
                log.info("SQLite connection closed");
            }
        } catch (SQLException e) {
            log.error("Failed to close SQLite connection", e);
        }
    }
}
