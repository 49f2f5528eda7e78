package de.htwsaar.mediavault.core.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.SQLDialect;
import org.jooq.Table;
import org.jooq.conf.Settings;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

/**
 * SQLite-Implementierung des {@link DedupIndex} (jOOQ-DSL, ohne Codegenerierung).
 *
 * <p>Zwei Verbindungen auf dieselbe Datei: eine Schreibverbindung, deren Transaktionen über einen
 * Lock serialisiert werden, und eine Leseverbindung. Im WAL-Modus sehen Leser immer einen
 * konsistenten, committeten Stand, auch während geschrieben wird.</p>
 *
 * <p>Pfade werden absolut und normalisiert gespeichert.</p>
 */
public final class SqliteDedupIndex implements DedupIndex {

    private static final Logger log = LoggerFactory.getLogger(SqliteDedupIndex.class);

    static {
        System.setProperty("org.jooq.no-logo", "true");
        System.setProperty("org.jooq.no-tips", "true");
    }

    private static final Table<Record> URL_RECORDS = DSL.table(DSL.name("url_records"));
    private static final Table<Record> ETAG_RECORDS = DSL.table(DSL.name("etag_records"));
    private static final Table<Record> FINGERPRINT_RECORDS = DSL.table(DSL.name("fingerprint_records"));
    private static final Table<Record> PATH_RECORDS = DSL.table(DSL.name("path_records"));
    private static final Table<Record> FAILED_URLS = DSL.table(DSL.name("failed_urls"));

    private static final Field<String> URL = DSL.field(DSL.name("url"), String.class);
    private static final Field<String> ETAG = DSL.field(DSL.name("etag"), String.class);
    private static final Field<String> FINGERPRINT = DSL.field(DSL.name("fingerprint"), String.class);
    private static final Field<String> HASH = DSL.field(DSL.name("hash"), String.class);
    private static final Field<String> PATH = DSL.field(DSL.name("path"), String.class);
    private static final Field<String> REASON = DSL.field(DSL.name("reason"), String.class);
    private static final Field<Long> FAILED_AT = DSL.field(DSL.name("failed_at"), Long.class);
    private static final Field<Integer> ATTEMPTS = DSL.field(DSL.name("attempts"), Integer.class);

    private final Path location;
    private final Connection writeConnection;
    private final Connection readConnection;
    private final DSLContext writer;
    private final DSLContext reader;
    private final Clock clock;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final Object readMonitor = new Object();
    private volatile boolean closed;

    private SqliteDedupIndex(Path location, Connection writeConnection, Connection readConnection, Clock clock) {
        this.location = location;
        this.writeConnection = writeConnection;
        this.readConnection = readConnection;
        Settings settings = new Settings().withExecuteLogging(false);
        this.writer = DSL.using(writeConnection, SQLDialect.SQLITE, settings);
        this.reader = DSL.using(readConnection, SQLDialect.SQLITE, settings);
        this.clock = clock;
    }

    /**
     * Öffnet (oder erzeugt) den Index an der angegebenen Stelle.
     *
     * @param dbFile SQLite-Datei; Elternverzeichnisse werden angelegt
     * @return geöffneter Index
     * @throws IndexAccessException wenn die Datei nicht geöffnet oder initialisiert werden kann
     */
    public static SqliteDedupIndex open(Path dbFile) {
        return open(dbFile, Clock.systemUTC());
    }

    public static SqliteDedupIndex open(Path dbFile, Clock clock) {
        Objects.requireNonNull(dbFile, "dbFile must not be null");
        Objects.requireNonNull(clock, "clock must not be null");

        Path absolute = dbFile.toAbsolutePath().normalize();
        String jdbcUrl = "jdbc:sqlite:" + absolute;
        Connection w = null;
        try {
            Path parent = absolute.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            w = connect(jdbcUrl);
            // Schema zuerst über die Schreibverbindung anlegen, erst danach den Leser öffnen
            initializeSchema(DSL.using(w, SQLDialect.SQLITE));
            Connection r = connect(jdbcUrl);
            log.debug("Opened index at {}", absolute);
            return new SqliteDedupIndex(absolute, w, r, clock);
        } catch (IOException | SQLException | DataAccessException e) {
            closeQuietly(w);
            throw new IndexAccessException("cannot open index at " + absolute + ": " + e.getMessage(), e);
        }
    }

    public Path location() {
        return location;
    }

    private static Connection connect(String jdbcUrl) throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.FULL);
        config.setTempStore(SQLiteConfig.TempStore.MEMORY);
        config.setBusyTimeout(5_000);
        return config.createConnection(jdbcUrl);
    }

    private static void initializeSchema(DSLContext dsl) {
        // WAL nach wenigen Seiten automatisch zurückschreiben, damit die -wal-Datei klein bleibt
        dsl.fetch("PRAGMA wal_autocheckpoint = 200");
        dsl.execute("""
                    CREATE TABLE IF NOT EXISTS url_records (
                        url TEXT PRIMARY KEY,
                        hash TEXT NOT NULL
                    )
                """);
        dsl.execute("""
                    CREATE TABLE IF NOT EXISTS etag_records (
                        etag TEXT PRIMARY KEY,
                        hash TEXT NOT NULL
                    )
                """);
        dsl.execute("""
                    CREATE TABLE IF NOT EXISTS fingerprint_records (
                        fingerprint TEXT PRIMARY KEY,
                        hash TEXT NOT NULL
                    )
                """);
        dsl.execute("""
                    CREATE TABLE IF NOT EXISTS path_records (
                        hash TEXT NOT NULL,
                        path TEXT NOT NULL,
                        PRIMARY KEY (hash, path)
                    )
                """);
        dsl.execute("CREATE INDEX IF NOT EXISTS idx_path_records_hash ON path_records(hash)");
        dsl.execute("""
                    CREATE TABLE IF NOT EXISTS failed_urls (
                        url TEXT PRIMARY KEY,
                        failed_at INTEGER NOT NULL,
                        reason TEXT,
                        attempts INTEGER NOT NULL DEFAULT 1
                    )
                """);
    }

    @Override
    public Optional<String> lookupByUrl(String normalizedUrl) {
        return lookup(URL_RECORDS, URL, normalizedUrl);
    }

    @Override
    public Optional<String> lookupByEtag(String etag) {
        return lookup(ETAG_RECORDS, ETAG, etag);
    }

    @Override
    public Optional<String> lookupByFingerprint(String fingerprint) {
        return lookup(FINGERPRINT_RECORDS, FINGERPRINT, fingerprint);
    }

    private Optional<String> lookup(Table<Record> table, Field<String> key, String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        return read(dsl -> dsl.select(HASH).from(table).where(key.eq(value)).fetchOptional(HASH));
    }

    @Override
    public List<Path> pathsFor(String hash) {
        if (hash == null || hash.isBlank()) return List.of();

        List<String> stored = read(dsl -> dsl.select(PATH)
                .from(PATH_RECORDS)
                .where(HASH.eq(hash))
                .orderBy(PATH)
                .fetch(PATH));

        List<Path> existing = new ArrayList<>();
        List<String> stale = new ArrayList<>();
        for (String p : stored) {
            Path path = Path.of(p);
            if (Files.exists(path)) {
                existing.add(path);
            } else {
                stale.add(p);
            }
        }
        if (!stale.isEmpty()) {
            int pruned = write(dsl -> {
                int n = 0;
                for (String p : stale) {
                    // erneut prüfen: die Datei kann inzwischen wieder angelegt worden sein
                    if (!Files.exists(Path.of(p))) {
                        n += dsl.deleteFrom(PATH_RECORDS)
                                .where(HASH.eq(hash))
                                .and(PATH.eq(p))
                                .execute();
                    }
                }
                return n;
            });
            log.debug("Pruned {} stale path(s) for hash {}", pruned, hash);
        }
        return existing;
    }

    @Override
    public void record(IndexRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        String path = record.path() == null ? null : key(record.path());
        write(dsl -> {
            linkIdentifiers(dsl, record);
            if (path != null) {
                insertPath(dsl, record.hash(), path);
            }
            return null;
        });
    }

    @Override
    public RecordOutcome recordDownload(IndexRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(record.path(), "recordDownload requires a path");
        String own = key(record.path());
        return write(dsl -> {
            List<String> stored = dsl.select(PATH)
                    .from(PATH_RECORDS)
                    .where(HASH.eq(record.hash()))
                    .orderBy(PATH)
                    .fetch(PATH);
            Optional<String> survivor = stored.stream()
                    .filter(p -> !p.equals(own))
                    .filter(p -> Files.exists(Path.of(p)))
                    .findFirst();

            linkIdentifiers(dsl, record);
            if (survivor.isPresent()) {
                return RecordOutcome.duplicateOf(Path.of(survivor.get()));
            }
            insertPath(dsl, record.hash(), own);
            return RecordOutcome.stored(record.path());
        });
    }

    private static void linkIdentifiers(DSLContext dsl, IndexRecord record) {
        if (record.url() != null) {
            dsl.insertInto(URL_RECORDS, URL, HASH)
                    .values(record.url(), record.hash())
                    .onConflictDoNothing()
                    .execute();
        }
        if (record.etag() != null) {
            dsl.insertInto(ETAG_RECORDS, ETAG, HASH)
                    .values(record.etag(), record.hash())
                    .onConflictDoNothing()
                    .execute();
        }
        if (record.fingerprint() != null) {
            dsl.insertInto(FINGERPRINT_RECORDS, FINGERPRINT, HASH)
                    .values(record.fingerprint(), record.hash())
                    .onConflictDoNothing()
                    .execute();
        }
    }

    private static void insertPath(DSLContext dsl, String hash, String path) {
        dsl.insertInto(PATH_RECORDS, HASH, PATH)
                .values(hash, path)
                .onConflictDoNothing()
                .execute();
    }

    @Override
    public List<PathEntry> entries() {
        return read(dsl -> dsl.select(HASH, PATH)
                .from(PATH_RECORDS)
                .orderBy(HASH, PATH)
                .fetch(r -> new PathEntry(r.get(HASH), Path.of(r.get(PATH)))));
    }

    @Override
    public Map<String, String> mappings(IdentifierKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        Table<Record> table = switch (kind) {
            case URL -> URL_RECORDS;
            case ETAG -> ETAG_RECORDS;
            case FINGERPRINT -> FINGERPRINT_RECORDS;
        };
        Field<String> key = switch (kind) {
            case URL -> URL;
            case ETAG -> ETAG;
            case FINGERPRINT -> FINGERPRINT;
        };
        return read(dsl -> {
            Map<String, String> out = new LinkedHashMap<>();
            dsl.select(key, HASH).from(table).orderBy(key).fetch().forEach(r -> out.put(r.get(key), r.get(HASH)));
            return out;
        });
    }

    @Override
    public void markFailed(String url, String reason) {
        if (url == null || url.isBlank()) return;
        long now = clock.instant().getEpochSecond();
        write(dsl -> dsl.insertInto(FAILED_URLS, URL, FAILED_AT, REASON, ATTEMPTS)
                .values(url, now, reason, 1)
                .onConflict(URL)
                .doUpdate()
                .set(FAILED_AT, now)
                .set(REASON, reason)
                .set(ATTEMPTS, ATTEMPTS.plus(1))
                .execute());
    }

    @Override
    public boolean isFailed(String url) {
        if (url == null || url.isBlank()) return false;
        return read(dsl -> dsl.fetchExists(dsl.selectOne().from(FAILED_URLS).where(URL.eq(url))));
    }

    @Override
    public void clearFailed(String url) {
        if (url == null || url.isBlank()) return;
        write(dsl -> dsl.deleteFrom(FAILED_URLS).where(URL.eq(url)).execute());
    }

    @Override
    public int clearAllFailed() {
        return write(dsl -> dsl.deleteFrom(FAILED_URLS).execute());
    }

    @Override
    public List<FailedUrl> failedUrls() {
        return read(dsl -> dsl.select(URL, REASON, ATTEMPTS, FAILED_AT)
                .from(FAILED_URLS)
                .orderBy(FAILED_AT.desc(), URL)
                .fetch(r -> new FailedUrl(
                        r.get(URL),
                        r.get(REASON),
                        r.get(ATTEMPTS) == null ? 0 : r.get(ATTEMPTS),
                        r.get(FAILED_AT) == null ? null : Instant.ofEpochSecond(r.get(FAILED_AT)))));
    }

    @Override
    public long failedCount() {
        return read(dsl -> (long) dsl.fetchCount(FAILED_URLS));
    }

    @Override
    public IndexStats stats() {
        return read(dsl -> new IndexStats(
                dsl.fetchCount(URL_RECORDS),
                dsl.fetchCount(ETAG_RECORDS),
                dsl.fetchCount(FINGERPRINT_RECORDS),
                dsl.fetchCount(PATH_RECORDS),
                dsl.fetchCount(dsl.selectDistinct(HASH).from(PATH_RECORDS)),
                dsl.fetchCount(FAILED_URLS)));
    }

    @Override
    public void checkpoint() {
        ensureOpen();
        writeLock.lock();
        try {
            writer.fetch("PRAGMA wal_checkpoint(FULL)");
        } catch (DataAccessException e) {
            throw new IndexAccessException("checkpoint failed: " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void close() {
        if (closed) return;
        writeLock.lock();
        try {
            synchronized (readMonitor) {
                if (closed) return;
                try {
                    writer.fetch("PRAGMA wal_checkpoint(FULL)");
                } catch (DataAccessException e) {
                    log.warn("Final checkpoint of {} failed: {}", location, e.getMessage());
                }
                closed = true;
                closeQuietly(readConnection);
                closeQuietly(writeConnection);
                log.debug("Closed index at {}", location);
            }
        } finally {
            writeLock.unlock();
        }
    }

    private <T> T read(Function<DSLContext, T> query) {
        ensureOpen();
        synchronized (readMonitor) {
            ensureOpen();
            try {
                return query.apply(reader);
            } catch (DataAccessException e) {
                throw new IndexAccessException("index read failed: " + e.getMessage(), e);
            }
        }
    }

    private <T> T write(Function<DSLContext, T> work) {
        ensureOpen();
        writeLock.lock();
        try {
            ensureOpen();
            return writer.transactionResult(cfg -> work.apply(DSL.using(cfg)));
        } catch (DataAccessException e) {
            throw new IndexAccessException("index write failed: " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IndexAccessException("index " + location + " is closed");
        }
    }

    private static String key(Path path) {
        return path.toAbsolutePath().normalize().toString();
    }

    private static void closeQuietly(Connection connection) {
        if (connection == null) return;
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Closing index connection failed: {}", e.getMessage());
        }
    }
}
