package com.tanumd.core.db;

import com.tanumd.core.error.DatabaseException;
import com.tanumd.core.error.DatabaseException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Owner of the SQLite file embedded in one document.
 *
 * <p>The database lives in a private temporary directory created for this handle and deleted
 * by {@link #close()}. The file path is never exposed. Each {@link #withRead} and
 * {@link #withWrite} call opens its own connection and closes it before returning, so no
 * connection outlives a call; several statements are atomic only when grouped in a single
 * {@code withWrite}.
 *
 * <p>The schema version is {@code PRAGMA user_version} inside the file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (DatabaseHandle db = DatabaseHandle.newEmpty(DbOptions.defaults())) {
 *     db.reset("CREATE TABLE items(id INTEGER PRIMARY KEY, name TEXT);", 1);
 *     int inserted = db.withWrite(conn -> {
 *         try (Statement st = conn.createStatement()) {
 *             return st.executeUpdate("INSERT INTO items(name) VALUES ('alpha')");
 *         }
 *     });
 *     db.migrate("ALTER TABLE items ADD COLUMN qty INTEGER DEFAULT 0;", 1, 2);
 * }
 * }</pre>
 */
public final class DatabaseHandle implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DatabaseHandle.class);

    /** Name of the database entry inside containers and workspaces. */
    public static final String FILE_NAME = "main.sqlite3";

    /** Every SQLite database file starts with these 16 bytes. */
    private static final byte[] SQLITE_MAGIC = "SQLite format 3\0".getBytes(StandardCharsets.US_ASCII);

    private final Path directory;
    private final Path file;
    private final DbOptions options;
    private boolean closed;

    private DatabaseHandle(Path directory, DbOptions options) {
        this.directory = directory;
        this.file = directory.resolve(FILE_NAME);
        this.options = options == null ? DbOptions.defaults() : options;
    }

    /**
     * Creates a fresh, empty database with {@code user_version = 0}.
     *
     * @param options settings to apply
     * @return new handle
     * @throws IOException if the temporary directory cannot be created
     * @throws DatabaseException if SQLite initialization fails
     */
    public static DatabaseHandle newEmpty(DbOptions options) throws IOException {
        DatabaseHandle handle = new DatabaseHandle(Files.createTempDirectory("tmd-db-"), options);
        try {
            handle.initialize();
        } catch (RuntimeException e) {
            handle.close();
            throw e;
        }
        log.debug("Created empty database in {}", handle.directory);
        return handle;
    }

    /**
     * Materializes a database from an existing image.
     *
     * @param bytes SQLite file content
     * @param options settings kept for later copies
     * @return new handle
     * @throws IOException if the temporary file cannot be written
     * @throws DatabaseException if the bytes do not carry the SQLite header
     */
    public static DatabaseHandle fromBytes(byte[] bytes, DbOptions options) throws IOException {
        Objects.requireNonNull(bytes, "bytes must not be null");
        requireSqliteImage(bytes);
        DatabaseHandle handle = new DatabaseHandle(Files.createTempDirectory("tmd-db-"), options);
        try {
            Files.write(handle.file, bytes);
        } catch (IOException e) {
            handle.close();
            throw e;
        }
        log.debug("Materialized {} byte database in {}", bytes.length, handle.directory);
        return handle;
    }

    /**
     * Checks whether bytes start with the SQLite header.
     *
     * @param bytes candidate database image
     * @return true if the 16-byte magic header is present
     */
    public static boolean isSqliteImage(byte[] bytes) {
        return bytes != null && bytes.length >= SQLITE_MAGIC.length
            && Arrays.equals(bytes, 0, SQLITE_MAGIC.length, SQLITE_MAGIC, 0, SQLITE_MAGIC.length);
    }

    /**
     * Runs read-only work on a private connection.
     *
     * @param work callback
     * @param <T> result type
     * @return callback result
     * @throws DatabaseException if the connection or the callback's statements fail
     */
    public <T> T withRead(SqlFunction<T> work) {
        ensureOpen();
        try (Connection connection = open(true)) {
            return work.apply(connection);
        } catch (SQLException e) {
            throw new DatabaseException(Reason.SQL, e.getMessage(), e);
        }
    }

    /**
     * Runs work in a transaction on a private connection. The transaction commits when the
     * callback returns and rolls back when it throws.
     *
     * @param work callback
     * @param <T> result type
     * @return callback result
     * @throws DatabaseException if the connection, the commit or the callback's statements fail
     */
    public <T> T withWrite(SqlFunction<T> work) {
        ensureOpen();
        try (Connection connection = open(false)) {
            connection.setAutoCommit(false);
            try {
                T result = work.apply(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new DatabaseException(Reason.SQL, e.getMessage(), e);
        }
    }

    /**
     * Reads the schema version counter.
     *
     * @return {@code PRAGMA user_version}
     */
    public int userVersion() {
        return withRead(DatabaseHandle::readUserVersion);
    }

    /**
     * Destroys all content, applies a schema and sets the version counter, in one transaction.
     *
     * <p>If {@code schemaSql} fails nothing changes: previous tables, rows and version remain.
     *
     * @param schemaSql DDL to apply (may contain several statements)
     * @param version new {@code user_version}
     * @throws DatabaseException if the schema is invalid
     */
    public void reset(String schemaSql, int version) {
        requireVersion(version);
        withWrite(connection -> {
            dropAllObjects(connection);
            execute(connection, schemaSql);
            writeUserVersion(connection, version);
            return null;
        });
        vacuum();
        log.info("Database reset to schema version {}", version);
    }

    /**
     * Applies one migration step.
     *
     * @param stepSql statements moving the schema from {@code from} to {@code to}
     * @param from expected current version
     * @param to version after the step
     * @throws DatabaseException with {@link Reason#VERSION_MISMATCH} if the stored version is
     *     not {@code from}, or {@link Reason#SQL} if the step fails; in both cases the stored
     *     version is unchanged
     */
    public void migrate(String stepSql, int from, int to) {
        requireVersion(to);
        withWrite(connection -> {
            int current = readUserVersion(connection);
            if (current != from) {
                throw new DatabaseException(Reason.VERSION_MISMATCH,
                    "expected user_version " + from + " but found " + current);
            }
            execute(connection, stepSql);
            writeUserVersion(connection, to);
            return null;
        });
        log.info("Database migrated from schema version {} to {}", from, to);
    }

    /**
     * Copies the database file to an external location.
     *
     * @param target destination file (replaced if present)
     * @throws IOException if copying fails
     */
    public void exportTo(Path target) throws IOException {
        ensureOpen();
        Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Exported database to {}", target);
    }

    /**
     * Replaces the database with the content of an external SQLite file.
     *
     * @param source SQLite file
     * @throws IOException if reading or writing fails
     * @throws DatabaseException if the source is not a SQLite database
     */
    public void importFrom(Path source) throws IOException {
        ensureOpen();
        byte[] bytes = Files.readAllBytes(source);
        requireSqliteImage(bytes);
        Files.write(file, bytes);
        deleteSidecars();
        log.debug("Imported {} byte database from {}", bytes.length, source);
    }

    /**
     * Reads the whole database file.
     *
     * @return database image
     * @throws IOException if reading fails
     */
    public byte[] toBytes() throws IOException {
        ensureOpen();
        return Files.readAllBytes(file);
    }

    /**
     * Opens a stream over the database file.
     *
     * @return input stream, to be closed by the caller
     * @throws IOException if the file cannot be opened
     */
    public InputStream openStream() throws IOException {
        ensureOpen();
        return Files.newInputStream(file);
    }

    /**
     * Creates an independent handle with a private copy of the database file.
     *
     * @return new handle
     * @throws IOException if copying fails
     */
    public DatabaseHandle copy() throws IOException {
        return fromBytes(toBytes(), options);
    }

    public DbOptions options() {
        return options;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Deletes the temporary directory and the database in it. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try (Stream<Path> paths = Files.walk(directory)) {
            List<Path> ordered = paths.sorted(Comparator.reverseOrder()).toList();
            for (Path path : ordered) {
                Files.deleteIfExists(path);
            }
            log.debug("Deleted database directory {}", directory);
        } catch (IOException e) {
            log.warn("Failed to delete database directory {}: {}", directory, e.getMessage());
        }
    }

    private void initialize() {
        ensureOpen();
        try (Connection connection = open(false); Statement statement = connection.createStatement()) {
            if (options.pageSize() != null) {
                statement.executeUpdate("PRAGMA page_size = " + options.pageSize());
            }
            if (options.journalMode() != null) {
                statement.execute("PRAGMA journal_mode = " + options.journalMode());
            }
            if (options.synchronous() != null) {
                statement.executeUpdate("PRAGMA synchronous = " + options.synchronous());
            }
            writeUserVersion(connection, 0);
            if (Files.size(file) == 0) {
                // Force the header page onto disk.
                statement.executeUpdate("CREATE TABLE tmd_init(x); DROP TABLE tmd_init;");
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (SQLException e) {
            throw new DatabaseException(Reason.SQL, "failed to initialize database: " + e.getMessage(), e);
        }
    }

    private Connection open(boolean readOnly) throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(readOnly);
        return DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath(), config.toProperties());
    }

    private static void rollback(Connection connection, Exception failure) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    private void vacuum() {
        try (Connection connection = open(false); Statement statement = connection.createStatement()) {
            statement.executeUpdate("VACUUM");
        } catch (SQLException e) {
            throw new DatabaseException(Reason.SQL, "vacuum failed: " + e.getMessage(), e);
        }
    }

    private void deleteSidecars() throws IOException {
        Files.deleteIfExists(directory.resolve(FILE_NAME + "-wal"));
        Files.deleteIfExists(directory.resolve(FILE_NAME + "-shm"));
        Files.deleteIfExists(directory.resolve(FILE_NAME + "-journal"));
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("database handle is closed");
        }
    }

    private static void dropAllObjects(Connection connection) throws SQLException {
        List<String[]> objects = new ArrayList<>();
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(
                 "SELECT type, name FROM sqlite_master "
                     + "WHERE name NOT LIKE 'sqlite\\_%' ESCAPE '\\' AND type IN ('view', 'trigger', 'index', 'table') "
                     + "ORDER BY CASE type WHEN 'view' THEN 0 WHEN 'trigger' THEN 1 WHEN 'index' THEN 2 ELSE 3 END")) {
            while (rs.next()) {
                objects.add(new String[] {rs.getString(1), rs.getString(2)});
            }
        }
        boolean hasSequence;
        try (Statement statement = connection.createStatement()) {
            for (String[] object : objects) {
                statement.executeUpdate("DROP " + object[0].toUpperCase(Locale.ROOT) + " IF EXISTS " + quote(object[1]));
            }
            try (ResultSet rs = statement.executeQuery(
                "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = 'sqlite_sequence'")) {
                hasSequence = rs.next();
            }
            if (hasSequence) {
                statement.executeUpdate("DELETE FROM sqlite_sequence");
            }
        }
    }

    private static void execute(Connection connection, String sql) throws SQLException {
        if (sql == null || sql.isBlank()) {
            return;
        }
        // The SQLite driver runs every statement of a multi-statement string here.
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate(sql);
        }
    }

    private static int readUserVersion(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("PRAGMA user_version")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private static void writeUserVersion(Connection connection, int version) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("PRAGMA user_version = " + version);
        }
    }

    private static void requireVersion(int version) {
        if (version < 0) {
            throw new IllegalArgumentException("schema version must not be negative: " + version);
        }
    }

    private static void requireSqliteImage(byte[] bytes) {
        if (!isSqliteImage(bytes)) {
            throw new DatabaseException(Reason.INVALID_DATABASE, "byte image is not a SQLite database");
        }
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
