package com.dcruver.promptloom.store;

import com.dcruver.promptloom.config.TagIndexProperties;
import com.dcruver.promptloom.domain.IndexStatus;
import com.dcruver.promptloom.io.LibraryFileSystem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Owns the SQLite tag index: schema creation, additive migrations and connections.
 *
 * Every connection comes from the injected data source, which opens a fresh connection to the
 * single database file per request with foreign keys enforced. Nothing here holds a connection
 * open between operations.
 */
@Component
@Slf4j
public class TagIndexStore {

    public static final int SCHEMA_VERSION = 6;

    /**
     * Version of the tokenization rules. Bumping it forces every file to be re-indexed.
     */
    public static final int CURRENT_INDEX_VERSION = 6;

    private static final List<String> SCHEMA = List.of(
        """
        CREATE TABLE IF NOT EXISTS Files (
            Id INTEGER PRIMARY KEY,
            Path TEXT NOT NULL UNIQUE COLLATE NOCASE,
            FileName TEXT NOT NULL,
            LastWriteTicks INTEGER NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS Tags (
            Id INTEGER PRIMARY KEY,
            Name TEXT NOT NULL UNIQUE COLLATE NOCASE,
            OccurringFileCount INTEGER NOT NULL DEFAULT 0
        )""",
        """
        CREATE TABLE IF NOT EXISTS FileTags (
            FileId INTEGER NOT NULL,
            TagId INTEGER NOT NULL,
            OccurrenceCount INTEGER NOT NULL,
            FileNameCount INTEGER NOT NULL DEFAULT 0,
            PathCount INTEGER NOT NULL DEFAULT 0,
            ContentCount INTEGER NOT NULL DEFAULT 0,
            PRIMARY KEY (FileId, TagId),
            FOREIGN KEY (FileId) REFERENCES Files(Id) ON DELETE CASCADE,
            FOREIGN KEY (TagId) REFERENCES Tags(Id) ON DELETE CASCADE
        )""",
        "CREATE INDEX IF NOT EXISTS IX_FileTags_TagId ON FileTags(TagId)",
        "CREATE INDEX IF NOT EXISTS IX_FileTags_FileId ON FileTags(FileId)",
        """
        CREATE TABLE IF NOT EXISTS IndexState (
            Id INTEGER PRIMARY KEY CHECK (Id = 1),
            SchemaVersion INTEGER NOT NULL,
            LastScanTicks INTEGER NOT NULL,
            LibraryRoot TEXT NOT NULL,
            IndexVersion INTEGER NOT NULL DEFAULT 1
        )""",
        """
        CREATE TABLE IF NOT EXISTS CategoryColors (
            Category TEXT NOT NULL PRIMARY KEY COLLATE NOCASE,
            ColorHex TEXT NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS TagColors (
            Tag TEXT NOT NULL PRIMARY KEY COLLATE NOCASE,
            ColorHex TEXT NOT NULL,
            ClusterId INTEGER NOT NULL DEFAULT 0
        )""",
        """
        CREATE TABLE IF NOT EXISTS TagColorState (
            Id INTEGER PRIMARY KEY CHECK (Id = 1),
            LastTagCount INTEGER NOT NULL DEFAULT 0,
            LastTagHash TEXT NOT NULL DEFAULT ''
        )"""
    );

    // table -> column -> definition; applied only when the column is missing
    private static final Map<String, Map<String, String>> MIGRATIONS = Map.of(
        "IndexState", Map.of(
            "IndexVersion", "INTEGER NOT NULL DEFAULT 1",
            "LibraryRoot", "TEXT NOT NULL DEFAULT ''"),
        "Tags", Map.of(
            "OccurringFileCount", "INTEGER NOT NULL DEFAULT 0"),
        "FileTags", Map.of(
            "FileNameCount", "INTEGER NOT NULL DEFAULT 0",
            "PathCount", "INTEGER NOT NULL DEFAULT 0",
            "ContentCount", "INTEGER NOT NULL DEFAULT 0"),
        "TagColors", Map.of(
            "ClusterId", "INTEGER NOT NULL DEFAULT 0")
    );

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final LibraryFileSystem fileSystem;
    private final TagIndexProperties properties;

    private volatile boolean initialized;

    public TagIndexStore(DataSource dataSource, LibraryFileSystem fileSystem, TagIndexProperties properties) {
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.fileSystem = fileSystem;
        this.properties = properties;
    }

    public Path getDatabasePath() {
        return properties.getDatabasePath();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public JdbcTemplate getJdbcTemplate() {
        return jdbcTemplate;
    }

    /**
     * Open a new connection to the index. The caller closes it.
     */
    public Connection createConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Create the schema if absent and apply additive migrations. Safe to call on every startup.
     */
    public void initialize() {
        Path parent = getDatabasePath().getParent();
        if (parent != null) {
            try {
                fileSystem.createDirectories(parent);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create index directory " + parent, e);
            }
        }

        jdbcTemplate.queryForObject("PRAGMA journal_mode = WAL", String.class);

        for (String statement : SCHEMA) {
            jdbcTemplate.execute(statement);
        }

        MIGRATIONS.forEach(this::ensureColumns);

        jdbcTemplate.execute(
            "CREATE VIRTUAL TABLE IF NOT EXISTS TagFts USING fts5(Name, content='Tags', content_rowid='Id')");

        jdbcTemplate.update(
            "INSERT OR IGNORE INTO IndexState (Id, SchemaVersion, LastScanTicks, LibraryRoot, IndexVersion) "
                + "VALUES (1, ?, 0, ?, ?)",
            SCHEMA_VERSION, properties.getLibraryDir().toString(), CURRENT_INDEX_VERSION);
        jdbcTemplate.update(
            "UPDATE IndexState SET SchemaVersion = ? WHERE Id = 1", SCHEMA_VERSION);
        jdbcTemplate.update(
            "INSERT OR IGNORE INTO TagColorState (Id, LastTagCount, LastTagHash) VALUES (1, 0, '')");

        initialized = true;
        log.debug("Initialized tag index at {}", getDatabasePath());
    }

    /**
     * Initialize once per process. Readers use this so they never write while a sync holds the lock.
     */
    public void ensureInitialized() {
        if (!initialized) {
            synchronized (this) {
                if (!initialized) {
                    initialize();
                }
            }
        }
    }

    /**
     * Read the bookkeeping row and table sizes.
     */
    public IndexStatus readStatus() {
        ensureInitialized();
        IndexStatus.IndexStatusBuilder status = jdbcTemplate.queryForObject(
            "SELECT SchemaVersion, IndexVersion, LastScanTicks, LibraryRoot FROM IndexState WHERE Id = 1",
            (rs, rowNum) -> IndexStatus.builder()
                .schemaVersion(rs.getInt("SchemaVersion"))
                .indexVersion(rs.getInt("IndexVersion"))
                .lastScanMillis(rs.getLong("LastScanTicks"))
                .libraryRoot(rs.getString("LibraryRoot")));
        return status
            .fileCount(count("Files"))
            .tagCount(count("Tags"))
            .folderColorCount(count("CategoryColors"))
            .tagColorCount(count("TagColors"))
            .build();
    }

    /**
     * Rebuild the full-text index over tag names from the Tags table.
     */
    public void rebuildFullText() {
        rebuildFullText(jdbcTemplate);
    }

    /**
     * Rebuild using the given template, so a sync can do it inside its own transaction.
     */
    public static void rebuildFullText(JdbcTemplate jdbc) {
        jdbc.update("INSERT INTO TagFts(TagFts) VALUES('rebuild')");
    }

    private int count(String table) {
        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return rows != null ? rows : 0;
    }

    /**
     * Column names of a table, case-insensitive.
     */
    Set<String> columnsOf(String table) {
        Set<String> columns = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        columns.addAll(jdbcTemplate.query("PRAGMA table_info(" + table + ")", (rs, rowNum) -> rs.getString("name")));
        return columns;
    }

    private void ensureColumns(String table, Map<String, String> definitions) {
        Set<String> existing = columnsOf(table);
        definitions.forEach((column, definition) -> {
            if (!existing.contains(column)) {
                log.info("Migrating {}: adding column {}", table, column);
                jdbcTemplate.execute("ALTER TABLE " + table + " ADD COLUMN " + column + " " + definition);
            }
        });
    }
}
