package com.dcruver.promptloom;

import com.dcruver.promptloom.app.DataSourceConfig;
import com.dcruver.promptloom.color.CategoryColorSynchronizer;
import com.dcruver.promptloom.color.TagColorSynchronizer;
import com.dcruver.promptloom.config.TagIndexProperties;
import com.dcruver.promptloom.indexer.TagExtractor;
import com.dcruver.promptloom.indexer.TagIndexer;
import com.dcruver.promptloom.io.LibraryFileSystem;
import com.dcruver.promptloom.io.LocalFileSystem;
import com.dcruver.promptloom.io.StopWordsStore;
import com.dcruver.promptloom.nlp.TagTokenizer;
import com.dcruver.promptloom.search.TagSearchService;
import com.dcruver.promptloom.store.TagIndexStore;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Wires the index components by hand over a temporary app-data root, without a Spring context.
 */
public class TagIndexFixture {

    public static final Instant NOW = Instant.parse("2026-03-12T10:00:00Z");

    public final Path appDataRoot;
    public final Path library;
    public final TagIndexProperties properties;
    public final LibraryFileSystem fileSystem;
    public final TagIndexStore store;
    public final StopWordsStore stopWords;
    public final TagTokenizer tokenizer;
    public final TagIndexer indexer;
    public final TagSearchService search;
    public final JdbcTemplate jdbc;

    public TagIndexFixture(Path tempDir) throws IOException {
        this(tempDir, new LocalFileSystem());
    }

    public TagIndexFixture(Path tempDir, LibraryFileSystem fileSystem) throws IOException {
        this.appDataRoot = tempDir.resolve("appdata");
        this.library = appDataRoot.resolve("Library");
        Files.createDirectories(library);

        this.properties = new TagIndexProperties();
        properties.setAppDataRoot(appDataRoot);
        properties.setHeartbeatInterval(Duration.ZERO);

        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        this.fileSystem = fileSystem;
        this.store = new TagIndexStore(
            DataSourceConfig.sqliteDataSource(properties.getDatabasePath()), fileSystem, properties);
        this.stopWords = new StopWordsStore(fileSystem, properties);
        this.tokenizer = new TagTokenizer();
        this.indexer = new TagIndexer(
            store,
            stopWords,
            fileSystem,
            new TagExtractor(tokenizer, fileSystem),
            new CategoryColorSynchronizer(),
            new TagColorSynchronizer(properties, clock),
            properties,
            clock,
            Runnable::run);
        this.search = new TagSearchService(store, stopWords, tokenizer, properties);
        this.jdbc = store.getJdbcTemplate();
    }

    /**
     * Write a library file relative to the library root and give it a fixed modification time.
     */
    public Path writeFile(String relativePath, String content, long modifiedSeconds) throws IOException {
        Path file = library.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        Files.setLastModifiedTime(file, FileTime.from(Instant.ofEpochSecond(modifiedSeconds)));
        return file.toAbsolutePath().normalize();
    }

    public Path writeFile(String relativePath, String content) throws IOException {
        return writeFile(relativePath, content, NOW.getEpochSecond());
    }

    public int countRows(String table) {
        Integer rows = jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return rows != null ? rows : 0;
    }
}
