package com.dcruver.promptloom.indexer;

import com.dcruver.promptloom.color.CategoryColorSynchronizer;
import com.dcruver.promptloom.color.TagColorSynchronizer;
import com.dcruver.promptloom.config.TagIndexProperties;
import com.dcruver.promptloom.domain.CancellationSignal;
import com.dcruver.promptloom.domain.IndexProgress;
import com.dcruver.promptloom.domain.SyncResult;
import com.dcruver.promptloom.domain.TagOccurrence;
import com.dcruver.promptloom.io.LibraryFileSystem;
import com.dcruver.promptloom.io.LibraryPaths;
import com.dcruver.promptloom.io.StopWordsStore;
import com.dcruver.promptloom.store.IndexConsistencyException;
import com.dcruver.promptloom.store.TagIndexStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Synchronizes the tag index with the prompt library on disk.
 *
 * A pass enumerates every {@code *.txt} file, re-tags the files whose stamp changed, drops files that
 * disappeared, garbage-collects orphan tags and refreshes folder and tag colors. Everything after
 * schema initialization happens in one transaction, so readers only ever see a complete pass.
 * Only one pass runs at a time in the process; other callers wait for it and then run their own.
 */
@Component
@Slf4j
public class TagIndexer {

    static final String STAGE_SCANNING = "Scanning library files";
    static final String STAGE_INDEXING = "Indexing tags";
    static final String STAGE_FINALIZING = "Finalizing index";
    static final String STAGE_FOLDER_COLORS = "Assigning folder colors";
    static final String STAGE_READY = "Index ready";

    private static final Semaphore SYNC_PERMIT = new Semaphore(1, true);
    private static final long PERMIT_POLL_MILLIS = 100;

    private final TagIndexStore store;
    private final StopWordsStore stopWordsStore;
    private final LibraryFileSystem fileSystem;
    private final TagExtractor extractor;
    private final CategoryColorSynchronizer categoryColors;
    private final TagColorSynchronizer tagColors;
    private final TagIndexProperties properties;
    private final Clock clock;
    private final Executor indexingExecutor;
    private final TransactionTemplate transactionTemplate;

    public TagIndexer(TagIndexStore store,
                      StopWordsStore stopWordsStore,
                      LibraryFileSystem fileSystem,
                      TagExtractor extractor,
                      CategoryColorSynchronizer categoryColors,
                      TagColorSynchronizer tagColors,
                      TagIndexProperties properties,
                      Clock clock,
                      Executor indexingExecutor) {
        this.store = store;
        this.stopWordsStore = stopWordsStore;
        this.fileSystem = fileSystem;
        this.extractor = extractor;
        this.categoryColors = categoryColors;
        this.tagColors = tagColors;
        this.properties = properties;
        this.clock = clock;
        this.indexingExecutor = indexingExecutor;
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(store.getDataSource()));
    }

    public SyncResult sync() {
        return sync(CancellationSignal.none(), progress -> { });
    }

    /**
     * Run a sync on the indexing executor.
     */
    public CompletableFuture<SyncResult> syncAsync(CancellationSignal cancellation, Consumer<IndexProgress> progress) {
        return CompletableFuture.supplyAsync(() -> sync(cancellation, progress), indexingExecutor);
    }

    /**
     * Run one full synchronization pass.
     *
     * @throws CancellationException   if {@code cancellation} fires; nothing is committed
     * @throws IndexConsistencyException if a freshly written row cannot be read back
     */
    public SyncResult sync(CancellationSignal cancellation, Consumer<IndexProgress> progress) {
        acquirePermit(cancellation);
        try {
            long started = clock.millis();
            store.initialize();

            Set<String> stopWords = stopWordsStore.loadOrCreate();
            Path libraryRoot = properties.getLibraryDir().toAbsolutePath().normalize();

            progress.accept(new IndexProgress(STAGE_SCANNING, 0, 0));
            Map<String, FileSnapshot> snapshots = buildSnapshots(libraryRoot);
            progress.accept(new IndexProgress(STAGE_INDEXING, 0, snapshots.size()));

            SyncResult result = transactionTemplate.execute(status ->
                syncInTransaction(store.getJdbcTemplate(), libraryRoot, snapshots, stopWords, cancellation, progress));

            progress.accept(new IndexProgress(STAGE_READY, snapshots.size(), snapshots.size()));
            log.info("Tag index synced in {} ms: {} files, {} tags (added {}, updated {}, removed {})",
                clock.millis() - started, result.getTotalFiles(), result.getTotalTags(),
                result.getAddedFiles(), result.getUpdatedFiles(), result.getRemovedFiles());
            return result;
        } finally {
            SYNC_PERMIT.release();
        }
    }

    private SyncResult syncInTransaction(JdbcTemplate jdbc,
                                         Path libraryRoot,
                                         Map<String, FileSnapshot> snapshots,
                                         Set<String> stopWords,
                                         CancellationSignal cancellation,
                                         Consumer<IndexProgress> progress) {
        Integer storedVersion = jdbc.queryForObject("SELECT IndexVersion FROM IndexState WHERE Id = 1", Integer.class);
        boolean forceResync = storedVersion == null || storedVersion < TagIndexStore.CURRENT_INDEX_VERSION;
        if (forceResync) {
            log.info("Index format {} is older than {}, re-tagging every file", storedVersion,
                TagIndexStore.CURRENT_INDEX_VERSION);
        }

        Map<String, Long> existing = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        jdbc.query("SELECT Path, LastWriteTicks FROM Files",
            rs -> { existing.put(rs.getString("Path"), rs.getLong("LastWriteTicks")); });

        List<Object[]> removed = new ArrayList<>();
        for (String path : existing.keySet()) {
            if (!snapshots.containsKey(path)) {
                removed.add(new Object[]{path});
            }
        }
        cancellation.throwIfCancelled();
        if (!removed.isEmpty()) {
            jdbc.batchUpdate("DELETE FROM Files WHERE Path = ?", removed);
        }

        int added = 0;
        int updated = 0;
        int processed = 0;
        int lastPercent = -1;
        int total = snapshots.size();
        Map<String, Long> tagIds = new HashMap<>();

        for (FileSnapshot snapshot : snapshots.values()) {
            cancellation.throwIfCancelled();
            processed++;

            Long storedStamp = existing.get(snapshot.path());
            if (forceResync || storedStamp == null || storedStamp != snapshot.lastWriteTicks()) {
                if (storedStamp == null) {
                    added++;
                } else {
                    updated++;
                }
                indexFile(jdbc, libraryRoot, snapshot, stopWords, tagIds);
            }

            int percent = (int) Math.round(processed * 100d / total);
            if (percent != lastPercent && (percent % 5 == 0 || percent == 100)) {
                lastPercent = percent;
                progress.accept(new IndexProgress(STAGE_INDEXING, processed, total));
            }
        }

        cancellation.throwIfCancelled();
        progress.accept(new IndexProgress(STAGE_FINALIZING, processed, total));

        jdbc.update("DELETE FROM Tags WHERE Id NOT IN (SELECT DISTINCT TagId FROM FileTags)");
        jdbc.update("UPDATE Tags SET OccurringFileCount = "
            + "(SELECT COUNT(DISTINCT FileId) FROM FileTags WHERE TagId = Tags.Id)");
        jdbc.update("UPDATE IndexState SET LastScanTicks = ?, LibraryRoot = ?, IndexVersion = ? WHERE Id = 1",
            clock.millis(), libraryRoot.toString(), TagIndexStore.CURRENT_INDEX_VERSION);
        TagIndexStore.rebuildFullText(jdbc);

        int totalFiles = count(jdbc, "SELECT COUNT(*) FROM Files");
        int totalTags = count(jdbc, "SELECT COUNT(*) FROM Tags");

        cancellation.throwIfCancelled();
        progress.accept(new IndexProgress(STAGE_FOLDER_COLORS, 0, 0));
        int folderColors = categoryColors.sync(jdbc, libraryRoot,
            snapshots.values().stream().map(snapshot -> Path.of(snapshot.path())).toList());

        cancellation.throwIfCancelled();
        int colors = tagColors.sync(jdbc, cancellation, progress);

        cancellation.throwIfCancelled();
        return SyncResult.builder()
            .addedFiles(added)
            .updatedFiles(updated)
            .removedFiles(removed.size())
            .totalFiles(totalFiles)
            .totalTags(totalTags)
            .totalColors(folderColors)
            .totalTagColors(colors)
            .build();
    }

    private void indexFile(JdbcTemplate jdbc, Path libraryRoot, FileSnapshot snapshot,
                           Set<String> stopWords, Map<String, Long> tagIds) {
        jdbc.update("INSERT INTO Files (Path, FileName, LastWriteTicks) VALUES (?, ?, ?) "
                + "ON CONFLICT(Path) DO UPDATE SET Path = excluded.Path, FileName = excluded.FileName, "
                + "LastWriteTicks = excluded.LastWriteTicks",
            snapshot.path(), snapshot.fileName(), snapshot.lastWriteTicks());

        long fileId = resolveId(jdbc, "SELECT Id FROM Files WHERE Path = ?", snapshot.path(), "file");
        jdbc.update("DELETE FROM FileTags WHERE FileId = ?", fileId);

        Map<String, TagOccurrence> occurrences = extractor.extract(libraryRoot, Path.of(snapshot.path()), stopWords);
        if (occurrences.isEmpty()) {
            return;
        }

        List<Object[]> rows = new ArrayList<>(occurrences.size());
        occurrences.forEach((tag, occurrence) -> rows.add(new Object[]{
            fileId,
            tagId(jdbc, tag, tagIds),
            occurrence.getTotalCount(),
            occurrence.getFileNameCount(),
            occurrence.getPathCount(),
            occurrence.getContentCount()
        }));
        jdbc.batchUpdate("INSERT INTO FileTags (FileId, TagId, OccurrenceCount, FileNameCount, PathCount, ContentCount) "
            + "VALUES (?, ?, ?, ?, ?, ?)", rows);
    }

    private long tagId(JdbcTemplate jdbc, String tag, Map<String, Long> tagIds) {
        Long cached = tagIds.get(tag);
        if (cached != null) {
            return cached;
        }
        jdbc.update("INSERT OR IGNORE INTO Tags (Name) VALUES (?)", tag);
        long id = resolveId(jdbc, "SELECT Id FROM Tags WHERE Name = ?", tag, "tag");
        tagIds.put(tag, id);
        return id;
    }

    private static long resolveId(JdbcTemplate jdbc, String sql, String key, String kind) {
        List<Long> ids = jdbc.queryForList(sql, Long.class, key);
        if (ids.isEmpty() || ids.get(0) == null) {
            throw new IndexConsistencyException("Failed to resolve " + kind + " id for " + key);
        }
        return ids.get(0);
    }

    private static int count(JdbcTemplate jdbc, String sql) {
        Integer value = jdbc.queryForObject(sql, Integer.class);
        return value != null ? value : 0;
    }

    /**
     * Absolute path to snapshot, keyed case-insensitively. A missing library yields no files.
     */
    Map<String, FileSnapshot> buildSnapshots(Path libraryRoot) {
        Map<String, FileSnapshot> snapshots = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (!fileSystem.directoryExists(libraryRoot)) {
            log.warn("Library directory does not exist: {}", libraryRoot);
            return snapshots;
        }

        List<Path> files;
        try {
            files = fileSystem.enumerateFiles(libraryRoot, "*.txt", true);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to enumerate library " + libraryRoot, e);
        }

        for (Path file : files) {
            Path absolute = file.toAbsolutePath().normalize();
            long stamp;
            try {
                stamp = fileSystem.lastWriteStamp(absolute);
            } catch (IOException e) {
                log.warn("Could not read modification time of {}: {}", absolute, e.getMessage());
                stamp = 0;
            }
            String fileName = LibraryPaths.stripExtension(absolute.getFileName().toString());
            snapshots.put(absolute.toString(), new FileSnapshot(absolute.toString(), fileName, stamp));
        }
        return snapshots;
    }

    private static void acquirePermit(CancellationSignal cancellation) {
        try {
            while (!SYNC_PERMIT.tryAcquire(PERMIT_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                cancellation.throwIfCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while waiting for the index");
            cancelled.initCause(e);
            throw cancelled;
        }
        if (cancellation.isCancelled()) {
            SYNC_PERMIT.release();
            cancellation.throwIfCancelled();
        }
    }
}
