package com.dcruver.promptloom.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * File-system operations used by the indexer and the stop-word store.
 * The indexer only reads through this interface; it never writes into the library tree.
 */
public interface LibraryFileSystem {

    boolean fileExists(Path path);

    boolean directoryExists(Path path);

    void createDirectories(Path path) throws IOException;

    /**
     * Enumerate regular files under {@code root} whose name matches {@code glob} (case-insensitive).
     *
     * @param recursive descend into subdirectories when true
     * @return matching files, sorted
     */
    List<Path> enumerateFiles(Path root, String glob, boolean recursive) throws IOException;

    String readAllText(Path path) throws IOException;

    void writeAllText(Path path, String contents) throws IOException;

    /**
     * Opaque, monotonic last-modified stamp used for change detection.
     */
    long lastWriteStamp(Path path) throws IOException;
}
