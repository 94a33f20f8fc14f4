package com.dcruver.promptloom.indexer;

/**
 * A library file as seen on disk during one scan.
 *
 * @param path           absolute path, the key stored in the Files table
 * @param fileName       file name without extension
 * @param lastWriteTicks last-modified stamp compared against the stored one
 */
public record FileSnapshot(String path, String fileName, long lastWriteTicks) {
}
