package com.dcruver.promptloom.search;

import lombok.Builder;
import lombok.Value;

/**
 * A file matching every requested tag.
 */
@Value
@Builder(toBuilder = true)
public class FileSearchResult {
    String path;
    String fileName;

    /**
     * Summed occurrences of the requested tags in this file.
     */
    int matchCount;

    /**
     * 0.6 x file-name hits + 0.3 x folder hits + 0.1 x content hits.
     */
    double relevanceScore;

    /**
     * Score relative to the best result of the same query, 0 to 100.
     */
    int relevancePercent;

    /**
     * Folder relative to the library root, '/'-separated; empty for top-level files.
     */
    String relativeFolderPath;

    public String getDisplayName() {
        return "(" + matchCount + ") " + fileName;
    }
}
