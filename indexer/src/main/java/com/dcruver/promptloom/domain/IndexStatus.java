package com.dcruver.promptloom.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of the index bookkeeping row plus table sizes.
 */
@Value
@Builder
public class IndexStatus {
    int schemaVersion;
    int indexVersion;

    /**
     * Epoch millis of the last completed sync, 0 if none.
     */
    long lastScanMillis;

    String libraryRoot;
    int fileCount;
    int tagCount;
    int folderColorCount;
    int tagColorCount;
}
