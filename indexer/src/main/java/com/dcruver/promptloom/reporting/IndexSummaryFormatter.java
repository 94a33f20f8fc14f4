package com.dcruver.promptloom.reporting;

import com.dcruver.promptloom.domain.SyncResult;

/**
 * One-line status text for a finished sync.
 */
public final class IndexSummaryFormatter {

    private IndexSummaryFormatter() {
    }

    public static String format(SyncResult result) {
        return String.format(
            "Index ready: %d files, %d tags (added %d, updated %d, removed %d). Colors: %d folders, %d tags.",
            result.getTotalFiles(),
            result.getTotalTags(),
            result.getAddedFiles(),
            result.getUpdatedFiles(),
            result.getRemovedFiles(),
            result.getTotalColors(),
            result.getTotalTagColors());
    }
}
