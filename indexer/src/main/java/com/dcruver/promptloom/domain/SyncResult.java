package com.dcruver.promptloom.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one synchronization pass.
 */
@Value
@Builder
public class SyncResult {
    int addedFiles;
    int updatedFiles;
    int removedFiles;
    int totalFiles;
    int totalTags;

    /**
     * Folder colors stored after the pass.
     */
    int totalColors;

    /**
     * Tag colors stored after the pass.
     */
    int totalTagColors;
}
