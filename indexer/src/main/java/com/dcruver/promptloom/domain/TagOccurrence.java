package com.dcruver.promptloom.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How often a tag occurs in one file, split by where it was found.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TagOccurrence {
    private int fileNameCount;
    private int pathCount;
    private int contentCount;

    public int getTotalCount() {
        return fileNameCount + pathCount + contentCount;
    }
}
