package com.dcruver.promptloom.search;

import lombok.Value;

/**
 * A tag that co-occurs with the current selection, scored relative to the strongest one.
 */
@Value
public class RelatedTag {
    String name;
    int relevancePercent;
}
