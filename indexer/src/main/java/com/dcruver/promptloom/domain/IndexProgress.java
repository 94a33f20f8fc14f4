package com.dcruver.promptloom.domain;

/**
 * Progress update emitted while the index is synchronized.
 *
 * @param stage     human-readable phase name
 * @param processed files processed so far in this phase
 * @param total     files in this phase, or 0 when unknown
 */
public record IndexProgress(String stage, int processed, int total) {

    /**
     * Percent complete when the total is known, otherwise 0.
     */
    public int percent() {
        return total <= 0 ? 0 : (int) Math.round(processed * 100d / total);
    }

    @Override
    public String toString() {
        return total <= 0
            ? stage + "..."
            : String.format("%s (%d/%d, %d%%)", stage, processed, total, percent());
    }
}
