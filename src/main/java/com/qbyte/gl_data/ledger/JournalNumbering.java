package com.qbyte.gl_data.ledger;

/**
 * Journal batch and entry codes derived from the entry ID.
 *
 * A batch covers 50 consecutive entries: IDs 1-50 are {@code BATCH-000001},
 * 51-100 are {@code BATCH-000002}, and so on.
 */
public final class JournalNumbering {

    public static final int ENTRIES_PER_BATCH = 50;

    private JournalNumbering() {
        // Utility class
    }

    public static long batchNumber(long entryId) {
        if (entryId < 1) {
            throw new IllegalArgumentException("Entry ID must be positive: " + entryId);
        }
        return (entryId + ENTRIES_PER_BATCH - 1) / ENTRIES_PER_BATCH;
    }

    public static String journalBatch(long entryId) {
        return String.format("BATCH-%06d", batchNumber(entryId));
    }

    public static String journalEntry(long entryId) {
        return String.format("JE-%08d", entryId);
    }
}
