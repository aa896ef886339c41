package com.qbyte.gl_data.stream;

import com.qbyte.gl_data.ledger.GLRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only buffer of generated GL records.
 *
 * Invariants:
 * 1. The generation engine is the only writer; records are appended in entry ID order
 * 2. Records are never removed or replaced
 * 3. The lock is held only to append or copy, never while a caller sleeps or writes to a socket
 *
 * The historical portion is sealed once, after the historical phase. Range
 * queries read the sealed copy and never take the lock.
 */
@Component
@Slf4j
public class RecordBuffer {

    private final ReentrantLock lock = new ReentrantLock();
    private final List<GLRecord> records = new ArrayList<>();

    private volatile List<GLRecord> historical = List.of();
    private volatile boolean sealed;

    /**
     * Appends one fully synthesized record. Writer only.
     */
    public void append(GLRecord record) {
        lock.lock();
        try {
            if (!records.isEmpty()) {
                long lastId = records.get(records.size() - 1).getGlEntryId();
                if (record.getGlEntryId() <= lastId) {
                    throw new IllegalStateException(String.format(
                        "Entry IDs must increase: last=%d, appended=%d", lastId, record.getGlEntryId()));
                }
            }
            records.add(record);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks everything appended so far as the historical portion.
     *
     * @throws IllegalStateException if already sealed
     */
    public void sealHistorical() {
        lock.lock();
        try {
            if (sealed) {
                throw new IllegalStateException("Historical portion is already sealed");
            }
            historical = List.copyOf(records);
            sealed = true;
            log.info("Sealed historical portion: records={}", historical.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copies every buffered record and returns the cursor a new stream session starts from.
     */
    public BufferSnapshot snapshotAndTail() {
        lock.lock();
        try {
            return new BufferSnapshot(List.copyOf(records), records.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns every record appended since {@code cursor}, and the advanced cursor.
     * The list is empty when nothing new exists.
     *
     * @throws IllegalArgumentException if the cursor is negative or ahead of the buffer
     */
    public BufferSnapshot readFrom(int cursor) {
        lock.lock();
        try {
            int size = records.size();
            if (cursor < 0 || cursor > size) {
                throw new IllegalArgumentException(
                    String.format("Cursor out of range: cursor=%d, size=%d", cursor, size));
            }
            if (cursor == size) {
                return new BufferSnapshot(List.of(), cursor);
            }
            return new BufferSnapshot(List.copyOf(records.subList(cursor, size)), size);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Historical records with {@code start <= transaction_date <= end}, in entry ID order.
     */
    public List<GLRecord> range(LocalDate start, LocalDate end) {
        return historical.stream()
            .filter(r -> !r.getTransactionDate().isBefore(start) && !r.getTransactionDate().isAfter(end))
            .toList();
    }

    /**
     * Up to {@code limit} records with {@code gl_entry_id > watermark}, oldest first.
     * Covers historical and live records.
     */
    public List<GLRecord> recordsAfter(long watermark, int limit) {
        lock.lock();
        try {
            int from = firstIndexAfter(watermark);
            int to = (int) Math.min((long) from + limit, records.size());
            return List.copyOf(records.subList(from, to));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Up to {@code limit} records with {@code from <= transaction_date < to}, in entry ID order.
     * Covers historical and live records.
     */
    public List<GLRecord> recordsInWindow(LocalDate from, LocalDate to, int limit) {
        lock.lock();
        try {
            return records.stream()
                .filter(r -> !r.getTransactionDate().isBefore(from) && r.getTransactionDate().isBefore(to))
                .limit(limit)
                .toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * The first {@code limit} buffered records.
     */
    public List<GLRecord> buffered(int limit) {
        lock.lock();
        try {
            return List.copyOf(records.subList(0, Math.min(limit, records.size())));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    public int historicalCount() {
        return historical.size();
    }

    public int liveCount() {
        return sealed ? size() - historicalCount() : 0;
    }

    public boolean isSealed() {
        return sealed;
    }

    // Binary search; entry IDs are strictly increasing in buffer order.
    private int firstIndexAfter(long watermark) {
        int low = 0;
        int high = records.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (records.get(mid).getGlEntryId() <= watermark) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}
