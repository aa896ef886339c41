package com.qbyte.gl_data.stream;

import com.qbyte.gl_data.ledger.GLRecord;
import lombok.Value;

import java.util.List;

/**
 * Records copied out of the buffer together with the cursor to resume from.
 * The cursor is the buffer length at the instant of the copy.
 */
@Value
public class BufferSnapshot {
    List<GLRecord> records;
    int cursor;

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
