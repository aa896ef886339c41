package com.qbyte.gl_data.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.qbyte.gl_data.ledger.GLRecord;
import lombok.Value;

import java.util.List;

/**
 * One newline-delimited JSON message on the stream.
 *
 * The first frame of every session is {@code buffered_records} carrying the
 * full snapshot; every later frame is {@code new_record} carrying exactly one record.
 */
public final class StreamFrame {

    public static final String BUFFERED_RECORDS = "buffered_records";
    public static final String NEW_RECORD = "new_record";

    private StreamFrame() {
    }

    public static Buffered buffered(List<GLRecord> records) {
        return new Buffered(BUFFERED_RECORDS, records.size(), records);
    }

    public static NewRecord newRecord(GLRecord record) {
        return new NewRecord(NEW_RECORD, record);
    }

    @Value
    @JsonPropertyOrder({"type", "count", "data"})
    public static class Buffered {
        @JsonProperty("type")
        String type;

        @JsonProperty("count")
        int count;

        @JsonProperty("data")
        List<GLRecord> data;
    }

    @Value
    @JsonInclude(JsonInclude.Include.ALWAYS)
    @JsonPropertyOrder({"type", "data"})
    public static class NewRecord {
        @JsonProperty("type")
        String type;

        @JsonProperty("data")
        GLRecord data;
    }
}
