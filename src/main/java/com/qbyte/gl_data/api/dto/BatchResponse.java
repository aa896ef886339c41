package com.qbyte.gl_data.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.qbyte.gl_data.ledger.GLRecord;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Response body for the ingestion batch endpoint.
 *
 * Echoes whichever selector was used: {@code after_id}, or the
 * half-open {@code [start_date, end_date)} window. {@code last_entry_id}
 * is the watermark to pass as {@code after_id} on the next pull.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"count", "limit", "after_id", "start_date", "end_date", "last_entry_id", "data"})
public class BatchResponse {

    @JsonProperty("count")
    int count;

    @JsonProperty("limit")
    int limit;

    @JsonProperty("after_id")
    Long afterId;

    @JsonProperty("start_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate startDate;

    @JsonProperty("end_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate endDate;

    @JsonProperty("last_entry_id")
    Long lastEntryId;

    @JsonProperty("data")
    List<GLRecord> data;
}
