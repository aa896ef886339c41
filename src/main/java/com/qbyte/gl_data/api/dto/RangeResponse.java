package com.qbyte.gl_data.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.qbyte.gl_data.ledger.GLRecord;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Response body for a historical date-range query.
 */
@Value
@JsonPropertyOrder({"count", "start_date", "end_date", "data"})
public class RangeResponse {

    @JsonProperty("count")
    int count;

    @JsonProperty("start_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate startDate;

    @JsonProperty("end_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate endDate;

    @JsonProperty("data")
    List<GLRecord> data;

    public static RangeResponse of(LocalDate startDate, LocalDate endDate, List<GLRecord> records) {
        return new RangeResponse(records.size(), startDate, endDate, records);
    }
}
