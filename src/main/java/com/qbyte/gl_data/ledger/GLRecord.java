package com.qbyte.gl_data.ledger;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.qbyte.gl_data.account.AccountType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A QByte-style General Ledger entry for oil and gas operations.
 *
 * Records are created once by the generation engine and never modified.
 * The JSON property names below are the wire format consumed by the
 * ingestion pipeline; absent AFE and JIB numbers are written as {@code null}.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({
    "gl_entry_id", "journal_batch", "journal_entry", "transaction_date", "posting_date",
    "account_code", "account_name", "account_type", "debit_amount", "credit_amount", "net_amount",
    "well_id", "lease_name", "property_id", "afe_number", "jib_number", "cost_center",
    "journal_source", "transaction_type", "description", "fiscal_period", "fiscal_year",
    "fiscal_month", "state", "county", "basin", "created_timestamp", "created_by", "last_modified"
})
public class GLRecord {

    @JsonProperty("gl_entry_id")
    long glEntryId;

    @JsonProperty("journal_batch")
    String journalBatch;

    @JsonProperty("journal_entry")
    String journalEntry;

    @JsonProperty("transaction_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate transactionDate;

    @JsonProperty("posting_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate postingDate;

    @JsonProperty("account_code")
    String accountCode;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("debit_amount")
    BigDecimal debitAmount;

    @JsonProperty("credit_amount")
    BigDecimal creditAmount;

    @JsonProperty("net_amount")
    BigDecimal netAmount;

    @JsonProperty("well_id")
    String wellId;

    @JsonProperty("lease_name")
    String leaseName;

    @JsonProperty("property_id")
    String propertyId;

    // Present only for capex accounts
    @JsonProperty("afe_number")
    String afeNumber;

    @JsonProperty("jib_number")
    String jibNumber;

    @JsonProperty("cost_center")
    String costCenter;

    @JsonProperty("journal_source")
    String journalSource;

    @JsonProperty("transaction_type")
    String transactionType;

    @JsonProperty("description")
    String description;

    @JsonProperty("fiscal_period")
    String fiscalPeriod;

    @JsonProperty("fiscal_year")
    int fiscalYear;

    @JsonProperty("fiscal_month")
    int fiscalMonth;

    @JsonProperty("state")
    String state;

    @JsonProperty("county")
    String county;

    @JsonProperty("basin")
    String basin;

    @JsonProperty("created_timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime createdTimestamp;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("last_modified")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime lastModified;
}
