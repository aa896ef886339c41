package com.qbyte.gl_data.ledger;

import com.qbyte.gl_data.account.Account;
import com.qbyte.gl_data.generator.AmountGenerator;
import com.qbyte.gl_data.generator.AmountPair;
import com.qbyte.gl_data.generator.DateGenerator;
import com.qbyte.gl_data.generator.JournalGenerator;
import com.qbyte.gl_data.generator.LedgerRandom;
import com.qbyte.gl_data.generator.OilGasDataGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Assembles one complete {@link GLRecord} from an account draw and the field generators.
 *
 * Draw order against the supplied source is fixed:
 * <ol>
 *   <li>account group roll, then account choice</li>
 *   <li>transaction date (only when none is supplied)</li>
 *   <li>well ID</li>
 *   <li>AFE number (capex accounts only)</li>
 *   <li>lease name</li>
 *   <li>property ID</li>
 *   <li>JIB roll (always), then JIB number when the roll is below 0.4</li>
 *   <li>cost center</li>
 *   <li>journal source</li>
 *   <li>transaction type</li>
 *   <li>amount</li>
 *   <li>state, county, basin</li>
 *   <li>creator-user suffix</li>
 * </ol>
 * Changing this order changes every record generated after the change for a given seed.
 */
@Component
@RequiredArgsConstructor
public class RecordSynthesizer {

    static final double JIB_PROBABILITY = 0.4;

    private static final DateTimeFormatter FISCAL_PERIOD = DateTimeFormatter.ofPattern("yyyy-MM");

    private final AccountSelector accountSelector;
    private final AmountGenerator amountGenerator;
    private final DateGenerator dateGenerator;
    private final JournalGenerator journalGenerator;
    private final OilGasDataGenerator oilGasGenerator;
    private final Clock clock;

    /**
     * Synthesizes the record for {@code entryId}.
     *
     * @param random the engine's random source
     * @param entryId 1-based entry ID; the journal batch and entry codes derive from it
     * @param transactionDate transaction date, or null to draw one relative to today
     * @param transactionDateTime created/modified timestamp; must not be null
     */
    public GLRecord synthesize(LedgerRandom random, long entryId,
                               LocalDate transactionDate, LocalDateTime transactionDateTime) {
        if (transactionDateTime == null) {
            throw new IllegalArgumentException("Transaction timestamp is required");
        }

        Account account = accountSelector.select(random);

        LocalDate txDate = transactionDate != null
            ? transactionDate
            : dateGenerator.generateTransactionDate(random, LocalDate.now(clock));

        String wellId = oilGasGenerator.generateWellId(random);
        String afeNumber = account.isCapex() ? oilGasGenerator.generateAfeNumber(random) : null;
        String leaseName = oilGasGenerator.generateLeaseName(random);
        String propertyId = oilGasGenerator.generatePropertyId(random);
        String jibNumber = random.nextDouble() < JIB_PROBABILITY
            ? oilGasGenerator.generateJibNumber(random, txDate)
            : null;
        String costCenter = oilGasGenerator.generateCostCenter(random);
        String journalSource = journalGenerator.generateJournalSource(random);
        String transactionType = journalGenerator.generateTransactionType(random);

        AmountPair amounts = amountGenerator.generateFor(random, account);

        String state = oilGasGenerator.generateState(random);
        String county = oilGasGenerator.generateCounty(random);
        String basin = oilGasGenerator.generateBasin(random);
        String createdBy = "USER-" + random.nextInt(100, 999);

        return GLRecord.builder()
            .glEntryId(entryId)
            .journalBatch(JournalNumbering.journalBatch(entryId))
            .journalEntry(JournalNumbering.journalEntry(entryId))
            .transactionDate(txDate)
            .postingDate(txDate)
            .accountCode(account.getCode())
            .accountName(account.getName())
            .accountType(account.getAccountType())
            .debitAmount(amounts.getDebit())
            .creditAmount(amounts.getCredit())
            .netAmount(amounts.net())
            .wellId(wellId)
            .leaseName(leaseName)
            .propertyId(propertyId)
            .afeNumber(afeNumber)
            .jibNumber(jibNumber)
            .costCenter(costCenter)
            .journalSource(journalSource)
            .transactionType(transactionType)
            .description(transactionType + " - " + account.getName() + " for " + wellId)
            .fiscalPeriod(txDate.format(FISCAL_PERIOD))
            .fiscalYear(txDate.getYear())
            .fiscalMonth(txDate.getMonthValue())
            .state(state)
            .county(county)
            .basin(basin)
            .createdTimestamp(transactionDateTime)
            .createdBy(createdBy)
            .lastModified(transactionDateTime)
            .build();
    }
}
