package com.qbyte.gl_data.generator;

import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Generates transaction dates relative to a caller-supplied "today".
 *
 * Only used when a record is synthesized without an explicit transaction
 * date. The engine always supplies one, so engine output never depends on
 * the wall clock.
 */
@Component
public class DateGenerator {

    public static final double DEFAULT_HISTORICAL_PROBABILITY = 0.8;
    public static final int MAX_DAYS_BACK = 30;

    /**
     * With probability {@code historicalProbability} returns a date 0 to 30
     * days before {@code today}, otherwise {@code today}.
     *
     * Consumes one draw, plus one more when the historical branch is taken.
     */
    public LocalDate generateTransactionDate(LedgerRandom random, LocalDate today, double historicalProbability) {
        if (random.nextDouble() < historicalProbability) {
            int daysAgo = random.nextInt(0, MAX_DAYS_BACK);
            return today.minusDays(daysAgo);
        }
        return today;
    }

    public LocalDate generateTransactionDate(LedgerRandom random, LocalDate today) {
        return generateTransactionDate(random, today, DEFAULT_HISTORICAL_PROBABILITY);
    }
}
