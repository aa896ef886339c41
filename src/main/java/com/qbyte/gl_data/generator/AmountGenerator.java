package com.qbyte.gl_data.generator;

import com.qbyte.gl_data.account.Account;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Generates transaction amounts conditioned on account classification.
 *
 * Ranges:
 * - Revenue: [5,000, 50,000), posted as a credit
 * - Capex: [10,000, 200,000), posted as a debit
 * - Operating and admin expense: [500, 15,000), posted as a debit
 *
 * Amounts are rounded to cents. Each call consumes exactly one draw.
 */
@Component
public class AmountGenerator {

    public static final double REVENUE_MIN = 5_000.0;
    public static final double REVENUE_MAX = 50_000.0;

    public static final double CAPEX_MIN = 10_000.0;
    public static final double CAPEX_MAX = 200_000.0;

    public static final double OPEX_MIN = 500.0;
    public static final double OPEX_MAX = 15_000.0;

    static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

    public AmountPair generateFor(LedgerRandom random, Account account) {
        if (account.isRevenue()) {
            return new AmountPair(ZERO, toCents(random.uniform(REVENUE_MIN, REVENUE_MAX)));
        }
        if (account.isCapex()) {
            return new AmountPair(toCents(random.uniform(CAPEX_MIN, CAPEX_MAX)), ZERO);
        }
        return new AmountPair(toCents(random.uniform(OPEX_MIN, OPEX_MAX)), ZERO);
    }

    private static BigDecimal toCents(double amount) {
        return BigDecimal.valueOf(amount).setScale(2, RoundingMode.HALF_EVEN);
    }
}
