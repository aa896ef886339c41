package com.qbyte.gl_data.generator;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Debit and credit amounts for one GL line. Exactly one side is nonzero.
 */
@Value
public class AmountPair {
    BigDecimal debit;
    BigDecimal credit;

    /**
     * Net amount as credit minus debit.
     */
    public BigDecimal net() {
        return credit.subtract(debit);
    }
}
