package com.qbyte.gl_data.account;

/**
 * Ledger side of an account as it appears on the wire.
 * Revenue accounts are credited, every other account is debited.
 */
public enum AccountType {
    REVENUE,
    EXPENSE
}
