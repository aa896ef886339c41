package com.qbyte.gl_data.account;

import lombok.Value;

/**
 * A GL account from the static chart of accounts.
 * Capital expenditure accounts are the 6xxx series.
 */
@Value
public class Account {
    String code;
    String name;
    AccountType accountType;

    public boolean isRevenue() {
        return accountType == AccountType.REVENUE;
    }

    public boolean isCapex() {
        return code.startsWith("6");
    }
}
