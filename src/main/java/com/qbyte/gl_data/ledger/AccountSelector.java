package com.qbyte.gl_data.ledger;

import com.qbyte.gl_data.account.Account;
import com.qbyte.gl_data.account.AccountCatalog;
import com.qbyte.gl_data.account.AccountKind;
import com.qbyte.gl_data.generator.LedgerRandom;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Weighted account draw: 30% revenue, 40% operating expense, 20% capex, 10% admin.
 *
 * One uniform roll picks the group against cumulative thresholds, a second
 * draw picks the account within the group.
 */
@Component
@RequiredArgsConstructor
public class AccountSelector {

    static final double REVENUE_THRESHOLD = 0.3;
    static final double OPERATING_EXPENSE_THRESHOLD = 0.7;
    static final double CAPEX_THRESHOLD = 0.9;

    private final AccountCatalog accountCatalog;

    public Account select(LedgerRandom random) {
        AccountKind kind = kindFor(random.nextDouble());
        return random.choice(accountCatalog.listByType(kind));
    }

    static AccountKind kindFor(double roll) {
        if (roll < REVENUE_THRESHOLD) {
            return AccountKind.REVENUE;
        } else if (roll < OPERATING_EXPENSE_THRESHOLD) {
            return AccountKind.OPERATING_EXPENSE;
        } else if (roll < CAPEX_THRESHOLD) {
            return AccountKind.CAPEX;
        }
        return AccountKind.ADMIN;
    }
}
