package com.qbyte.gl_data.account;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static chart of oil and gas GL accounts, grouped by {@link AccountKind}.
 *
 * The catalog is immutable and defined once. Group order and the order of
 * accounts inside a group are part of the generated output: the record
 * synthesizer picks accounts by index, so reordering this table changes
 * every record produced for a given seed.
 */
@Component
public class AccountCatalog {

    private final Map<AccountKind, List<Account>> accountsByKind;

    public AccountCatalog() {
        Map<AccountKind, List<Account>> accounts = new EnumMap<>(AccountKind.class);

        accounts.put(AccountKind.REVENUE, List.of(
            new Account("4100", "Crude Oil Sales Revenue", AccountType.REVENUE),
            new Account("4200", "Natural Gas Sales Revenue", AccountType.REVENUE),
            new Account("4300", "NGL Sales Revenue", AccountType.REVENUE),
            new Account("4400", "Condensate Sales Revenue", AccountType.REVENUE),
            new Account("4500", "Gathering & Processing Revenue", AccountType.REVENUE)
        ));

        accounts.put(AccountKind.OPERATING_EXPENSE, List.of(
            new Account("5100", "Lease Operating Expense", AccountType.EXPENSE),
            new Account("5200", "Workover Expense", AccountType.EXPENSE),
            new Account("5300", "Well Service Expense", AccountType.EXPENSE),
            new Account("5400", "Production Equipment Maintenance", AccountType.EXPENSE),
            new Account("5500", "Field Operations Expense", AccountType.EXPENSE),
            new Account("5600", "Gathering & Transportation", AccountType.EXPENSE),
            new Account("5700", "Processing & Treating", AccountType.EXPENSE)
        ));

        accounts.put(AccountKind.CAPEX, List.of(
            new Account("6100", "Drilling Costs", AccountType.EXPENSE),
            new Account("6200", "Completion Costs", AccountType.EXPENSE),
            new Account("6300", "Facilities & Equipment", AccountType.EXPENSE),
            new Account("6400", "Land & Lease Acquisition", AccountType.EXPENSE),
            new Account("6500", "Geological & Geophysical", AccountType.EXPENSE)
        ));

        accounts.put(AccountKind.ADMIN, List.of(
            new Account("7100", "General & Administrative", AccountType.EXPENSE),
            new Account("7200", "Overhead Allocation", AccountType.EXPENSE),
            new Account("7300", "Insurance Expense", AccountType.EXPENSE),
            new Account("7400", "Property Tax", AccountType.EXPENSE)
        ));

        this.accountsByKind = Collections.unmodifiableMap(accounts);
    }

    /**
     * Gets all accounts of one kind, in catalog order.
     */
    public List<Account> listByType(AccountKind kind) {
        return accountsByKind.get(kind);
    }

    public List<Account> getAllAccounts() {
        List<Account> all = new ArrayList<>();
        for (AccountKind kind : AccountKind.values()) {
            all.addAll(accountsByKind.get(kind));
        }
        return Collections.unmodifiableList(all);
    }

    /**
     * Legend of code series to account group, e.g. {@code "4xxx" -> "Revenue Accounts"}.
     */
    public Map<String, String> getAccountTypesInfo() {
        Map<String, String> info = new LinkedHashMap<>();
        for (AccountKind kind : AccountKind.values()) {
            info.put(kind.getCodeSeries(), kind.getLabel());
        }
        return info;
    }
}
