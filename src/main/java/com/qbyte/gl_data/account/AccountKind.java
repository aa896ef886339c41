package com.qbyte.gl_data.account;

/**
 * Catalog grouping used by the weighted account draw.
 */
public enum AccountKind {
    REVENUE("4xxx", "Revenue Accounts"),
    OPERATING_EXPENSE("5xxx", "Operating Expense Accounts"),
    CAPEX("6xxx", "Capital Expenditure Accounts"),
    ADMIN("7xxx", "Administrative Accounts");

    private final String codeSeries;
    private final String label;

    AccountKind(String codeSeries, String label) {
        this.codeSeries = codeSeries;
        this.label = label;
    }

    public String getCodeSeries() {
        return codeSeries;
    }

    public String getLabel() {
        return label;
    }
}
