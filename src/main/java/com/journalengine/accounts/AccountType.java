package com.journalengine.accounts;

import java.util.EnumSet;
import java.util.Set;

/**
 * Types of accounts a journal leg can be booked on.
 */
public enum AccountType {
    ASSET,
    EXPENSE,
    REVENUE,
    CASH,
    LOAN,
    DEBT,
    MORTGAGE,
    INITIAL_BALANCE,
    RECONCILIATION,
    LIABILITY_CREDIT;

    private static final Set<AccountType> LIABILITIES = EnumSet.of(LOAN, DEBT, MORTGAGE);

    public static Set<AccountType> liabilities() {
        return EnumSet.copyOf(LIABILITIES);
    }

    /**
     * Loan, debt and mortgage accounts.
     */
    public boolean isLiability() {
        return LIABILITIES.contains(this);
    }
}
