package com.journalengine.journals;

import java.util.Locale;
import java.util.Optional;

/**
 * Types of transaction journals.
 *
 * The type constrains which account types may appear on the source and
 * destination side of a journal.
 */
public enum TransactionType {
    WITHDRAWAL("Withdrawal"),
    DEPOSIT("Deposit"),
    TRANSFER("Transfer"),
    OPENING_BALANCE("Opening balance"),
    RECONCILIATION("Reconciliation"),
    LIABILITY_CREDIT("Liability credit"),

    /**
     * Placeholder for a requested type that does not exist. No account
     * combination is valid for it.
     */
    INVALID("Invalid");

    private final String displayName;

    TransactionType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Looks up a type by its request or display form. "opening-balance",
     * "opening_balance" and "Opening balance" all name the same type.
     * {@link #INVALID} cannot be requested.
     */
    public static Optional<TransactionType> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().replace('-', ' ').replace('_', ' ').toLowerCase(Locale.ROOT);
        for (TransactionType type : values()) {
            if (type != INVALID && type.displayName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
