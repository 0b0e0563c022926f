package com.journalengine.common;

import com.journalengine.common.exception.InvalidAmountException;

import java.math.BigDecimal;

/**
 * Sign and parsing helpers for ledger amounts.
 */
public final class Amounts {

    private Amounts() {
    }

    /**
     * The negative absolute value, as written to a source leg.
     */
    public static BigDecimal negative(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return amount.abs().negate();
    }

    /**
     * The positive absolute value, as written to a destination leg.
     */
    public static BigDecimal positive(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return amount.abs();
    }

    /**
     * Parses a journal amount. Empty, non-numeric and zero values are rejected.
     *
     * @throws InvalidAmountException if the value is not a usable amount
     */
    public static BigDecimal parseAmount(Object value) {
        String string = value == null ? "" : value.toString().trim();
        if (string.isEmpty()) {
            throw new InvalidAmountException("The amount cannot be empty");
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(string);
        } catch (NumberFormatException e) {
            throw new InvalidAmountException("Not a valid amount: " + string, e);
        }
        if (amount.signum() == 0) {
            throw new InvalidAmountException("The amount cannot be zero");
        }
        return amount;
    }

    /**
     * Parses a foreign amount. Returns null for absent, empty, zero or
     * non-numeric values; a foreign amount is optional by nature.
     */
    public static BigDecimal parseForeignAmount(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return parseAmount(value);
        } catch (InvalidAmountException e) {
            return null;
        }
    }

    /**
     * Canonical string form used for comparisons, independent of scale.
     */
    public static String canonical(BigDecimal amount) {
        if (amount == null) {
            return "";
        }
        return amount.signum() == 0 ? "0" : amount.stripTrailingZeros().toPlainString();
    }
}
