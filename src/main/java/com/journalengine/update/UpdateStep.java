package com.journalengine.update;

/**
 * The steps of a journal update, in the order they run.
 */
public enum UpdateStep {
    ACCOUNTS,
    TYPE,
    BILL,
    FIELDS,
    CATEGORY,
    BUDGET,
    TAGS,
    RECONCILED,
    NOTES,
    META,
    CURRENCY,
    AMOUNT,
    FOREIGN_AMOUNT
}
