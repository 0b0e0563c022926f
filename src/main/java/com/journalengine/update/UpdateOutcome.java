package com.journalengine.update;

/**
 * Why a requested change was not applied.
 */
public enum UpdateOutcome {

    /**
     * Not enough information, or the change does not apply to this journal.
     */
    SKIPPED,

    /**
     * The change would break a ledger rule, such as an account combination
     * that the journal type does not allow.
     */
    REJECTED,

    /**
     * A value could not be parsed or resolved.
     */
    FAILED
}
