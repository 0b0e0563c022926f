package com.journalengine.common.exception;

/**
 * Thrown when stored ledger data violates the double-entry structure,
 * for example a journal without a source or destination leg.
 *
 * This is never recovered from inside an update.
 */
public class LedgerIntegrityException extends JournalEngineException {

    public LedgerIntegrityException(String message) {
        super(message);
    }
}
