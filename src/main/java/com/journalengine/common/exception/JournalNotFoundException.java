package com.journalengine.common.exception;

/**
 * Thrown when a transaction journal is not found.
 */
public class JournalNotFoundException extends JournalEngineException {

    public JournalNotFoundException(Long journalId) {
        super("Transaction journal not found: " + journalId);
    }
}
