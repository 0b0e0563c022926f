package com.journalengine.common.exception;

/**
 * Thrown when an amount cannot be parsed or is not acceptable as a journal amount.
 */
public class InvalidAmountException extends JournalEngineException {

    public InvalidAmountException(String message) {
        super(message);
    }

    public InvalidAmountException(String message, Throwable cause) {
        super(message, cause);
    }
}
