package com.journalengine.common.exception;

/**
 * Base exception for all journal engine exceptions.
 */
public class JournalEngineException extends RuntimeException {

    public JournalEngineException(String message) {
        super(message);
    }

    public JournalEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
