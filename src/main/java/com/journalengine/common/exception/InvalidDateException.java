package com.journalengine.common.exception;

/**
 * Thrown when a date value cannot be parsed.
 */
public class InvalidDateException extends JournalEngineException {

    public InvalidDateException(String value, Throwable cause) {
        super("Not a valid date value: " + value, cause);
    }
}
