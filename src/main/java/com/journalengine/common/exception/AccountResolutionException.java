package com.journalengine.common.exception;

/**
 * Thrown when account details cannot be turned into an account that is
 * acceptable for the given transaction type and role.
 */
public class AccountResolutionException extends JournalEngineException {

    public AccountResolutionException(String message) {
        super(message);
    }
}
