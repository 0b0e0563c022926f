package com.journalengine.accounts;

/**
 * The side of a journal an account is resolved for.
 */
public enum AccountRole {
    SOURCE,
    DESTINATION
}
