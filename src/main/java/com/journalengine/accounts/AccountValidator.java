package com.journalengine.accounts;

import com.journalengine.common.exception.AccountResolutionException;
import com.journalengine.journals.TransactionType;

/**
 * Decides whether account details are acceptable for a transaction type and
 * turns them into concrete accounts.
 */
public interface AccountValidator {

    /**
     * Whether the details identify a source account acceptable for the given type.
     *
     * @param userId owner of the journal
     * @param type expected transaction type
     * @param candidate submitted or current account details
     */
    boolean validateSource(String userId, TransactionType type, AccountCandidate candidate);

    /**
     * Whether the details identify a destination account acceptable for the
     * given type, opposite the given source account.
     *
     * @param source the resolved source account, may be null
     */
    boolean validateDestination(String userId, TransactionType type, Account source, AccountCandidate candidate);

    /**
     * Finds, or where the type allows it creates, the source account.
     *
     * @throws AccountResolutionException if no acceptable account can be found or created
     */
    Account resolveSource(String userId, TransactionType type, AccountCandidate candidate);

    /**
     * Finds, or where the type allows it creates, the destination account.
     * Only types allowed opposite the given source are considered, the same
     * set {@link #validateDestination} checks against.
     *
     * @param source the resolved source account, may be null
     * @throws AccountResolutionException if no acceptable account can be found or created
     */
    Account resolveDestination(String userId, TransactionType type, Account source, AccountCandidate candidate);
}
