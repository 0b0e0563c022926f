package com.journalengine.update;

import com.journalengine.accounts.Account;
import com.journalengine.journals.LegPair;
import com.journalengine.journals.TransactionJournal;
import lombok.Value;

/**
 * Everything one update call works on, built once when the call starts.
 *
 * The legs are the managed entities the steps write to. The original
 * accounts are captured before any step runs and never change afterwards.
 */
@Value
public class UpdateContext {
    String userId;
    TransactionJournal journal;
    JournalUpdateRequest request;
    LegPair legs;
    Account originalSourceAccount;
    Account originalDestinationAccount;

    public static UpdateContext of(TransactionJournal journal, JournalUpdateRequest request, LegPair legs) {
        return new UpdateContext(
            journal.getUserId(),
            journal,
            request,
            legs,
            legs.getSource().getAccount(),
            legs.getDestination().getAccount()
        );
    }
}
