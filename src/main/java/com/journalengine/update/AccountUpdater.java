package com.journalengine.update;

import com.journalengine.accounts.Account;
import com.journalengine.accounts.AccountCandidate;
import com.journalengine.accounts.AccountRole;
import com.journalengine.accounts.AccountValidator;
import com.journalengine.common.exception.AccountResolutionException;
import com.journalengine.journals.LegPair;
import com.journalengine.journals.Transaction;
import com.journalengine.journals.TransactionJournal;
import com.journalengine.journals.TransactionRepository;
import com.journalengine.journals.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.journalengine.update.JournalUpdateRequest.*;

/**
 * Re-points the journal's legs at new accounts and changes its type.
 *
 * Both accounts are validated against the expected type first. Nothing is
 * changed unless both are acceptable, and the type only changes together
 * with a valid account combination.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccountUpdater {

    private final AccountValidator accountValidator;
    private final TransactionRepository transactionRepository;

    public void apply(UpdateContext context, UpdateReport report) {
        if (!hasValidSourceAccount(context) || !hasValidDestinationAccount(context)) {
            report.rejected(UpdateStep.ACCOUNTS, null, String.format(
                "Source and destination accounts are not valid for a %s",
                expectedType(context).getDisplayName().toLowerCase()));
            return;
        }
        log.debug("Accounts of journal #{} are valid for a {}", context.getJournal().getId(),
            expectedType(context).getDisplayName());
        updateAccounts(context, report);
        updateType(context);
    }

    /**
     * The type the accounts must fit: the requested type if there is one,
     * else the journal's current type. An unknown requested type is
     * {@link TransactionType#INVALID}.
     */
    public TransactionType expectedType(UpdateContext context) {
        JournalUpdateRequest request = context.getRequest();
        if (!request.has(TYPE)) {
            return context.getJournal().getTransactionType();
        }
        return TransactionType.find(request.getString(TYPE)).orElse(TransactionType.INVALID);
    }

    public boolean hasValidSourceAccount(UpdateContext context) {
        JournalUpdateRequest request = context.getRequest();
        AccountCandidate candidate = request.hasAny(SOURCE_ID, SOURCE_NAME)
            ? AccountCandidate.builder()
                .id(request.getLong(SOURCE_ID))
                .name(request.getString(SOURCE_NAME))
                .build()
            : AccountCandidate.of(context.getOriginalSourceAccount());
        return accountValidator.validateSource(context.getUserId(), expectedType(context), candidate);
    }

    public boolean hasValidDestinationAccount(UpdateContext context) {
        JournalUpdateRequest request = context.getRequest();
        AccountCandidate candidate = request.hasAny(DESTINATION_ID, DESTINATION_NAME)
            ? AccountCandidate.builder()
                .id(request.getLong(DESTINATION_ID))
                .name(request.getString(DESTINATION_NAME))
                .build()
            : AccountCandidate.of(context.getOriginalDestinationAccount());
        Account source = getValidSourceAccount(context);
        return accountValidator.validateDestination(context.getUserId(), expectedType(context), source, candidate);
    }

    /**
     * The requested source account, or the original one when the request
     * names none or it cannot be resolved.
     */
    public Account getValidSourceAccount(UpdateContext context) {
        return resolveOrOriginal(context, AccountRole.SOURCE, null, null);
    }

    /**
     * The requested destination account, resolved opposite the valid source
     * account, or the original one when the request names none or it cannot
     * be resolved.
     */
    public Account getValidDestinationAccount(UpdateContext context) {
        return resolveOrOriginal(context, AccountRole.DESTINATION, getValidSourceAccount(context), null);
    }

    public void updateAccounts(UpdateContext context, UpdateReport report) {
        Account source = resolveOrOriginal(context, AccountRole.SOURCE, null, report);
        Account destination = resolveOrOriginal(context, AccountRole.DESTINATION, source, report);

        if (source.getId().equals(destination.getId())) {
            report.rejected(UpdateStep.ACCOUNTS, null, String.format(
                "Source and destination are the same account #%d", source.getId()));
            return;
        }

        LegPair legs = context.getLegs();
        repoint(legs.getSource(), source);
        repoint(legs.getDestination(), destination);
        log.debug("Journal #{} now moves money from account #{} to account #{}",
            context.getJournal().getId(), source.getId(), destination.getId());
    }

    /**
     * Runs only once the accounts fit {@link #expectedType}, so the requested type is a known one.
     */
    private void updateType(UpdateContext context) {
        if (!context.getRequest().has(TYPE)) {
            return;
        }
        TransactionType type = expectedType(context);
        TransactionJournal journal = context.getJournal();
        if (journal.getTransactionType() != type) {
            log.info("Journal #{} changes type from {} to {}", journal.getId(),
                journal.getTransactionType().getDisplayName(), type.getDisplayName());
            journal.setTransactionType(type);
        }
    }

    private void repoint(Transaction leg, Account account) {
        if (!account.getId().equals(leg.getAccount().getId())) {
            leg.setAccount(account);
            transactionRepository.save(leg);
        }
    }

    private Account resolveOrOriginal(UpdateContext context, AccountRole role, Account source,
                                      UpdateReport report) {
        boolean isSource = role == AccountRole.SOURCE;
        Account original = isSource ? context.getOriginalSourceAccount() : context.getOriginalDestinationAccount();
        String idField = isSource ? SOURCE_ID : DESTINATION_ID;
        String nameField = isSource ? SOURCE_NAME : DESTINATION_NAME;

        JournalUpdateRequest request = context.getRequest();
        if (!request.hasAny(idField, nameField)) {
            return original;
        }
        AccountCandidate candidate = AccountCandidate.builder()
            .id(request.getLong(idField))
            .name(request.getString(nameField))
            .iban(request.getString(isSource ? SOURCE_IBAN : DESTINATION_IBAN))
            .number(request.getString(isSource ? SOURCE_NUMBER : DESTINATION_NUMBER))
            .bic(request.getString(isSource ? SOURCE_BIC : DESTINATION_BIC))
            .build();
        try {
            return isSource
                ? accountValidator.resolveSource(context.getUserId(), expectedType(context), candidate)
                : accountValidator.resolveDestination(context.getUserId(), expectedType(context), source, candidate);
        } catch (AccountResolutionException e) {
            log.warn("Keeping account #{} as {}: {}", original.getId(), role.name().toLowerCase(), e.getMessage());
            if (report != null) {
                report.failed(UpdateStep.ACCOUNTS, idField, e.getMessage());
            }
            return original;
        }
    }
}
