package com.journalengine.update;

import com.journalengine.common.exception.JournalNotFoundException;
import com.journalengine.journals.LegResolver;
import com.journalengine.journals.TransactionGroupHasher;
import com.journalengine.journals.TransactionJournal;
import com.journalengine.journals.TransactionJournalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Applies a partial update to one journal and its two legs.
 *
 * Update flow:
 * 1. Hash the journal's group
 * 2. Accounts and type, only together and only when both accounts are valid
 * 3. Bill, description, date, order
 * 4. Category, budget, tags, reconciled flag, notes, metadata
 * 5. Currency, amount, foreign amount
 * 6. Hash again and report whether anything changed
 *
 * A step that cannot apply its part is reported in the result and the
 * remaining steps still run. A broken ledger invariant aborts the call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalUpdateService {

    private final TransactionJournalRepository journalRepository;
    private final LegResolver legResolver;
    private final TransactionGroupHasher groupHasher;
    private final AccountUpdater accountUpdater;
    private final FieldPatcher fieldPatcher;
    private final RelationshipUpdater relationshipUpdater;
    private final MetaUpdater metaUpdater;
    private final CurrencyReconciler currencyReconciler;
    private final AmountReconciler amountReconciler;

    @Transactional
    public UpdateResult update(Long journalId, Map<String, ?> data) {
        TransactionJournal journal = journalRepository.findById(journalId)
            .orElseThrow(() -> new JournalNotFoundException(journalId));
        return update(journal, new JournalUpdateRequest(data));
    }

    @Transactional
    public UpdateResult update(TransactionJournal journal, JournalUpdateRequest request) {
        log.info("Updating journal #{} ({}) with {}", journal.getId(),
            journal.getTransactionType().getDisplayName(), request);

        String startHash = groupHasher.compareHash(journal);
        UpdateContext context = UpdateContext.of(journal, request, legResolver.resolve(journal));
        UpdateReport report = new UpdateReport();

        accountUpdater.apply(context, report);
        relationshipUpdater.updateBill(context, report);
        fieldPatcher.apply(context, report);
        journalRepository.save(journal);

        relationshipUpdater.updateCategory(context, report);
        relationshipUpdater.updateBudget(context, report);
        relationshipUpdater.updateTags(context, report);
        relationshipUpdater.updateReconciled(context, report);
        relationshipUpdater.updateNotes(context, report);
        metaUpdater.apply(context, report);

        currencyReconciler.apply(context, report);
        amountReconciler.updateAmount(context, report);
        amountReconciler.updateForeignAmount(context, report);
        journalRepository.save(journal);

        String endHash = groupHasher.compareHash(journal);
        boolean changed = !startHash.equals(endHash);
        UpdateResult result = new UpdateResult(journal.getId(), changed, report.getIssues());

        if (result.hasIssues()) {
            log.info("Journal #{} updated with {} issue(s), changed={}", journal.getId(),
                result.getIssues().size(), changed);
        } else {
            log.info("Journal #{} updated, changed={}", journal.getId(), changed);
        }
        return result;
    }
}
