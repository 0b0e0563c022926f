package com.journalengine.update;

import com.journalengine.bills.BillService;
import com.journalengine.budgets.Budget;
import com.journalengine.budgets.BudgetService;
import com.journalengine.categories.Category;
import com.journalengine.categories.CategoryService;
import com.journalengine.journals.LegPair;
import com.journalengine.journals.TransactionJournal;
import com.journalengine.journals.TransactionRepository;
import com.journalengine.journals.TransactionType;
import com.journalengine.notes.NoteService;
import com.journalengine.tags.Tag;
import com.journalengine.tags.TagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

import static com.journalengine.update.JournalUpdateRequest.*;

/**
 * Links the journal to its bill, category, budget, tags and note, and sets
 * the reconciled flag of its legs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RelationshipUpdater {

    private final BillService billService;
    private final CategoryService categoryService;
    private final BudgetService budgetService;
    private final TagService tagService;
    private final NoteService noteService;
    private final TransactionRepository transactionRepository;

    /**
     * Only withdrawals carry a bill.
     */
    public void updateBill(UpdateContext context, UpdateReport report) {
        JournalUpdateRequest request = context.getRequest();
        if (!request.hasAny(BILL_ID, BILL_NAME)) {
            return;
        }
        TransactionJournal journal = context.getJournal();
        if (journal.getTransactionType() != TransactionType.WITHDRAWAL) {
            report.skipped(UpdateStep.BILL, BILL_ID, "Only withdrawals can be linked to a bill");
            return;
        }
        journal.setBill(billService.findBill(context.getUserId(), request.getLong(BILL_ID),
            request.getString(BILL_NAME)).orElse(null));
    }

    public void updateCategory(UpdateContext context, UpdateReport report) {
        JournalUpdateRequest request = context.getRequest();
        if (!request.hasAny(CATEGORY_ID, CATEGORY_NAME)) {
            return;
        }
        Optional<Category> category = categoryService.findOrCreate(context.getUserId(),
            request.getLong(CATEGORY_ID), request.getString(CATEGORY_NAME));

        Set<Category> categories = context.getJournal().getCategories();
        categories.clear();
        category.ifPresent(categories::add);
    }

    public void updateBudget(UpdateContext context, UpdateReport report) {
        JournalUpdateRequest request = context.getRequest();
        TransactionJournal journal = context.getJournal();
        Set<Budget> budgets = journal.getBudgets();

        if (request.hasAny(BUDGET_ID, BUDGET_NAME)) {
            Optional<Budget> budget = budgetService.findBudget(context.getUserId(),
                request.getLong(BUDGET_ID), request.getString(BUDGET_NAME));
            budgets.clear();
            budget.ifPresent(budgets::add);
        }

        if (journal.getTransactionType() == TransactionType.TRANSFER && !budgets.isEmpty()) {
            log.debug("Transfer #{} cannot have a budget, removing it", journal.getId());
            budgets.clear();
        }
    }

    /**
     * Replaces the tag set. Missing tags are created.
     */
    public void updateTags(UpdateContext context, UpdateReport report) {
        JournalUpdateRequest request = context.getRequest();
        if (!request.has(TAGS)) {
            return;
        }
        if (!(request.get(TAGS) instanceof Collection)) {
            report.skipped(UpdateStep.TAGS, TAGS, "Tags must be a list");
            return;
        }
        Set<Tag> tags = tagService.findOrCreateAll(context.getUserId(), (Collection<?>) request.get(TAGS));
        Set<Tag> current = context.getJournal().getTags();
        current.clear();
        current.addAll(tags);
    }

    public void updateReconciled(UpdateContext context, UpdateReport report) {
        JournalUpdateRequest request = context.getRequest();
        if (!request.has(RECONCILED)) {
            return;
        }
        Boolean reconciled = request.getBoolean(RECONCILED);
        if (reconciled == null) {
            report.skipped(UpdateStep.RECONCILED, RECONCILED, "Reconciled must be true or false");
            return;
        }
        LegPair legs = context.getLegs();
        legs.getSource().setReconciled(reconciled);
        legs.getDestination().setReconciled(reconciled);
        transactionRepository.save(legs.getSource());
        transactionRepository.save(legs.getDestination());
    }

    public void updateNotes(UpdateContext context, UpdateReport report) {
        JournalUpdateRequest request = context.getRequest();
        if (!request.has(NOTES)) {
            return;
        }
        noteService.storeNotes(context.getJournal(), request.getString(NOTES));
    }
}
