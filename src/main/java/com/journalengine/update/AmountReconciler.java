package com.journalengine.update;

import com.journalengine.accounts.AccountType;
import com.journalengine.common.Amounts;
import com.journalengine.common.exception.InvalidAmountException;
import com.journalengine.currencies.CurrencyService;
import com.journalengine.currencies.TransactionCurrency;
import com.journalengine.journals.LegPair;
import com.journalengine.journals.Transaction;
import com.journalengine.journals.TransactionJournal;
import com.journalengine.journals.TransactionRepository;
import com.journalengine.journals.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

import static com.journalengine.update.JournalUpdateRequest.*;

/**
 * Writes the primary and foreign amounts of both legs.
 *
 * The source leg always carries the negative amount, the destination leg
 * the positive one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AmountReconciler {

    private static final String CLEAR_FOREIGN_AMOUNT = "0";

    private final CurrencyService currencyService;
    private final TransactionRepository transactionRepository;

    public void updateAmount(UpdateContext context, UpdateReport report) {
        JournalUpdateRequest request = context.getRequest();
        if (!request.has(AMOUNT)) {
            return;
        }
        BigDecimal amount;
        try {
            amount = Amounts.parseAmount(request.get(AMOUNT));
        } catch (InvalidAmountException e) {
            report.failed(UpdateStep.AMOUNT, AMOUNT, e.getMessage());
            return;
        }

        LegPair legs = context.getLegs();
        Transaction source = legs.getSource();
        Transaction destination = legs.getDestination();
        source.setAmount(Amounts.negative(amount));
        source.setBalanceDirty(true);
        destination.setAmount(Amounts.positive(amount));
        destination.setBalanceDirty(true);
        transactionRepository.save(source);
        transactionRepository.save(destination);
    }

    /**
     * For transfers and for asset/liability pairs the destination leg books
     * the foreign amount as its own amount, and keeps the source's primary
     * amount as its foreign amount.
     */
    public void updateForeignAmount(UpdateContext context, UpdateReport report) {
        JournalUpdateRequest request = context.getRequest();
        if (!request.hasAny(FOREIGN_CURRENCY_ID, FOREIGN_CURRENCY_CODE, FOREIGN_AMOUNT)) {
            return;
        }
        TransactionJournal journal = context.getJournal();
        LegPair legs = context.getLegs();
        Transaction source = legs.getSource();
        Transaction destination = legs.getDestination();

        BigDecimal foreignAmount = Amounts.parseForeignAmount(request.get(FOREIGN_AMOUNT));
        TransactionCurrency foreignCurrency = currencyService
            .findCurrencyNull(request.getLong(FOREIGN_CURRENCY_ID), request.getString(FOREIGN_CURRENCY_CODE))
            .orElse(source.getForeignCurrency());

        if (foreignCurrency != null && foreignCurrency.getId().equals(journal.getCurrency().getId())) {
            report.rejected(UpdateStep.FOREIGN_AMOUNT, FOREIGN_CURRENCY_ID,
                "Foreign currency cannot be the journal's own currency " + foreignCurrency.getCode());
            return;
        }

        if (foreignCurrency != null && foreignAmount != null) {
            source.setForeignCurrency(foreignCurrency);
            source.setForeignAmount(Amounts.negative(foreignAmount));

            if (journal.getTransactionType() == TransactionType.TRANSFER || isBetweenAssetAndLiability(legs)) {
                log.debug("Journal #{} books {} {} on the destination leg", journal.getId(),
                    foreignAmount, foreignCurrency.getCode());
                BigDecimal sourceAmount = Amounts.positive(source.getAmount());
                TransactionCurrency sourceCurrency = source.getCurrency();
                destination.setCurrency(foreignCurrency);
                destination.setAmount(Amounts.positive(foreignAmount));
                destination.setForeignAmount(sourceAmount);
                destination.setForeignCurrency(sourceCurrency);
                destination.setBalanceDirty(true);
            } else {
                destination.setForeignCurrency(foreignCurrency);
                destination.setForeignAmount(Amounts.positive(foreignAmount));
            }
            transactionRepository.save(source);
            transactionRepository.save(destination);
            return;
        }

        if (CLEAR_FOREIGN_AMOUNT.equals(request.getString(FOREIGN_AMOUNT))) {
            source.clearForeignAmount();
            destination.clearForeignAmount();
            transactionRepository.save(source);
            transactionRepository.save(destination);
            return;
        }

        report.skipped(UpdateStep.FOREIGN_AMOUNT, FOREIGN_AMOUNT,
            "A foreign amount needs both a foreign currency and a non-zero amount");
    }

    /**
     * Whether one leg is on an asset account and the other on a loan, debt
     * or mortgage, in either direction.
     */
    public boolean isBetweenAssetAndLiability(LegPair legs) {
        AccountType sourceType = legs.getSource().getAccount().getAccountType();
        AccountType destinationType = legs.getDestination().getAccount().getAccountType();
        return (sourceType.isLiability() && destinationType == AccountType.ASSET)
            || (destinationType.isLiability() && sourceType == AccountType.ASSET);
    }
}
