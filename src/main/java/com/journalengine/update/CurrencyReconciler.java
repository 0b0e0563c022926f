package com.journalengine.update;

import com.journalengine.common.exception.CurrencyNotFoundException;
import com.journalengine.currencies.CurrencyService;
import com.journalengine.currencies.TransactionCurrency;
import com.journalengine.journals.LegPair;
import com.journalengine.journals.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.journalengine.update.JournalUpdateRequest.CURRENCY_CODE;
import static com.journalengine.update.JournalUpdateRequest.CURRENCY_ID;

/**
 * Moves the journal and both legs to another primary currency.
 * Amounts are not converted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CurrencyReconciler {

    private final CurrencyService currencyService;
    private final TransactionRepository transactionRepository;

    public void apply(UpdateContext context, UpdateReport report) {
        JournalUpdateRequest request = context.getRequest();
        if (!request.hasAny(CURRENCY_ID, CURRENCY_CODE)) {
            return;
        }
        TransactionCurrency currency;
        try {
            currency = currencyService.findCurrency(request.getLong(CURRENCY_ID), request.getString(CURRENCY_CODE));
        } catch (CurrencyNotFoundException e) {
            report.failed(UpdateStep.CURRENCY, CURRENCY_ID, e.getMessage());
            return;
        }

        context.getJournal().setCurrency(currency);
        LegPair legs = context.getLegs();
        legs.getSource().setCurrency(currency);
        legs.getDestination().setCurrency(currency);
        transactionRepository.save(legs.getSource());
        transactionRepository.save(legs.getDestination());
        log.debug("Journal #{} now in {}", context.getJournal().getId(), currency.getCode());
    }
}
