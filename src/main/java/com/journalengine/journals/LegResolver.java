package com.journalengine.journals;

import com.journalengine.common.exception.LedgerIntegrityException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Finds the source (negative) and destination (positive) leg of a journal.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LegResolver {

    private final TransactionRepository transactionRepository;

    /**
     * @throws LedgerIntegrityException if the journal does not have exactly one
     *         negative and one positive leg
     */
    @Transactional(readOnly = true)
    public LegPair resolve(TransactionJournal journal) {
        List<Transaction> sources = transactionRepository.findByJournalIdAndAmountLessThan(
            journal.getId(), BigDecimal.ZERO);
        List<Transaction> destinations = transactionRepository.findByJournalIdAndAmountGreaterThan(
            journal.getId(), BigDecimal.ZERO);

        if (sources.size() != 1 || destinations.size() != 1) {
            log.error("Journal #{} has {} source and {} destination legs", journal.getId(),
                sources.size(), destinations.size());
            throw new LedgerIntegrityException(String.format(
                "Journal #%d must have exactly one source and one destination leg, found %d and %d",
                journal.getId(), sources.size(), destinations.size()));
        }
        return new LegPair(sources.get(0), destinations.get(0));
    }
}
