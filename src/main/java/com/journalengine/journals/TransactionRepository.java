package com.journalengine.journals;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

/**
 * Repository for journal legs.
 */
@Repository
public interface TransactionRepository extends JpaRepository<Transaction, Long> {

    List<Transaction> findByJournalIdOrderByIdAsc(Long journalId);

    List<Transaction> findByJournalIdAndAmountLessThan(Long journalId, BigDecimal amount);

    List<Transaction> findByJournalIdAndAmountGreaterThan(Long journalId, BigDecimal amount);
}
