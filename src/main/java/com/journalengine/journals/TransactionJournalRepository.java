package com.journalengine.journals;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for transaction journals.
 */
@Repository
public interface TransactionJournalRepository extends JpaRepository<TransactionJournal, Long> {

    List<TransactionJournal> findByGroupIdOrderBySortOrderAscIdAsc(Long groupId);
}
