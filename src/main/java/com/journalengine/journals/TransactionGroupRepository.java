package com.journalengine.journals;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for transaction groups.
 */
@Repository
public interface TransactionGroupRepository extends JpaRepository<TransactionGroup, Long> {
}
