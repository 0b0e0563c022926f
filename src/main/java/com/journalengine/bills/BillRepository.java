package com.journalengine.bills;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for bills.
 */
@Repository
public interface BillRepository extends JpaRepository<Bill, Long> {

    Optional<Bill> findByIdAndUserId(Long id, String userId);

    Optional<Bill> findFirstByUserIdAndNameOrderByIdAsc(String userId, String name);
}
