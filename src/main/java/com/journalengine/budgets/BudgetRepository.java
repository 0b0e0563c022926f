package com.journalengine.budgets;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for budgets.
 */
@Repository
public interface BudgetRepository extends JpaRepository<Budget, Long> {

    Optional<Budget> findByIdAndUserId(Long id, String userId);

    Optional<Budget> findFirstByUserIdAndNameOrderByIdAsc(String userId, String name);
}
