package com.journalengine.budgets;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Looks up a user's budgets.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetService {

    private final BudgetRepository budgetRepository;

    @Transactional
    public Budget createBudget(String userId, String name) {
        Budget budget = budgetRepository.save(new Budget(userId, name));
        log.info("Created budget #{} (\"{}\") for user {}", budget.getId(), name, userId);
        return budget;
    }

    /**
     * Finds a budget by id, then by name. Budgets are never created on the fly.
     */
    @Transactional(readOnly = true)
    public Optional<Budget> findBudget(String userId, Long budgetId, String budgetName) {
        if (budgetId != null && budgetId > 0) {
            Optional<Budget> byId = budgetRepository.findByIdAndUserId(budgetId, userId);
            if (byId.isPresent()) {
                return byId;
            }
        }
        if (budgetName != null && !budgetName.isBlank()) {
            return budgetRepository.findFirstByUserIdAndNameOrderByIdAsc(userId, budgetName.trim());
        }
        return Optional.empty();
    }
}
