package com.journalengine.currencies;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for currencies.
 */
@Repository
public interface CurrencyRepository extends JpaRepository<TransactionCurrency, Long> {

    Optional<TransactionCurrency> findByCode(String code);
}
