package com.journalengine.accounts;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for account persistence.
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, Long> {

    Optional<Account> findByIdAndUserId(Long id, String userId);

    List<Account> findByUserIdAndNameAndAccountTypeInOrderByIdAsc(String userId, String name,
                                                                  Collection<AccountType> accountTypes);

    List<Account> findByUserIdAndIbanAndAccountTypeInOrderByIdAsc(String userId, String iban,
                                                                  Collection<AccountType> accountTypes);

    List<Account> findByUserIdAndAccountNumberAndAccountTypeInOrderByIdAsc(String userId, String accountNumber,
                                                                           Collection<AccountType> accountTypes);

    List<Account> findByUserId(String userId);
}
