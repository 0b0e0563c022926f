package com.journalengine.accounts;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Service for managing accounts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;

    @Transactional
    public Account createAccount(String userId, String name, AccountType accountType) {
        return createAccount(userId, AccountCandidate.named(name), accountType);
    }

    /**
     * Creates an account from the identifying details of an update request.
     */
    @Transactional
    public Account createAccount(String userId, AccountCandidate candidate, AccountType accountType) {
        if (!candidate.hasName()) {
            throw new IllegalArgumentException("Cannot create an account without a name");
        }
        Account account = new Account(userId, candidate.getName().trim(), accountType);
        account.setIban(candidate.getIban());
        account.setAccountNumber(candidate.getNumber());
        account.setBic(candidate.getBic());
        accountRepository.save(account);
        log.info("Created {} account #{} (\"{}\") for user {}",
            accountType, account.getId(), account.getName(), userId);
        return account;
    }
}
