package com.journalengine.accounts;

import com.journalengine.common.exception.AccountResolutionException;
import com.journalengine.journals.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Account validator backed by {@link AccountTypeRules}.
 *
 * Lookup order for both validation and resolution:
 * 1. account id, owned by the user and of an allowed type
 * 2. exact name among accounts of an allowed type
 * 3. IBAN, then account number, among accounts of an allowed type
 * 4. creation by name, for the roles where the rules allow it
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RuleBasedAccountValidator implements AccountValidator {

    private final AccountRepository accountRepository;
    private final AccountService accountService;

    @Override
    @Transactional(readOnly = true)
    public boolean validateSource(String userId, TransactionType type, AccountCandidate candidate) {
        Set<AccountType> allowed = AccountTypeRules.sourceTypes(type);
        boolean result = isAcceptable(userId, type, AccountRole.SOURCE, allowed, candidate);
        log.debug("validateSource({}, {}) for {} returns {}", candidate.getId(), candidate.getName(),
            type.getDisplayName(), result);
        return result;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean validateDestination(String userId, TransactionType type, Account source,
                                       AccountCandidate candidate) {
        AccountType sourceType = source == null ? null : source.getAccountType();
        Set<AccountType> allowed = AccountTypeRules.destinationTypes(type, sourceType);
        boolean result = isAcceptable(userId, type, AccountRole.DESTINATION, allowed, candidate);
        log.debug("validateDestination({}, {}) for {} opposite {} returns {}", candidate.getId(),
            candidate.getName(), type.getDisplayName(), sourceType, result);
        return result;
    }

    @Override
    @Transactional(noRollbackFor = AccountResolutionException.class)
    public Account resolveSource(String userId, TransactionType type, AccountCandidate candidate) {
        return resolve(userId, type, AccountRole.SOURCE, AccountTypeRules.sourceTypes(type), candidate);
    }

    @Override
    @Transactional(noRollbackFor = AccountResolutionException.class)
    public Account resolveDestination(String userId, TransactionType type, Account source,
                                      AccountCandidate candidate) {
        AccountType sourceType = source == null ? null : source.getAccountType();
        return resolve(userId, type, AccountRole.DESTINATION,
            AccountTypeRules.destinationTypes(type, sourceType), candidate);
    }

    private Account resolve(String userId, TransactionType type, AccountRole role, Set<AccountType> allowed,
                            AccountCandidate candidate) {
        Optional<Account> existing = findExisting(userId, allowed, candidate);
        if (existing.isPresent()) {
            return existing.get();
        }

        AccountType creatable = AccountTypeRules.creatableType(type, role);
        if (creatable != null && allowed.contains(creatable) && candidate.hasName()) {
            return accountService.createAccount(userId, candidate, creatable);
        }
        throw new AccountResolutionException(String.format(
            "No %s account for a %s matches id=%s, name=%s", role.name().toLowerCase(),
            type.getDisplayName().toLowerCase(), candidate.getId(), candidate.getName()));
    }

    private boolean isAcceptable(String userId, TransactionType type, AccountRole role,
                                 Set<AccountType> allowed, AccountCandidate candidate) {
        if (allowed.isEmpty()) {
            return false;
        }
        if (findExisting(userId, allowed, candidate).isPresent()) {
            return true;
        }
        AccountType creatable = AccountTypeRules.creatableType(type, role);
        return creatable != null && allowed.contains(creatable) && candidate.hasName();
    }

    private Optional<Account> findExisting(String userId, Set<AccountType> allowed, AccountCandidate candidate) {
        if (allowed.isEmpty()) {
            return Optional.empty();
        }
        if (candidate.hasId()) {
            Optional<Account> byId = accountRepository.findByIdAndUserId(candidate.getId(), userId)
                .filter(account -> allowed.contains(account.getAccountType()));
            if (byId.isPresent()) {
                return byId;
            }
        }
        if (candidate.hasName()) {
            List<Account> byName = accountRepository.findByUserIdAndNameAndAccountTypeInOrderByIdAsc(
                userId, candidate.getName().trim(), allowed);
            if (!byName.isEmpty()) {
                return Optional.of(byName.get(0));
            }
        }
        if (candidate.hasIban()) {
            List<Account> byIban = accountRepository.findByUserIdAndIbanAndAccountTypeInOrderByIdAsc(
                userId, candidate.getIban().trim(), allowed);
            if (!byIban.isEmpty()) {
                return Optional.of(byIban.get(0));
            }
        }
        if (candidate.hasNumber()) {
            List<Account> byNumber = accountRepository.findByUserIdAndAccountNumberAndAccountTypeInOrderByIdAsc(
                userId, candidate.getNumber().trim(), allowed);
            if (!byNumber.isEmpty()) {
                return Optional.of(byNumber.get(0));
            }
        }
        return Optional.empty();
    }
}
