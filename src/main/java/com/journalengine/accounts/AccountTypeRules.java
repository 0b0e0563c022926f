package com.journalengine.accounts;

import com.journalengine.journals.TransactionType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.journalengine.accounts.AccountType.*;

/**
 * Which account types may be combined for each transaction type.
 *
 * For every transaction type the table lists the allowed source account
 * types and, per source type, the destination types it may book against.
 */
public final class AccountTypeRules {

    private static final Map<TransactionType, Map<AccountType, Set<AccountType>>> RULES =
        new EnumMap<>(TransactionType.class);

    static {
        Set<AccountType> liabilities = AccountType.liabilities();
        Set<AccountType> assetOrLiability = EnumSet.of(ASSET, LOAN, DEBT, MORTGAGE);

        Map<AccountType, Set<AccountType>> withdrawal = new EnumMap<>(AccountType.class);
        withdrawal.put(ASSET, EnumSet.of(EXPENSE, CASH, LOAN, DEBT, MORTGAGE));
        liabilities.forEach(type -> withdrawal.put(type, EnumSet.of(EXPENSE, CASH)));
        RULES.put(TransactionType.WITHDRAWAL, withdrawal);

        Map<AccountType, Set<AccountType>> deposit = new EnumMap<>(AccountType.class);
        deposit.put(REVENUE, assetOrLiability);
        deposit.put(CASH, assetOrLiability);
        liabilities.forEach(type -> deposit.put(type, EnumSet.of(ASSET)));
        RULES.put(TransactionType.DEPOSIT, deposit);

        Map<AccountType, Set<AccountType>> transfer = new EnumMap<>(AccountType.class);
        assetOrLiability.forEach(type -> transfer.put(type, assetOrLiability));
        RULES.put(TransactionType.TRANSFER, transfer);

        Map<AccountType, Set<AccountType>> openingBalance = new EnumMap<>(AccountType.class);
        openingBalance.put(INITIAL_BALANCE, assetOrLiability);
        assetOrLiability.forEach(type -> openingBalance.put(type, EnumSet.of(INITIAL_BALANCE)));
        RULES.put(TransactionType.OPENING_BALANCE, openingBalance);

        Map<AccountType, Set<AccountType>> reconciliation = new EnumMap<>(AccountType.class);
        reconciliation.put(AccountType.RECONCILIATION, EnumSet.of(ASSET));
        reconciliation.put(ASSET, EnumSet.of(AccountType.RECONCILIATION));
        RULES.put(TransactionType.RECONCILIATION, reconciliation);

        Map<AccountType, Set<AccountType>> liabilityCredit = new EnumMap<>(AccountType.class);
        liabilityCredit.put(AccountType.LIABILITY_CREDIT, liabilities);
        liabilities.forEach(type -> liabilityCredit.put(type, EnumSet.of(AccountType.LIABILITY_CREDIT)));
        RULES.put(TransactionType.LIABILITY_CREDIT, liabilityCredit);
    }

    private AccountTypeRules() {
    }

    public static Set<AccountType> sourceTypes(TransactionType type) {
        Map<AccountType, Set<AccountType>> rules = RULES.get(type);
        if (rules == null || rules.isEmpty()) {
            return Collections.emptySet();
        }
        return EnumSet.copyOf(rules.keySet());
    }

    /**
     * All destination types for the transaction type, regardless of source.
     */
    public static Set<AccountType> destinationTypes(TransactionType type) {
        Set<AccountType> result = EnumSet.noneOf(AccountType.class);
        Map<AccountType, Set<AccountType>> rules = RULES.get(type);
        if (rules != null) {
            rules.values().forEach(result::addAll);
        }
        return result;
    }

    /**
     * Destination types allowed opposite a source account of the given type.
     * A null source type allows every destination type of the transaction type.
     */
    public static Set<AccountType> destinationTypes(TransactionType type, AccountType sourceType) {
        if (sourceType == null) {
            return destinationTypes(type);
        }
        Map<AccountType, Set<AccountType>> rules = RULES.get(type);
        if (rules == null || !rules.containsKey(sourceType)) {
            return EnumSet.noneOf(AccountType.class);
        }
        return EnumSet.copyOf(rules.get(sourceType));
    }

    /**
     * The account type created when an unknown name is submitted, or null when
     * the role must refer to an existing account.
     */
    public static AccountType creatableType(TransactionType type, AccountRole role) {
        if (type == TransactionType.WITHDRAWAL && role == AccountRole.DESTINATION) {
            return EXPENSE;
        }
        if (type == TransactionType.DEPOSIT && role == AccountRole.SOURCE) {
            return REVENUE;
        }
        return null;
    }
}
