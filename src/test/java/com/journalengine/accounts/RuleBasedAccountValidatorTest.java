package com.journalengine.accounts;

import com.journalengine.common.exception.AccountResolutionException;
import com.journalengine.journals.TransactionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RuleBasedAccountValidator.
 *
 * Repository lookups are mocked; unstubbed lookups find nothing.
 */
@ExtendWith(MockitoExtension.class)
class RuleBasedAccountValidatorTest {

    private static final String USER = "user-1";

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private AccountService accountService;

    private RuleBasedAccountValidator validator;

    @BeforeEach
    void setUp() {
        validator = new RuleBasedAccountValidator(accountRepository, accountService);
    }

    private static Account account(long id, String name, AccountType type) {
        Account account = new Account(USER, name, type);
        account.setId(id);
        return account;
    }

    @Test
    void testValidateSource_ById() {
        Account checking = account(1L, "Checking", AccountType.ASSET);
        when(accountRepository.findByIdAndUserId(1L, USER)).thenReturn(Optional.of(checking));

        assertTrue(validator.validateSource(USER, TransactionType.WITHDRAWAL,
            AccountCandidate.builder().id(1L).build()));
    }

    @Test
    void testValidateSource_WrongTypeById() {
        Account groceries = account(2L, "Groceries", AccountType.EXPENSE);
        when(accountRepository.findByIdAndUserId(2L, USER)).thenReturn(Optional.of(groceries));

        assertFalse(validator.validateSource(USER, TransactionType.WITHDRAWAL,
            AccountCandidate.builder().id(2L).build()));
    }

    @Test
    void testValidateSource_UnknownNameOnDepositCanBeCreated() {
        assertTrue(validator.validateSource(USER, TransactionType.DEPOSIT, AccountCandidate.named("New employer")));
        verify(accountService, never()).createAccount(any(), any(AccountCandidate.class), any());
    }

    @Test
    void testValidateSource_UnknownNameOnWithdrawal() {
        assertFalse(validator.validateSource(USER, TransactionType.WITHDRAWAL, AccountCandidate.named("Nowhere")));
    }

    @Test
    void testValidateDestination_DependsOnSourceType() {
        Account savings = account(3L, "Savings", AccountType.ASSET);
        Account mortgage = account(4L, "Mortgage", AccountType.MORTGAGE);
        when(accountRepository.findByIdAndUserId(3L, USER)).thenReturn(Optional.of(savings));

        AccountCandidate candidate = AccountCandidate.builder().id(3L).build();

        // deposits from a liability may only land on an asset account
        assertTrue(validator.validateDestination(USER, TransactionType.DEPOSIT, mortgage, candidate));
        assertFalse(validator.validateDestination(USER, TransactionType.WITHDRAWAL, mortgage, candidate));
    }

    @Test
    void testValidate_InvalidType() {
        assertFalse(validator.validateSource(USER, TransactionType.INVALID, AccountCandidate.named("Checking")));
        verifyNoInteractions(accountRepository);
    }

    @Test
    void testResolve_ByName() {
        Account checking = account(1L, "Checking", AccountType.ASSET);
        when(accountRepository.findByUserIdAndNameAndAccountTypeInOrderByIdAsc(eq(USER), eq("Checking"), any()))
            .thenReturn(List.of(checking));

        Account resolved = validator.resolveSource(USER, TransactionType.TRANSFER, AccountCandidate.named(" Checking "));

        assertSame(checking, resolved);
    }

    @Test
    void testResolve_ByIbanWhenNameMisses() {
        Account checking = account(1L, "Checking", AccountType.ASSET);
        when(accountRepository.findByUserIdAndIbanAndAccountTypeInOrderByIdAsc(eq(USER), eq("NL91ABNA0417164300"), any()))
            .thenReturn(List.of(checking));

        Account resolved = validator.resolveSource(USER, TransactionType.WITHDRAWAL,
            AccountCandidate.builder().name("Old name").iban("NL91ABNA0417164300").build());

        assertSame(checking, resolved);
    }

    @Test
    void testResolve_CreatesExpenseAccount() {
        Account checking = account(1L, "Checking", AccountType.ASSET);
        AccountCandidate candidate = AccountCandidate.named("Corner bakery");
        Account created = account(9L, "Corner bakery", AccountType.EXPENSE);
        when(accountService.createAccount(USER, candidate, AccountType.EXPENSE)).thenReturn(created);

        Account resolved = validator.resolveDestination(USER, TransactionType.WITHDRAWAL, checking, candidate);

        assertSame(created, resolved);
    }

    @Test
    void testResolveDestination_IgnoresAccountNotAllowedOppositeSource() {
        Account carLoan = account(1L, "Car loan", AccountType.LOAN);
        Account otherLoan = account(2L, "Other loan", AccountType.LOAN);
        when(accountRepository.findByIdAndUserId(2L, USER)).thenReturn(Optional.of(otherLoan));
        AccountCandidate candidate = AccountCandidate.builder().id(2L).name("Shop").build();
        Account shop = account(3L, "Shop", AccountType.EXPENSE);
        when(accountService.createAccount(USER, candidate, AccountType.EXPENSE)).thenReturn(shop);

        // a withdrawal from a loan may only go to an expense or cash account
        assertTrue(validator.validateDestination(USER, TransactionType.WITHDRAWAL, carLoan, candidate));
        Account resolved = validator.resolveDestination(USER, TransactionType.WITHDRAWAL, carLoan, candidate);

        assertSame(shop, resolved);
    }

    @Test
    void testResolveDestination_DepositNeverCreates() {
        Account mortgage = account(1L, "Mortgage", AccountType.MORTGAGE);

        assertThrows(AccountResolutionException.class, () -> validator.resolveDestination(USER,
            TransactionType.DEPOSIT, mortgage, AccountCandidate.named("New savings")));
        verifyNoInteractions(accountService);
    }

    @Test
    void testResolve_TransferNeverCreates() {
        Account checking = account(1L, "Checking", AccountType.ASSET);

        assertThrows(AccountResolutionException.class, () -> validator.resolveDestination(USER,
            TransactionType.TRANSFER, checking, AccountCandidate.named("Unknown")));
        verifyNoInteractions(accountService);
    }
}
