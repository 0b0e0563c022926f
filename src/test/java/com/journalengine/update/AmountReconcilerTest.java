package com.journalengine.update;

import com.journalengine.accounts.Account;
import com.journalengine.accounts.AccountType;
import com.journalengine.currencies.CurrencyService;
import com.journalengine.currencies.TransactionCurrency;
import com.journalengine.journals.LegPair;
import com.journalengine.journals.Transaction;
import com.journalengine.journals.TransactionJournal;
import com.journalengine.journals.TransactionRepository;
import com.journalengine.journals.TransactionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AmountReconciler.
 *
 * Covers the sign rules of the primary amount and the three foreign amount
 * layouts: plain, moved to the destination leg, and cleared.
 */
@ExtendWith(MockitoExtension.class)
class AmountReconcilerTest {

    @Mock
    private CurrencyService currencyService;

    @Mock
    private TransactionRepository transactionRepository;

    private AmountReconciler reconciler;
    private TransactionCurrency euro;
    private TransactionCurrency dollar;

    @BeforeEach
    void setUp() {
        reconciler = new AmountReconciler(currencyService, transactionRepository);
        euro = currency(1L, "EUR");
        dollar = currency(2L, "USD");
    }

    private static TransactionCurrency currency(long id, String code) {
        TransactionCurrency currency = new TransactionCurrency(code, code, code, 2);
        currency.setId(id);
        return currency;
    }

    private static Account account(long id, AccountType type) {
        Account account = new Account("user-1", type.name(), type);
        account.setId(id);
        return account;
    }

    private UpdateContext context(TransactionType type, AccountType sourceType, AccountType destinationType,
                                  Map<String, Object> data) {
        TransactionJournal journal = new TransactionJournal("user-1", null, type, euro, "Journal",
            Instant.parse("2024-01-15T10:00:00Z"));
        journal.setId(1L);
        Transaction source = new Transaction(journal, account(10L, sourceType), new BigDecimal("-100"), euro);
        Transaction destination = new Transaction(journal, account(11L, destinationType), new BigDecimal("100"), euro);
        return UpdateContext.of(journal, new JournalUpdateRequest(data), new LegPair(source, destination));
    }

    @Test
    void testUpdateAmount() {
        UpdateContext context = context(TransactionType.WITHDRAWAL, AccountType.ASSET, AccountType.EXPENSE,
            Map.of("amount", "7.5"));
        UpdateReport report = new UpdateReport();

        reconciler.updateAmount(context, report);

        assertEquals(0, new BigDecimal("-7.5").compareTo(context.getLegs().getSource().getAmount()));
        assertEquals(0, new BigDecimal("7.5").compareTo(context.getLegs().getDestination().getAmount()));
        assertTrue(report.getIssues().isEmpty());
        verify(transactionRepository, times(2)).save(any(Transaction.class));
    }

    @Test
    void testUpdateAmount_NotANumber() {
        UpdateContext context = context(TransactionType.WITHDRAWAL, AccountType.ASSET, AccountType.EXPENSE,
            Map.of("amount", "ten"));
        UpdateReport report = new UpdateReport();

        reconciler.updateAmount(context, report);

        assertEquals(UpdateOutcome.FAILED, report.getIssues().get(0).getOutcome());
        assertEquals(0, new BigDecimal("100").compareTo(context.getLegs().getDestination().getAmount()));
        verifyNoInteractions(transactionRepository);
    }

    @Test
    void testForeignAmount_Withdrawal() {
        UpdateContext context = context(TransactionType.WITHDRAWAL, AccountType.ASSET, AccountType.EXPENSE,
            Map.of("foreign_currency_code", "USD", "foreign_amount", "-110"));
        when(currencyService.findCurrencyNull(isNull(), eq("USD"))).thenReturn(Optional.of(dollar));

        reconciler.updateForeignAmount(context, new UpdateReport());

        Transaction source = context.getLegs().getSource();
        Transaction destination = context.getLegs().getDestination();
        assertEquals(0, new BigDecimal("-110").compareTo(source.getForeignAmount()));
        assertSame(dollar, destination.getForeignCurrency());
        assertEquals(0, new BigDecimal("110").compareTo(destination.getForeignAmount()));
        assertSame(euro, destination.getCurrency());
    }

    @Test
    void testForeignAmount_LiabilityToAssetMovesToDestination() {
        UpdateContext context = context(TransactionType.DEPOSIT, AccountType.LOAN, AccountType.ASSET,
            Map.of("foreign_currency_id", 2L, "foreign_amount", "95"));
        when(currencyService.findCurrencyNull(eq(2L), isNull())).thenReturn(Optional.of(dollar));

        reconciler.updateForeignAmount(context, new UpdateReport());

        Transaction destination = context.getLegs().getDestination();
        assertSame(dollar, destination.getCurrency());
        assertEquals(0, new BigDecimal("95").compareTo(destination.getAmount()));
        assertSame(euro, destination.getForeignCurrency());
        assertEquals(0, new BigDecimal("100").compareTo(destination.getForeignAmount()));
        assertTrue(destination.isBalanceDirty());
    }

    @Test
    void testForeignAmount_UsesExistingForeignCurrency() {
        UpdateContext context = context(TransactionType.WITHDRAWAL, AccountType.ASSET, AccountType.EXPENSE,
            Map.of("foreign_amount", "50"));
        context.getLegs().getSource().setForeignCurrency(dollar);
        when(currencyService.findCurrencyNull(null, null)).thenReturn(Optional.empty());

        reconciler.updateForeignAmount(context, new UpdateReport());

        assertEquals(0, new BigDecimal("50").compareTo(context.getLegs().getDestination().getForeignAmount()));
    }

    @Test
    void testForeignAmount_ZeroClears() {
        UpdateContext context = context(TransactionType.WITHDRAWAL, AccountType.ASSET, AccountType.EXPENSE,
            Map.of("foreign_amount", "0"));
        Transaction source = context.getLegs().getSource();
        source.setForeignCurrency(dollar);
        source.setForeignAmount(new BigDecimal("-110"));
        when(currencyService.findCurrencyNull(null, null)).thenReturn(Optional.empty());
        UpdateReport report = new UpdateReport();

        reconciler.updateForeignAmount(context, report);

        assertNull(source.getForeignCurrency());
        assertNull(source.getForeignAmount());
        assertTrue(report.getIssues().isEmpty());
    }

    @Test
    void testForeignAmount_SameCurrencyAsJournal() {
        UpdateContext context = context(TransactionType.WITHDRAWAL, AccountType.ASSET, AccountType.EXPENSE,
            Map.of("foreign_currency_code", "EUR", "foreign_amount", "10"));
        when(currencyService.findCurrencyNull(isNull(), eq("EUR"))).thenReturn(Optional.of(euro));
        UpdateReport report = new UpdateReport();

        reconciler.updateForeignAmount(context, report);

        assertEquals(UpdateOutcome.REJECTED, report.getIssues().get(0).getOutcome());
        assertNull(context.getLegs().getSource().getForeignAmount());
        verifyNoInteractions(transactionRepository);
    }

    @Test
    void testIsBetweenAssetAndLiability() {
        assertTrue(reconciler.isBetweenAssetAndLiability(
            context(TransactionType.WITHDRAWAL, AccountType.ASSET, AccountType.DEBT, Map.of()).getLegs()));
        assertTrue(reconciler.isBetweenAssetAndLiability(
            context(TransactionType.DEPOSIT, AccountType.MORTGAGE, AccountType.ASSET, Map.of()).getLegs()));
        assertFalse(reconciler.isBetweenAssetAndLiability(
            context(TransactionType.WITHDRAWAL, AccountType.ASSET, AccountType.EXPENSE, Map.of()).getLegs()));
        assertFalse(reconciler.isBetweenAssetAndLiability(
            context(TransactionType.TRANSFER, AccountType.LOAN, AccountType.DEBT, Map.of()).getLegs()));
    }
}
