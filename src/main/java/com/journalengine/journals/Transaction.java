package com.journalengine.journals;

import com.journalengine.accounts.Account;
import com.journalengine.currencies.TransactionCurrency;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One leg of a journal: a signed amount booked on one account.
 *
 * A negative amount marks the source leg, a positive amount the destination leg.
 */
@Entity
@Table(name = "transactions", indexes = {
    @Index(name = "idx_transactions_journal_id", columnList = "transaction_journal_id"),
    @Index(name = "idx_transactions_account_id", columnList = "account_id")
})
@Data
@NoArgsConstructor
public class Transaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @ManyToOne(optional = false)
    @JoinColumn(name = "transaction_journal_id", nullable = false)
    private TransactionJournal journal;

    @NotNull
    @ManyToOne(optional = false)
    @JoinColumn(name = "account_id", nullable = false)
    private Account account;

    @NotNull
    @Column(nullable = false, precision = 32, scale = 12)
    private BigDecimal amount;

    @NotNull
    @ManyToOne(optional = false)
    @JoinColumn(name = "transaction_currency_id", nullable = false)
    private TransactionCurrency currency;

    @ManyToOne
    @JoinColumn(name = "foreign_currency_id")
    private TransactionCurrency foreignCurrency;

    @Column(name = "foreign_amount", precision = 32, scale = 12)
    private BigDecimal foreignAmount;

    private boolean reconciled;

    /**
     * Set whenever the amount changes, so cached account balances get recomputed.
     */
    @Column(name = "balance_dirty")
    private boolean balanceDirty;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Transaction(TransactionJournal journal, Account account, BigDecimal amount,
                       TransactionCurrency currency) {
        this.journal = journal;
        this.account = account;
        this.amount = amount;
        this.currency = currency;
        this.updatedAt = Instant.now();
    }

    public void clearForeignAmount() {
        this.foreignCurrency = null;
        this.foreignAmount = null;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
