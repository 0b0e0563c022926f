package com.journalengine.journals;

import com.journalengine.bills.Bill;
import com.journalengine.budgets.Budget;
import com.journalengine.categories.Category;
import com.journalengine.currencies.TransactionCurrency;
import com.journalengine.tags.Tag;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * One logical financial event, booked as exactly two legs
 * ({@link Transaction}) of opposite sign.
 */
@Entity
@Table(name = "transaction_journals", indexes = {
    @Index(name = "idx_journals_group_id", columnList = "group_id"),
    @Index(name = "idx_journals_user_id", columnList = "user_id")
})
@Data
@NoArgsConstructor
public class TransactionJournal {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(name = "user_id", nullable = false)
    private String userId;

    @ManyToOne
    @JoinColumn(name = "group_id")
    private TransactionGroup group;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false)
    private TransactionType transactionType;

    @NotNull
    @ManyToOne(optional = false)
    @JoinColumn(name = "transaction_currency_id", nullable = false)
    private TransactionCurrency currency;

    @ManyToOne
    @JoinColumn(name = "bill_id")
    private Bill bill;

    @NotBlank
    @Size(max = 1024)
    @Column(nullable = false, length = 1024)
    private String description;

    @NotNull
    @Column(name = "journal_date", nullable = false)
    private Instant date;

    @Column(name = "date_tz", length = 50)
    private String dateTz;

    @Column(name = "sort_order")
    private int sortOrder;

    @ManyToMany
    @JoinTable(name = "category_transaction_journal",
        joinColumns = @JoinColumn(name = "transaction_journal_id"),
        inverseJoinColumns = @JoinColumn(name = "category_id"))
    private Set<Category> categories = new HashSet<>();

    @ManyToMany
    @JoinTable(name = "budget_transaction_journal",
        joinColumns = @JoinColumn(name = "transaction_journal_id"),
        inverseJoinColumns = @JoinColumn(name = "budget_id"))
    private Set<Budget> budgets = new HashSet<>();

    @ManyToMany
    @JoinTable(name = "tag_transaction_journal",
        joinColumns = @JoinColumn(name = "transaction_journal_id"),
        inverseJoinColumns = @JoinColumn(name = "tag_id"))
    private Set<Tag> tags = new HashSet<>();

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public TransactionJournal(String userId, TransactionGroup group, TransactionType transactionType,
                              TransactionCurrency currency, String description, Instant date) {
        this.userId = userId;
        this.group = group;
        this.transactionType = transactionType;
        this.currency = currency;
        this.description = description;
        this.date = date;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
