package com.journalengine.accounts;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An account owned by a user. Journal legs point at accounts.
 */
@Entity
@Table(name = "accounts", indexes = {
    @Index(name = "idx_accounts_user_id", columnList = "user_id"),
    @Index(name = "idx_accounts_name", columnList = "name")
})
@Data
@NoArgsConstructor
public class Account {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(name = "user_id", nullable = false)
    private String userId;

    @NotBlank
    @Column(nullable = false)
    private String name;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false)
    private AccountType accountType;

    private String iban;

    @Column(name = "account_number")
    private String accountNumber;

    private String bic;

    private boolean active = true;

    @Column(name = "created_at")
    private Instant createdAt;

    public Account(String userId, String name, AccountType accountType) {
        this.userId = userId;
        this.name = name;
        this.accountType = accountType;
        this.createdAt = Instant.now();
    }
}
