package com.journalengine.journals;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A user-facing entry made of one or more journals (splits).
 */
@Entity
@Table(name = "transaction_groups", indexes = {
    @Index(name = "idx_groups_user_id", columnList = "user_id")
})
@Data
@NoArgsConstructor
public class TransactionGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(name = "user_id", nullable = false)
    private String userId;

    private String title;

    @Column(name = "created_at")
    private Instant createdAt;

    public TransactionGroup(String userId, String title) {
        this.userId = userId;
        this.title = title;
        this.createdAt = Instant.now();
    }
}
