package com.journalengine.budgets;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A spending budget withdrawals can be assigned to.
 */
@Entity
@Table(name = "budgets", indexes = {
    @Index(name = "idx_budgets_user_id", columnList = "user_id")
})
@Data
@NoArgsConstructor
public class Budget {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(name = "user_id", nullable = false)
    private String userId;

    @NotBlank
    @Column(nullable = false)
    private String name;

    private boolean active = true;

    public Budget(String userId, String name) {
        this.userId = userId;
        this.name = name;
    }
}
