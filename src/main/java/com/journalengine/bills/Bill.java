package com.journalengine.bills;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A recurring expected payment that withdrawals can be linked to.
 */
@Entity
@Table(name = "bills", indexes = {
    @Index(name = "idx_bills_user_id", columnList = "user_id")
})
@Data
@NoArgsConstructor
public class Bill {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(name = "user_id", nullable = false)
    private String userId;

    @NotBlank
    @Column(nullable = false)
    private String name;

    @Column(name = "amount_min", precision = 32, scale = 12)
    private BigDecimal amountMin;

    @Column(name = "amount_max", precision = 32, scale = 12)
    private BigDecimal amountMax;

    private boolean active = true;

    public Bill(String userId, String name) {
        this.userId = userId;
        this.name = name;
    }
}
