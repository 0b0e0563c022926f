package com.journalengine.currencies;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A currency amounts can be booked in.
 */
@Entity
@Table(name = "transaction_currencies", uniqueConstraints = {
    @UniqueConstraint(name = "uk_currencies_code", columnNames = "code")
})
@Data
@NoArgsConstructor
public class TransactionCurrency {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = 51)
    @Column(nullable = false)
    private String code;

    private String name;

    private String symbol;

    @Column(name = "decimal_places")
    private int decimalPlaces = 2;

    private boolean enabled = true;

    public TransactionCurrency(String code, String name, String symbol, int decimalPlaces) {
        this.code = code;
        this.name = name;
        this.symbol = symbol;
        this.decimalPlaces = decimalPlaces;
    }
}
