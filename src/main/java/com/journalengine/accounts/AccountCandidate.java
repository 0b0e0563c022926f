package com.journalengine.accounts;

import lombok.Builder;
import lombok.Value;

/**
 * Identifying details of an account as submitted in an update request.
 * Any field may be null.
 */
@Value
@Builder
public class AccountCandidate {
    Long id;
    String name;
    String iban;
    String number;
    String bic;

    public static AccountCandidate of(Account account) {
        return AccountCandidate.builder()
            .id(account.getId())
            .name(account.getName())
            .build();
    }

    public static AccountCandidate named(String name) {
        return AccountCandidate.builder().name(name).build();
    }

    public boolean hasId() {
        return id != null && id > 0;
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }

    public boolean hasIban() {
        return iban != null && !iban.isBlank();
    }

    public boolean hasNumber() {
        return number != null && !number.isBlank();
    }
}
