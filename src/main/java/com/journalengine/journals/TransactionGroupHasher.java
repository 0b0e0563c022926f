package com.journalengine.journals;

import com.journalengine.budgets.Budget;
import com.journalengine.categories.Category;
import com.journalengine.common.Amounts;
import com.journalengine.currencies.TransactionCurrency;
import com.journalengine.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Computes the compare hash of a transaction group: a SHA-256 digest of
 * everything observable about its journals and their legs. Two equal hashes
 * mean nothing observable changed in between.
 */
@Component
@RequiredArgsConstructor
public class TransactionGroupHasher {

    private final TransactionJournalRepository journalRepository;
    private final TransactionRepository transactionRepository;

    @Transactional(readOnly = true)
    public String compareHash(TransactionGroup group) {
        return digest(journalRepository.findByGroupIdOrderBySortOrderAscIdAsc(group.getId()));
    }

    /**
     * The compare hash of the journal's group, or of the journal alone when
     * it does not belong to a group.
     */
    @Transactional(readOnly = true)
    public String compareHash(TransactionJournal journal) {
        if (journal.getGroup() != null && journal.getGroup().getId() != null) {
            return compareHash(journal.getGroup());
        }
        return digest(List.of(journal));
    }

    private String digest(List<TransactionJournal> journals) {
        StringBuilder content = new StringBuilder();
        for (TransactionJournal journal : journals) {
            appendJournal(content, journal);
            for (Transaction leg : transactionRepository.findByJournalIdOrderByIdAsc(journal.getId())) {
                appendLeg(content, leg);
            }
        }
        return sha256(content.toString());
    }

    private void appendJournal(StringBuilder content, TransactionJournal journal) {
        content.append("journal|").append(journal.getId())
            .append('|').append(journal.getTransactionType())
            .append('|').append(journal.getDescription())
            .append('|').append(journal.getDate())
            .append('|').append(journal.getDateTz())
            .append('|').append(journal.getSortOrder())
            .append('|').append(code(journal.getCurrency()))
            .append('|').append(journal.getBill() == null ? "" : journal.getBill().getId())
            .append('|').append(journal.getCategories().stream().map(Category::getId)
                .filter(Objects::nonNull).sorted().map(String::valueOf).collect(Collectors.joining(",")))
            .append('|').append(journal.getBudgets().stream().map(Budget::getId)
                .filter(Objects::nonNull).sorted().map(String::valueOf).collect(Collectors.joining(",")))
            .append('|').append(journal.getTags().stream().map(Tag::getTag)
                .sorted().collect(Collectors.joining(",")))
            .append('\n');
    }

    private void appendLeg(StringBuilder content, Transaction leg) {
        content.append("leg|").append(leg.getId())
            .append('|').append(leg.getAccount() == null ? "" : leg.getAccount().getId())
            .append('|').append(Amounts.canonical(leg.getAmount()))
            .append('|').append(code(leg.getCurrency()))
            .append('|').append(code(leg.getForeignCurrency()))
            .append('|').append(Amounts.canonical(leg.getForeignAmount()))
            .append('|').append(leg.isReconciled())
            .append('\n');
    }

    private static String code(TransactionCurrency currency) {
        return currency == null ? "" : currency.getCode();
    }

    private static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
