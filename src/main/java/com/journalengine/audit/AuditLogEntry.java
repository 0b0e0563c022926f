package com.journalengine.audit;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted record of a journal field change.
 * Audit entries are append-only.
 */
@Entity
@Table(name = "audit_log_entries", indexes = {
    @Index(name = "idx_audit_journal_id", columnList = "transaction_journal_id"),
    @Index(name = "idx_audit_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
public class AuditLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "transaction_journal_id", nullable = false)
    private Long journalId;

    @Column(nullable = false)
    private String action;

    @Column(name = "before_value", length = 1024)
    private String before;

    @Column(name = "after_value", length = 1024)
    private String after;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static AuditLogEntry from(JournalAuditEvent event) {
        AuditLogEntry entry = new AuditLogEntry();
        entry.userId = event.getUserId();
        entry.journalId = event.getJournalId();
        entry.action = event.getAction();
        entry.before = event.getBefore();
        entry.after = event.getAfter();
        entry.createdAt = event.getOccurredAt();
        return entry;
    }
}
