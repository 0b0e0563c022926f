package com.journalengine.audit;

import lombok.Value;

import java.time.Instant;

/**
 * A single field change on a journal, raised while the journal is updated.
 */
@Value
public class JournalAuditEvent {
    String userId;
    Long journalId;
    String action;
    String before;
    String after;
    Instant occurredAt;

    public static JournalAuditEvent fieldChanged(String userId, Long journalId, String field,
                                                Object before, Object after) {
        return new JournalAuditEvent(
            userId,
            journalId,
            "update_" + field,
            before == null ? null : before.toString(),
            after == null ? null : after.toString(),
            Instant.now()
        );
    }
}
