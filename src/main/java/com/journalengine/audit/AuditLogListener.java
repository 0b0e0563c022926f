package com.journalengine.audit;

import lombok.RequiredArgsConstructor;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Stores every published {@link JournalAuditEvent} in the audit log.
 * Runs inside the publishing transaction, so audit rows commit or roll
 * back together with the change they describe.
 */
@Component
@RequiredArgsConstructor
public class AuditLogListener {

    private final AuditLogRepository auditLogRepository;

    @EventListener
    public void onJournalAuditEvent(JournalAuditEvent event) {
        auditLogRepository.save(AuditLogEntry.from(event));
    }
}
