package com.journalengine.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes journal audit events on the Spring application event bus.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditEventPublisher {

    private final ApplicationEventPublisher eventPublisher;

    public void record(JournalAuditEvent event) {
        log.debug("Audit: journal #{} {} \"{}\" -> \"{}\"", event.getJournalId(), event.getAction(),
            event.getBefore(), event.getAfter());
        eventPublisher.publishEvent(event);
    }
}
