package com.journalengine.update;

import com.journalengine.audit.AuditEventPublisher;
import com.journalengine.audit.JournalAuditEvent;
import com.journalengine.common.DateParser;
import com.journalengine.common.exception.InvalidDateException;
import com.journalengine.config.DateTimeSettings;
import com.journalengine.journals.TransactionJournal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.ZonedDateTime;

import static com.journalengine.update.JournalUpdateRequest.*;

/**
 * Writes the plain journal fields: description, date and order.
 * Every applied change publishes an audit event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FieldPatcher {

    private static final int MAX_DESCRIPTION_LENGTH = 1024;

    private final DateTimeSettings dateTimeSettings;
    private final AuditEventPublisher auditEventPublisher;

    public void apply(UpdateContext context, UpdateReport report) {
        updateDescription(context, report);
        updateDate(context, report);
        updateOrder(context, report);
    }

    /**
     * A blank description is read as absent; a journal always keeps one.
     */
    private void updateDescription(UpdateContext context, UpdateReport report) {
        String value = context.getRequest().getString(DESCRIPTION);
        if (value == null || value.isBlank()) {
            return;
        }
        if (value.length() > MAX_DESCRIPTION_LENGTH) {
            report.failed(UpdateStep.FIELDS, DESCRIPTION, String.format(
                "Description is %d characters, at most %d are allowed", value.length(), MAX_DESCRIPTION_LENGTH));
            return;
        }
        TransactionJournal journal = context.getJournal();
        String before = journal.getDescription();
        journal.setDescription(value);
        audit(context, DESCRIPTION, before, value);
    }

    private void updateDate(UpdateContext context, UpdateReport report) {
        Object raw = context.getRequest().get(DATE);
        if (raw == null || raw.toString().isEmpty()) {
            return;
        }
        ZonedDateTime parsed;
        try {
            parsed = DateParser.parse(raw, dateTimeSettings.getApplicationZone());
        } catch (InvalidDateException e) {
            report.failed(UpdateStep.FIELDS, DATE, e.getMessage());
            return;
        }
        ZonedDateTime normalized = dateTimeSettings.normalize(parsed);

        TransactionJournal journal = context.getJournal();
        String before = journal.getDate() == null ? null : render(journal);
        journal.setDate(normalized.toInstant());
        journal.setDateTz(normalized.getZone().getId());
        audit(context, DATE, before, normalized);
    }

    private void updateOrder(UpdateContext context, UpdateReport report) {
        String value = context.getRequest().getString(ORDER);
        if (value == null || value.isEmpty()) {
            return;
        }
        int order;
        try {
            order = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            report.failed(UpdateStep.FIELDS, ORDER, "Order is not a whole number: " + value);
            return;
        }
        TransactionJournal journal = context.getJournal();
        int before = journal.getSortOrder();
        journal.setSortOrder(order);
        audit(context, ORDER, before, order);
    }

    private String render(TransactionJournal journal) {
        ZoneId zone = journal.getDateTz() == null
            ? dateTimeSettings.getApplicationZone()
            : ZoneId.of(journal.getDateTz());
        return journal.getDate().atZone(zone).toString();
    }

    private void audit(UpdateContext context, String field, Object before, Object after) {
        auditEventPublisher.record(JournalAuditEvent.fieldChanged(
            context.getUserId(), context.getJournal().getId(), field, before, after));
    }
}
