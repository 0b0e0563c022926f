package com.journalengine.update;

import com.journalengine.accounts.Account;
import com.journalengine.accounts.AccountType;
import com.journalengine.audit.AuditEventPublisher;
import com.journalengine.audit.JournalAuditEvent;
import com.journalengine.config.DateTimeSettings;
import com.journalengine.currencies.TransactionCurrency;
import com.journalengine.journals.LegPair;
import com.journalengine.journals.Transaction;
import com.journalengine.journals.TransactionJournal;
import com.journalengine.journals.TransactionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FieldPatcherTest {

    private static final ZoneId AMSTERDAM = ZoneId.of("Europe/Amsterdam");

    @Mock
    private AuditEventPublisher auditEventPublisher;

    private TransactionJournal journal;
    private LegPair legs;

    @BeforeEach
    void setUp() {
        TransactionCurrency euro = new TransactionCurrency("EUR", "Euro", "€", 2);
        journal = new TransactionJournal("user-1", null, TransactionType.WITHDRAWAL, euro, "Lunch",
            Instant.parse("2024-01-15T10:00:00Z"));
        journal.setId(3L);
        journal.setDateTz("UTC");
        legs = new LegPair(
            new Transaction(journal, new Account("user-1", "Checking", AccountType.ASSET), new BigDecimal("-5"), euro),
            new Transaction(journal, new Account("user-1", "Cafe", AccountType.EXPENSE), new BigDecimal("5"), euro));
    }

    private UpdateContext context(Map<String, Object> data) {
        return UpdateContext.of(journal, new JournalUpdateRequest(data), legs);
    }

    @Test
    void testDateInApplicationZone() {
        FieldPatcher patcher = new FieldPatcher(DateTimeSettings.of(AMSTERDAM, false), auditEventPublisher);

        patcher.apply(context(Map.of("date", "2024-06-01T09:30:00")), new UpdateReport());

        assertEquals(Instant.parse("2024-06-01T07:30:00Z"), journal.getDate());
        assertEquals("Europe/Amsterdam", journal.getDateTz());
    }

    @Test
    void testDateForcedToUtc() {
        FieldPatcher patcher = new FieldPatcher(DateTimeSettings.of(AMSTERDAM, true), auditEventPublisher);

        patcher.apply(context(Map.of("date", "2024-06-01T09:30:00")), new UpdateReport());

        assertEquals(Instant.parse("2024-06-01T07:30:00Z"), journal.getDate());
        assertEquals("UTC", journal.getDateTz());
    }

    @Test
    void testAuditEvents() {
        FieldPatcher patcher = new FieldPatcher(DateTimeSettings.of(AMSTERDAM, false), auditEventPublisher);

        patcher.apply(context(Map.of("description", "Dinner", "order", "2")), new UpdateReport());

        ArgumentCaptor<JournalAuditEvent> captor = ArgumentCaptor.forClass(JournalAuditEvent.class);
        verify(auditEventPublisher, times(2)).record(captor.capture());
        assertEquals("update_description", captor.getAllValues().get(0).getAction());
        assertEquals("Lunch", captor.getAllValues().get(0).getBefore());
        assertEquals("update_order", captor.getAllValues().get(1).getAction());
        assertEquals("0", captor.getAllValues().get(1).getBefore());
        assertEquals("2", captor.getAllValues().get(1).getAfter());
    }

    @Test
    void testBadOrder() {
        FieldPatcher patcher = new FieldPatcher(DateTimeSettings.of(AMSTERDAM, false), auditEventPublisher);
        UpdateReport report = new UpdateReport();

        patcher.apply(context(Map.of("order", "first")), report);

        assertEquals(0, journal.getSortOrder());
        UpdateIssue issue = report.getIssues().get(0);
        assertEquals(UpdateStep.FIELDS, issue.getStep());
        assertEquals("order", issue.getField());
        assertEquals(UpdateOutcome.FAILED, issue.getOutcome());
        verifyNoInteractions(auditEventPublisher);
    }
}
