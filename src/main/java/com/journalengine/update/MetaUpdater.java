package com.journalengine.update;

import com.journalengine.common.DateParser;
import com.journalengine.common.exception.InvalidDateException;
import com.journalengine.config.DateTimeSettings;
import com.journalengine.journals.TransactionJournal;
import com.journalengine.meta.JournalMetaService;
import com.journalengine.meta.MetaFields;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes the free-form string and date metadata of a journal.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetaUpdater {

    private final JournalMetaService metaService;
    private final DateTimeSettings dateTimeSettings;

    public void apply(UpdateContext context, UpdateReport report) {
        updateMetaFields(context);
        updateMetaDates(context, report);
    }

    private void updateMetaFields(UpdateContext context) {
        JournalUpdateRequest request = context.getRequest();
        for (String field : MetaFields.STRING_FIELDS) {
            if (request.has(field)) {
                metaService.updateOrCreate(context.getJournal(), field, request.getString(field));
            }
        }
    }

    /**
     * Stops at the first date that cannot be parsed. Dates before it in
     * {@link MetaFields#DATE_FIELDS} have already been written.
     */
    private void updateMetaDates(UpdateContext context, UpdateReport report) {
        JournalUpdateRequest request = context.getRequest();
        TransactionJournal journal = context.getJournal();
        for (String field : MetaFields.DATE_FIELDS) {
            if (!request.has(field)) {
                continue;
            }
            String value = request.getStringOrEmpty(field);
            if (value.isEmpty()) {
                metaService.updateOrCreate(journal, field, null);
                metaService.updateOrCreate(journal, MetaFields.timezoneField(field), null);
                continue;
            }
            ZonedDateTime date;
            try {
                date = DateParser.parse(request.get(field), dateTimeSettings.getApplicationZone());
            } catch (InvalidDateException e) {
                report.failed(UpdateStep.META, field, e.getMessage());
                return;
            }
            metaService.updateOrCreate(journal, field, date.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
            metaService.updateOrCreate(journal, MetaFields.timezoneField(field), date.getZone().getId());
        }
    }
}
