package com.journalengine.meta;

import java.util.List;

/**
 * The metadata names an update request may carry.
 */
public final class MetaFields {

    public static final List<String> STRING_FIELDS = List.of(
        "sepa_cc",
        "sepa_ct_op",
        "sepa_ct_id",
        "sepa_db",
        "sepa_country",
        "sepa_ep",
        "sepa_ci",
        "sepa_batch_id",
        "recurrence_id",
        "internal_reference",
        "bunq_payment_id",
        "external_id",
        "external_url"
    );

    public static final List<String> DATE_FIELDS = List.of(
        "interest_date",
        "book_date",
        "process_date",
        "due_date",
        "payment_date",
        "invoice_date"
    );

    private MetaFields() {
    }

    /**
     * Name of the entry holding the timezone of a date field.
     */
    public static String timezoneField(String dateField) {
        return dateField + "_tz";
    }
}
