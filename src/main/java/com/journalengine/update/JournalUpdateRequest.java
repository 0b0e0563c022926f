package com.journalengine.update;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A sparse set of requested changes to one journal.
 *
 * Presence matters: a key that is present with an empty value asks for a
 * field to be cleared (where clearing is allowed), an absent key leaves the
 * field untouched.
 */
public class JournalUpdateRequest {

    public static final String TYPE = "type";
    public static final String SOURCE_ID = "source_id";
    public static final String SOURCE_NAME = "source_name";
    public static final String SOURCE_IBAN = "source_iban";
    public static final String SOURCE_NUMBER = "source_number";
    public static final String SOURCE_BIC = "source_bic";
    public static final String DESTINATION_ID = "destination_id";
    public static final String DESTINATION_NAME = "destination_name";
    public static final String DESTINATION_IBAN = "destination_iban";
    public static final String DESTINATION_NUMBER = "destination_number";
    public static final String DESTINATION_BIC = "destination_bic";
    public static final String DESCRIPTION = "description";
    public static final String DATE = "date";
    public static final String ORDER = "order";
    public static final String BILL_ID = "bill_id";
    public static final String BILL_NAME = "bill_name";
    public static final String CATEGORY_ID = "category_id";
    public static final String CATEGORY_NAME = "category_name";
    public static final String BUDGET_ID = "budget_id";
    public static final String BUDGET_NAME = "budget_name";
    public static final String TAGS = "tags";
    public static final String RECONCILED = "reconciled";
    public static final String NOTES = "notes";
    public static final String CURRENCY_ID = "currency_id";
    public static final String CURRENCY_CODE = "currency_code";
    public static final String AMOUNT = "amount";
    public static final String FOREIGN_CURRENCY_ID = "foreign_currency_id";
    public static final String FOREIGN_CURRENCY_CODE = "foreign_currency_code";
    public static final String FOREIGN_AMOUNT = "foreign_amount";

    private final Map<String, Object> data;

    public JournalUpdateRequest(Map<String, ?> data) {
        this.data = data == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(data));
    }

    public boolean has(String field) {
        return data.containsKey(field);
    }

    public boolean hasAny(String... fields) {
        return hasAny(Arrays.asList(fields));
    }

    public boolean hasAny(Collection<String> fields) {
        return fields.stream().anyMatch(data::containsKey);
    }

    public Object get(String field) {
        return data.get(field);
    }

    /**
     * String form of the value, or null when absent or null.
     */
    public String getString(String field) {
        Object value = data.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        return value.toString();
    }

    /**
     * String form of the value, with absent and null both read as "".
     */
    public String getStringOrEmpty(String field) {
        String value = getString(field);
        return value == null ? "" : value;
    }

    /**
     * The value as an id. Absent, blank and non-numeric values are null.
     */
    public Long getLong(String field) {
        Object value = data.get(field);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        try {
            return Long.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * The value if it is a genuine boolean, otherwise null. Strings such as
     * "true" do not count.
     */
    public Boolean getBoolean(String field) {
        Object value = data.get(field);
        return value instanceof Boolean ? (Boolean) value : null;
    }

    public Map<String, Object> asMap() {
        return data;
    }

    @Override
    public String toString() {
        return "JournalUpdateRequest" + data.keySet();
    }
}
