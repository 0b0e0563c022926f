package com.journalengine.common.exception;

/**
 * Thrown when neither the currency id nor the currency code match a known currency.
 */
public class CurrencyNotFoundException extends JournalEngineException {

    public CurrencyNotFoundException(Long currencyId, String currencyCode) {
        super(String.format("Currency not found: id=%s, code=%s", currencyId, currencyCode));
    }
}
