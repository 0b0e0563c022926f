package com.journalengine.currencies;

import com.journalengine.common.exception.CurrencyNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;

/**
 * Finds currencies by id or code.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CurrencyService {

    private final CurrencyRepository currencyRepository;

    @Transactional
    public TransactionCurrency create(String code, String name, String symbol, int decimalPlaces) {
        TransactionCurrency currency = new TransactionCurrency(code, name, symbol, decimalPlaces);
        currencyRepository.save(currency);
        log.info("Created currency #{} ({})", currency.getId(), code);
        return currency;
    }

    /**
     * Finds a currency by id, then by code. A disabled currency that is
     * found is enabled, since it is about to be used.
     *
     * @throws CurrencyNotFoundException if neither matches
     */
    @Transactional(noRollbackFor = CurrencyNotFoundException.class)
    public TransactionCurrency findCurrency(Long currencyId, String currencyCode) {
        TransactionCurrency currency = findCurrencyNull(currencyId, currencyCode)
            .orElseThrow(() -> new CurrencyNotFoundException(currencyId, currencyCode));
        if (!currency.isEnabled()) {
            log.info("Enabling currency {} because it is used in a journal", currency.getCode());
            currency.setEnabled(true);
            currencyRepository.save(currency);
        }
        return currency;
    }

    /**
     * Finds a currency by id, then by code, or nothing.
     */
    @Transactional(readOnly = true)
    public Optional<TransactionCurrency> findCurrencyNull(Long currencyId, String currencyCode) {
        if (currencyId != null && currencyId > 0) {
            Optional<TransactionCurrency> byId = currencyRepository.findById(currencyId);
            if (byId.isPresent()) {
                return byId;
            }
        }
        if (currencyCode != null && !currencyCode.isBlank()) {
            return currencyRepository.findByCode(currencyCode.trim().toUpperCase(Locale.ROOT));
        }
        return Optional.empty();
    }
}
