package com.jay.alm.layer1_ingest;

import com.jay.alm.config.AlmConfig;
import com.jay.alm.exception.MissingFxRateException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Resolves the rate converting an event's currency into the reporting currency.
 *
 * Lookup order:
 *   1. reporting currency → 1
 *   2. the rate carried on the record itself (PER_EVENT mode only)
 *   3. the latest configured historical rate on or before the event date
 *   4. the configured fixed rate
 * Anything else is a {@link MissingFxRateException}.
 */
@Service
@RequiredArgsConstructor
public class FxRateService {

    private final AlmConfig config;

    public BigDecimal rateFor(String currency, BigDecimal recordRate, LocalDate date) {
        String reporting = config.reporting().getCurrency();
        if (currency == null || currency.equalsIgnoreCase(reporting)) return BigDecimal.ONE;

        AlmConfig.Fx fx = config.fx();
        if (fx.getMode() == AlmConfig.FxMode.PER_EVENT && recordRate != null && recordRate.signum() > 0) {
            return recordRate;
        }
        Map<LocalDate, BigDecimal> history = fx.getHistoricalRates().get(currency.toUpperCase());
        if (history != null && !history.isEmpty()) {
            NavigableMap<LocalDate, BigDecimal> sorted = new TreeMap<>(history);
            Map.Entry<LocalDate, BigDecimal> entry = sorted.floorEntry(date);
            if (entry != null) return entry.getValue();
        }
        BigDecimal fixed = fx.getFixedRates().get(currency.toUpperCase());
        if (fixed != null) return fixed;
        throw new MissingFxRateException(currency, reporting, date);
    }
}
