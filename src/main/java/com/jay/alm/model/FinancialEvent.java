package com.jay.alm.model;

import com.jay.alm.model.enums.EventKind;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;

/**
 * One row of the chronological ledger. Amounts are in the reporting currency.
 * {@code runningNav} is the NAV after this event has been applied.
 */
@Builder(toBuilder = true)
public record FinancialEvent(
    Instant timestamp,
    EventKind kind,
    String symbol,
    String description,
    BigDecimal cashImpact,
    BigDecimal realizedPnl,
    BigDecimal commission,
    String currency,
    BigDecimal fxRate,
    String sourceTransactionId,
    String cashType,
    String linkedTransactionId,
    String linkedPositionId,
    BigDecimal runningNav,
    boolean synthetic
) {

    /** Ledger order: timestamp ascending, ties broken by transaction id. */
    public static final Comparator<FinancialEvent> LEDGER_ORDER =
        Comparator.comparing(FinancialEvent::timestamp)
            .thenComparing(FinancialEvent::sourceTransactionId);

    public BigDecimal navDelta() {
        return cashImpact.add(realizedPnl);
    }
}
