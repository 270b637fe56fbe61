package com.jay.alm.model;

import com.jay.alm.model.enums.SummaryStatus;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One calendar day of the ledger in the reporting timezone.
 * {@code openingNav} is null when no prior closing and no reported opening exist.
 */
@Builder(toBuilder = true)
public record DailySummary(
    LocalDate date,
    BigDecimal openingNav,
    BigDecimal closingNav,
    BigDecimal totalPnl,
    BigDecimal netCashFlow,
    BigDecimal commissions,
    BigDecimal depositsBeforeOpen,
    int eventCount,
    SummaryStatus status,
    Boolean discrepancyFlag
) {
    /** Return base: opening NAV plus deposits posted before the market opened. */
    public BigDecimal adjustedOpeningNav() {
        return openingNav == null ? null : openingNav.add(depositsBeforeOpen);
    }

    public BigDecimal netPnl() {
        return totalPnl.subtract(commissions);
    }
}
