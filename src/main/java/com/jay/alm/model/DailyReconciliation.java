package com.jay.alm.model;

import com.jay.alm.model.enums.SummaryStatus;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Per-day reconciliation record consumed by downstream formatters.
 * Reported values and returns are null where the inputs were unavailable.
 */
@Builder
public record DailyReconciliation(
    LocalDate date,
    BigDecimal openingNav,
    BigDecimal closingNav,
    BigDecimal totalPnl,
    BigDecimal netCashFlow,
    BigDecimal reportedClosingNav,
    BigDecimal discrepancy,
    BigDecimal tolerance,
    BigDecimal naiveReturnPct,
    BigDecimal correctReturnPct,
    SummaryStatus status,
    List<Finding> violations
) {
    public boolean failed() {
        return status == SummaryStatus.FAILED;
    }
}
