package com.jay.alm.model;

import com.jay.alm.model.enums.SourceType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Broker-reported change in NAV over [fromDate, toDate].
 * Values are in the account's base currency.
 */
@Builder(toBuilder = true)
public record NavSnapshot(
    LocalDate fromDate,
    LocalDate toDate,
    BigDecimal startingValue,
    BigDecimal endingValue,
    BigDecimal depositsWithdrawals,
    BigDecimal markToMarket,
    BigDecimal realized,
    BigDecimal fees,
    BigDecimal commissions,
    BigDecimal interest,
    BigDecimal changeInInterestAccruals,
    String currency
) implements RawRecord {

    @Override
    public SourceType sourceType() {
        return SourceType.NAV_SNAPSHOT;
    }

    @Override
    public String transactionId() {
        return "NAV-" + fromDate + "-" + toDate;
    }

    public boolean isSingleDay() {
        return fromDate.equals(toDate);
    }

    public boolean covers(LocalDate date) {
        return !date.isBefore(fromDate) && !date.isAfter(toDate);
    }
}
