package com.jay.alm.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Broker-reported figures for one day, taken from a single-day NAV snapshot.
 */
public record ReportedDay(LocalDate date, BigDecimal openingNav, BigDecimal closingNav,
                          BigDecimal depositsWithdrawals) {

    public static ReportedDay from(NavSnapshot snapshot) {
        return new ReportedDay(snapshot.toDate(), snapshot.startingValue(), snapshot.endingValue(),
            snapshot.depositsWithdrawals());
    }
}
