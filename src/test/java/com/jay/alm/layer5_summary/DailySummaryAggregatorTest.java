package com.jay.alm.layer5_summary;

import com.jay.alm.TestData;
import com.jay.alm.model.DailySummary;
import com.jay.alm.model.FinancialEvent;
import com.jay.alm.model.Money;
import com.jay.alm.model.enums.EventKind;
import com.jay.alm.model.enums.SummaryStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.jay.alm.TestData.d;
import static com.jay.alm.TestData.ny;
import static org.assertj.core.api.Assertions.*;

class DailySummaryAggregatorTest {

    private final DailySummaryAggregator aggregator = new DailySummaryAggregator(TestData.usdConfig());

    /** Builds a ledger with running NAV computed from {@code seed}. */
    private static List<FinancialEvent> ledger(BigDecimal seed, FinancialEvent... events) {
        List<FinancialEvent> out = new ArrayList<>();
        BigDecimal nav = seed;
        for (FinancialEvent e : events) {
            nav = Money.of(nav.add(e.navDelta()));
            out.add(e.toBuilder().runningNav(nav).build());
        }
        return out;
    }

    private static FinancialEvent trade(String id, String at, String cash, String pnl, String commission) {
        return FinancialEvent.builder()
            .sourceTransactionId(id).timestamp(ny(at)).kind(EventKind.TRADE).symbol("AAPL")
            .cashImpact(Money.of(cash)).realizedPnl(Money.of(pnl)).commission(Money.of(commission))
            .currency("USD").fxRate(BigDecimal.ONE)
            .build();
    }

    private static FinancialEvent cash(String id, String at, String type, String amount) {
        return FinancialEvent.builder()
            .sourceTransactionId(id).timestamp(ny(at)).kind(EventKind.CASH_MOVEMENT)
            .cashImpact(Money.of(amount)).realizedPnl(Money.ZERO).commission(Money.ZERO)
            .currency("USD").fxRate(BigDecimal.ONE).cashType(type)
            .build();
    }

    @Test
    @DisplayName("one row per day; opening = previous closing")
    void groupsByDay() {
        List<FinancialEvent> events = ledger(d("1000.00"),
            trade("T1", "2025-06-10T10:00:00", "-100", "0", "-1"),
            trade("T2", "2025-06-10T15:00:00", "110", "10", "-1"),
            trade("T3", "2025-06-11T10:00:00", "-50", "0", "-0.5"),
            trade("T4", "2025-06-12T10:00:00", "60", "10", "-0.5"));

        List<DailySummary> days = aggregator.aggregate(events, d("1000.00"));

        assertThat(days).extracting(DailySummary::date).containsExactly(
            LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 11), LocalDate.of(2025, 6, 12));
        DailySummary first = days.get(0);
        assertThat(first.openingNav()).isEqualByComparingTo("1000.00");
        assertThat(first.closingNav()).isEqualByComparingTo("1020.00");
        assertThat(first.totalPnl()).isEqualByComparingTo("10.00");
        assertThat(first.netCashFlow()).isEqualByComparingTo("10.00");
        assertThat(first.commissions()).isEqualByComparingTo("2.00");
        assertThat(first.eventCount()).isEqualTo(2);
        assertThat(first.status()).isEqualTo(SummaryStatus.COMPUTED);
        assertThat(days.get(1).openingNav()).isEqualTo(first.closingNav());
        assertThat(days.get(2).openingNav()).isEqualTo(days.get(1).closingNav());
    }

    @Test
    @DisplayName("Σ net cash flow + Σ P&L = final closing − initial opening")
    void conservation() {
        List<FinancialEvent> events = ledger(d("5000.00"),
            cash("C1", "2025-06-09T08:00:00", "Deposits/Withdrawals", "250"),
            trade("T1", "2025-06-10T10:00:00", "-100", "3.5", "-1"),
            trade("T2", "2025-06-11T10:00:00", "80", "-7.25", "-1"),
            cash("C2", "2025-06-11T16:00:00", "Withdrawal", "-40"));

        List<DailySummary> days = aggregator.aggregate(events, d("5000.00"));

        BigDecimal flows = days.stream().map(s -> s.netCashFlow().add(s.totalPnl()))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal change = days.get(days.size() - 1).closingNav().subtract(days.get(0).openingNav());
        assertThat(flows).isEqualByComparingTo(change);
    }

    @Test
    @DisplayName("deposit-only day: next opening = this opening + deposit")
    void depositOnlyDayCarriesOver() {
        List<FinancialEvent> events = ledger(d("79299.20"),
            cash("C1", "2025-06-14T08:00:00", "Deposits/Withdrawals", "119945.00"),
            trade("T1", "2025-06-16T10:00:00", "-100", "0", "-1"));

        List<DailySummary> days = aggregator.aggregate(events, d("79299.20"));

        assertThat(days.get(0).eventCount()).isEqualTo(1);
        assertThat(days.get(1).openingNav()).isEqualByComparingTo(days.get(0).openingNav().add(d("119945.00")));
    }

    @Test
    @DisplayName("only positive deposits before 09:30 count toward the return base")
    void depositsBeforeOpen() {
        List<FinancialEvent> events = ledger(d("79299.20"),
            cash("C1", "2025-06-10T08:00:00", "Deposits/Withdrawals", "119945.00"),
            cash("C2", "2025-06-10T09:29:59", "Deposits/Withdrawals", "-500.00"),
            cash("C3", "2025-06-10T09:30:00", "Deposits/Withdrawals", "1000.00"),
            cash("C4", "2025-06-10T08:30:00", "Dividends", "12.00"));

        DailySummary day = aggregator.aggregate(events, d("79299.20")).get(0);

        assertThat(day.depositsBeforeOpen()).isEqualByComparingTo("119945.00");
        assertThat(day.adjustedOpeningNav()).isEqualByComparingTo("199244.20");
        assertThat(day.openingNav()).isEqualByComparingTo("79299.20");
    }

    @Test
    @DisplayName("no known opening: first day MISSING_PRIOR_DAY_NAV, later days proceed")
    void missingPriorDayNav() {
        List<FinancialEvent> events = ledger(Money.ZERO,
            trade("T1", "2025-06-10T10:00:00", "-100", "0", "-1"),
            trade("T2", "2025-06-11T10:00:00", "120", "20", "-1"));

        List<DailySummary> days = aggregator.aggregate(events, null);

        assertThat(days.get(0).status()).isEqualTo(SummaryStatus.MISSING_PRIOR_DAY_NAV);
        assertThat(days.get(0).openingNav()).isNull();
        assertThat(days.get(0).adjustedOpeningNav()).isNull();
        assertThat(days.get(1).status()).isEqualTo(SummaryStatus.COMPUTED);
        assertThat(days.get(1).openingNav()).isEqualByComparingTo("-100.00");
    }

    @Test
    @DisplayName("days follow the reporting timezone, not UTC")
    void reportingZoneDates() {
        // 21:00 New York is already the next day in UTC
        List<FinancialEvent> events = ledger(d("0"), trade("T1", "2025-06-10T21:00:00", "1", "0", "0"));

        assertThat(aggregator.aggregate(events, d("0")).get(0).date()).isEqualTo(LocalDate.of(2025, 6, 10));
    }

    @Test
    @DisplayName("empty ledger yields no rows")
    void emptyLedger() {
        assertThat(aggregator.aggregate(List.of(), d("1"))).isEmpty();
    }
}
