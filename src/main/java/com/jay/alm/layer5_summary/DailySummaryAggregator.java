package com.jay.alm.layer5_summary;

import com.jay.alm.config.AlmConfig;
import com.jay.alm.model.DailySummary;
import com.jay.alm.model.FinancialEvent;
import com.jay.alm.model.Ledger;
import com.jay.alm.model.Money;
import com.jay.alm.model.enums.EventKind;
import com.jay.alm.model.enums.SummaryStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Layer 5 — Daily Summary Aggregator.
 * Folds ledger events into one row per calendar day (reporting timezone).
 *
 * Opening NAV of a day is the previous day's closing NAV; the first day uses the NAV the
 * ledger was seeded with. When that is unknown the first day is marked
 * {@link SummaryStatus#MISSING_PRIOR_DAY_NAV} and carries no opening NAV; later days
 * proceed from its closing. Deposits booked before the market open are totalled separately
 * because they move the return base, not the carried NAV.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DailySummaryAggregator {

    private final AlmConfig config;

    public List<DailySummary> aggregate(Ledger ledger) {
        return aggregate(ledger.events(), ledger.seedNav());
    }

    /**
     * @param events         canonical ledger events, any order
     * @param firstDayOpening NAV before the first event, null when unknown
     */
    public List<DailySummary> aggregate(List<FinancialEvent> events, BigDecimal firstDayOpening) {
        ZoneId zone = config.reporting().zoneId();
        Map<LocalDate, List<FinancialEvent>> byDate = new TreeMap<>();
        events.stream()
            .sorted(FinancialEvent.LEDGER_ORDER)
            .forEach(e -> byDate.computeIfAbsent(e.timestamp().atZone(zone).toLocalDate(),
                k -> new ArrayList<>()).add(e));

        List<DailySummary> summaries = new ArrayList<>(byDate.size());
        BigDecimal previousClose = null;
        boolean first = true;
        for (Map.Entry<LocalDate, List<FinancialEvent>> day : byDate.entrySet()) {
            BigDecimal opening = first ? Money.of(firstDayOpening) : previousClose;
            DailySummary summary = summarize(day.getKey(), day.getValue(), opening, zone);
            if (summary.status() == SummaryStatus.MISSING_PRIOR_DAY_NAV) {
                log.warn("No prior-day NAV for {} — opening NAV unknown", day.getKey());
            }
            summaries.add(summary);
            previousClose = summary.closingNav();
            first = false;
        }
        log.info("DailySummaryAggregator: {} day(s) from {} event(s)", summaries.size(), events.size());
        return List.copyOf(summaries);
    }

    private DailySummary summarize(LocalDate date, List<FinancialEvent> dayEvents, BigDecimal opening, ZoneId zone) {
        BigDecimal pnl = Money.ZERO;
        BigDecimal cash = Money.ZERO;
        BigDecimal commissions = Money.ZERO;
        BigDecimal depositsBeforeOpen = Money.ZERO;
        for (FinancialEvent e : dayEvents) {
            pnl = pnl.add(e.realizedPnl());
            cash = cash.add(e.cashImpact());
            commissions = commissions.add(e.commission().abs());
            if (isDepositBeforeOpen(e, zone)) depositsBeforeOpen = depositsBeforeOpen.add(e.cashImpact());
        }
        return DailySummary.builder()
            .date(date)
            .openingNav(opening)
            .closingNav(dayEvents.get(dayEvents.size() - 1).runningNav())
            .totalPnl(Money.of(pnl))
            .netCashFlow(Money.of(cash))
            .commissions(Money.of(commissions))
            .depositsBeforeOpen(Money.of(depositsBeforeOpen))
            .eventCount(dayEvents.size())
            .status(opening == null ? SummaryStatus.MISSING_PRIOR_DAY_NAV : SummaryStatus.COMPUTED)
            .build();
    }

    private boolean isDepositBeforeOpen(FinancialEvent e, ZoneId zone) {
        if (e.kind() != EventKind.CASH_MOVEMENT || e.cashImpact().signum() <= 0) return false;
        if (!config.ledger().getDepositWithdrawalType().equalsIgnoreCase(e.cashType())) return false;
        ZonedDateTime local = e.timestamp().atZone(zone);
        return local.toLocalTime().isBefore(config.reporting().getMarketOpen());
    }
}
