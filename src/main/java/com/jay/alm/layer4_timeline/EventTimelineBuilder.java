package com.jay.alm.layer4_timeline;

import com.jay.alm.config.AlmConfig;
import com.jay.alm.layer1_ingest.FxRateService;
import com.jay.alm.layer3_position.PositionTracker;
import com.jay.alm.model.AssignmentDetection;
import com.jay.alm.model.CashTransaction;
import com.jay.alm.model.FinancialEvent;
import com.jay.alm.model.IngestionResult;
import com.jay.alm.model.Ledger;
import com.jay.alm.model.Money;
import com.jay.alm.model.NavSnapshot;
import com.jay.alm.model.OpenPosition;
import com.jay.alm.model.PositionOutcome;
import com.jay.alm.model.RawRecord;
import com.jay.alm.model.TradeExecution;
import com.jay.alm.model.enums.BookingClassification;
import com.jay.alm.model.enums.EventKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Layer 4 — Event Timeline Builder.
 * Merges trades, cash movements and detected assignments into one ledger ordered by
 * (timestamp, transaction id), carrying a running NAV:
 *
 *   running_nav(i) = running_nav(i-1) + cash_impact(i) + realized_pnl(i)
 *
 * Cash impact is (proceeds + commission) × fx for trades, amount × fx for cash movements
 * and zero for expirations. Realized P&L comes from the {@link PositionTracker} for stock
 * trades, is zero for assignment deliveries and is the broker-reported value otherwise.
 *
 * Full mode seeds the NAV from the earliest reported starting value. Append mode emits only
 * transaction ids that are not yet persisted and continues from the last persisted NAV.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventTimelineBuilder {

    static final String AGGREGATE_DW_PREFIX = "AGGREGATE-DW-";

    private final AlmConfig config;
    private final FxRateService fxRateService;

    // ── Public API ─────────────────────────────────────────────────────────────

    /** Builds the complete ledger from scratch. Same input, equal ledger. */
    public Ledger build(IngestionResult input, AssignmentDetection detection) {
        BigDecimal seed = seedNav(input.navSnapshots());
        if (seed == null) {
            log.warn("No reported starting NAV and no fallback configured — running NAV starts at 0 (seed unknown)");
        }
        PositionTracker tracker = new PositionTracker();
        List<FinancialEvent> events = merge(input, detection, tracker, Set.of(), Set.of(),
            seed != null ? seed : Money.ZERO);
        log.info("EventTimelineBuilder: {} ledger events, {} lots, final NAV {}",
            events.size(), tracker.positions().size(),
            events.isEmpty() ? seed : events.get(events.size() - 1).runningNav());
        return new Ledger(events, seed, tracker.positions(), unresolvedTrades(input, detection),
            detection.ambiguousGroups());
    }

    /**
     * Emits events only for transaction ids absent from {@code persistedEvents}, continuing the
     * running NAV from the last persisted event. Persisted rows are never revised; a new event
     * dated before the last persisted one is logged since only a full rebuild reorders it.
     */
    public Ledger append(IngestionResult input, AssignmentDetection detection,
                         List<FinancialEvent> persistedEvents, Collection<OpenPosition> persistedOpenPositions) {
        if (persistedEvents.isEmpty()) {
            log.info("EventTimelineBuilder: store is empty — append falls back to a full build");
            return build(input, detection);
        }
        List<FinancialEvent> persisted = new ArrayList<>(persistedEvents);
        persisted.sort(FinancialEvent.LEDGER_ORDER);
        FinancialEvent last = persisted.get(persisted.size() - 1);

        Set<String> persistedIds = new HashSet<>();
        Set<LocalDate> persistedDepositDates = new HashSet<>();
        for (FinancialEvent e : persisted) {
            persistedIds.add(e.sourceTransactionId());
            if (isDepositWithdrawal(e.cashType())) persistedDepositDates.add(reportingDate(e.timestamp()));
        }

        PositionTracker tracker = new PositionTracker(persistedOpenPositions);
        List<FinancialEvent> fresh = merge(input, detection, tracker, persistedIds, persistedDepositDates,
            last.runningNav());

        fresh.stream()
            .filter(e -> FinancialEvent.LEDGER_ORDER.compare(e, last) < 0)
            .forEach(e -> log.warn("Back-dated event {} at {} precedes the last persisted event {} — "
                + "run a full rebuild to reorder the ledger", e.sourceTransactionId(), e.timestamp(),
                last.sourceTransactionId()));
        log.info("EventTimelineBuilder: append emitted {} new event(s) after {} persisted",
            fresh.size(), persisted.size());
        return new Ledger(fresh, last.runningNav(), tracker.positions(), unresolvedTrades(input, detection),
            detection.ambiguousGroups());
    }

    // ── Merge ─────────────────────────────────────────────────────────────────

    private List<FinancialEvent> merge(IngestionResult input, AssignmentDetection detection,
                                       PositionTracker tracker, Set<String> skipIds,
                                       Set<LocalDate> knownDepositDates, BigDecimal startNav) {
        List<RawRecord> records = new ArrayList<>();
        for (TradeExecution t : input.trades()) {
            if (!detection.isUnresolved(t.transactionId())) records.add(t);
        }
        records.addAll(input.cashTransactions());
        if (config.ledger().isSynthesizeAggregateCashFlow()) {
            records.addAll(aggregateCashFlows(input, knownDepositDates));
        }
        records.removeIf(r -> skipIds.contains(r.transactionId()));
        records.sort(Comparator.comparing(EventTimelineBuilder::timestampOf)
            .thenComparing(RawRecord::transactionId));

        List<FinancialEvent> events = new ArrayList<>(records.size());
        BigDecimal nav = Money.of(startNav);
        for (RawRecord record : records) {
            FinancialEvent event = record instanceof TradeExecution trade
                ? tradeEvent(trade, detection, tracker)
                : cashEvent((CashTransaction) record);
            nav = Money.of(nav.add(event.navDelta()));
            events.add(event.toBuilder().runningNav(nav).build());
        }
        return List.copyOf(events);
    }

    private FinancialEvent tradeEvent(TradeExecution t, AssignmentDetection detection, PositionTracker tracker) {
        BigDecimal fx = fxRateService.rateFor(t.currency(), t.fxRateToBase(), reportingDate(t.timestamp()));
        BigDecimal cash = Money.of(t.proceeds().add(t.commission()).multiply(fx));
        BigDecimal reportedPnl = Money.of(t.fifoPnlRealized().multiply(fx));
        FinancialEvent.FinancialEventBuilder b = FinancialEvent.builder()
            .timestamp(t.timestamp())
            .symbol(t.symbol())
            .description(t.description())
            .commission(Money.of(t.commission().multiply(fx)))
            .currency(t.currency())
            .fxRate(fx)
            .sourceTransactionId(t.transactionId());

        BookingClassification classification = detection.classificationOf(t.transactionId());
        if (classification == BookingClassification.EXPIRATION) {
            return b.kind(EventKind.EXPIRATION).cashImpact(Money.ZERO).realizedPnl(reportedPnl).build();
        }
        if (classification == BookingClassification.ASSIGNMENT) {
            b.kind(EventKind.ASSIGNMENT).cashImpact(cash);
            if (t.isStock()) {
                PositionOutcome outcome = tracker.openFromAssignment(t, fx);
                return b.realizedPnl(Money.ZERO).linkedPositionId(outcome.linkedPositionId()).build();
            }
            String stockId = detection.optionToStock().get(t.transactionId());
            return b.realizedPnl(reportedPnl)
                .linkedTransactionId(stockId)
                .linkedPositionId(OpenPosition.idFor(stockId))
                .build();
        }

        b.kind(EventKind.TRADE).cashImpact(cash);
        if (t.isStock()) {
            PositionOutcome outcome = tracker.apply(t, fx);
            return b.realizedPnl(outcome.realizedPnl()).linkedPositionId(outcome.linkedPositionId()).build();
        }
        return b.realizedPnl(reportedPnl).build();
    }

    private FinancialEvent cashEvent(CashTransaction c) {
        boolean synthetic = c.transactionId().startsWith(AGGREGATE_DW_PREFIX);
        BigDecimal fx = synthetic
            ? BigDecimal.ONE
            : fxRateService.rateFor(c.currency(), c.fxRateToBase(), reportingDate(c.timestamp()));
        return FinancialEvent.builder()
            .timestamp(c.timestamp())
            .kind(EventKind.CASH_MOVEMENT)
            .description(c.description())
            .cashImpact(Money.of(c.amount().multiply(fx)))
            .realizedPnl(Money.ZERO)
            .commission(Money.ZERO)
            .currency(c.currency())
            .fxRate(fx)
            .sourceTransactionId(c.transactionId())
            .cashType(c.type())
            .synthetic(synthetic)
            .build();
    }

    // ── Seeding & aggregate cash flow ─────────────────────────────────────────

    BigDecimal seedNav(List<NavSnapshot> snapshots) {
        return snapshots.stream()
            .min(Comparator.comparing(NavSnapshot::fromDate).thenComparing(NavSnapshot::toDate))
            .map(NavSnapshot::startingValue)
            .map(Money::of)
            .orElse(Money.of(config.reporting().getOpeningNavFallback()));
    }

    /**
     * A NAV period reporting deposits/withdrawals with no matching cash record gets one
     * synthetic cash movement at 00:00 of its first day. Shorter periods are matched first
     * so a month snapshot does not repeat what its daily snapshots already supplied.
     */
    List<CashTransaction> aggregateCashFlows(IngestionResult input, Set<LocalDate> knownDepositDates) {
        Set<LocalDate> depositDates = new HashSet<>(knownDepositDates);
        for (CashTransaction c : input.cashTransactions()) {
            if (isDepositWithdrawal(c.type())) depositDates.add(reportingDate(c.timestamp()));
        }
        List<NavSnapshot> periods = new ArrayList<>(input.navSnapshots());
        periods.sort(Comparator.comparing((NavSnapshot n) -> n.toDate().toEpochDay() - n.fromDate().toEpochDay())
            .thenComparing(NavSnapshot::fromDate));

        List<CashTransaction> synthesized = new ArrayList<>();
        for (NavSnapshot nav : periods) {
            if (nav.depositsWithdrawals().signum() == 0) continue;
            if (depositDates.stream().anyMatch(nav::covers)) continue;
            ZoneId zone = config.reporting().zoneId();
            synthesized.add(CashTransaction.builder()
                .transactionId(AGGREGATE_DW_PREFIX + nav.fromDate() + "-" + nav.toDate())
                .timestamp(nav.fromDate().atStartOfDay(zone).toInstant())
                .type(config.ledger().getDepositWithdrawalType())
                .description("Aggregate deposits/withdrawals reported for " + nav.fromDate() + " to " + nav.toDate())
                .amount(nav.depositsWithdrawals())
                .currency(config.reporting().getCurrency())
                .build());
            depositDates.add(nav.fromDate());
            log.info("Synthesized aggregate cash flow {} for {}..{}", nav.depositsWithdrawals(),
                nav.fromDate(), nav.toDate());
        }
        return synthesized;
    }

    private List<TradeExecution> unresolvedTrades(IngestionResult input, AssignmentDetection detection) {
        return input.trades().stream().filter(t -> detection.isUnresolved(t.transactionId())).toList();
    }

    private boolean isDepositWithdrawal(String cashType) {
        return config.ledger().getDepositWithdrawalType().equalsIgnoreCase(cashType);
    }

    private LocalDate reportingDate(Instant timestamp) {
        return timestamp.atZone(config.reporting().zoneId()).toLocalDate();
    }

    private static Instant timestampOf(RawRecord record) {
        if (record instanceof TradeExecution t) return t.timestamp();
        return ((CashTransaction) record).timestamp();
    }
}
