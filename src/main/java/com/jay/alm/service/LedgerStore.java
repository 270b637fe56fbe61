package com.jay.alm.service;

import com.jay.alm.entity.ChronologicalEvent;
import com.jay.alm.entity.DailySummaryRecord;
import com.jay.alm.entity.StockPosition;
import com.jay.alm.model.DailySummary;
import com.jay.alm.model.FinancialEvent;
import com.jay.alm.model.OpenPosition;
import com.jay.alm.model.enums.PositionStatus;
import com.jay.alm.repository.ChronologicalEventRepository;
import com.jay.alm.repository.DailySummaryRecordRepository;
import com.jay.alm.repository.StockPositionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Persisted ledger store.
 *   chronological_events — insert-or-ignore by source transaction id
 *   stock_positions      — one row per lot, replaced with the tracker's state
 *   daily_summary        — insert-or-update by date
 * Every write method runs in a single transaction, so a failed run leaves the store as it was.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerStore {

    private final ChronologicalEventRepository eventRepo;
    private final StockPositionRepository positionRepo;
    private final DailySummaryRecordRepository summaryRepo;

    // ── Writes ────────────────────────────────────────────────────────────────

    /** Replaces the whole store with the output of a full rebuild. */
    @Transactional
    public void replaceAll(List<FinancialEvent> events, List<OpenPosition> positions, List<DailySummary> summaries) {
        eventRepo.deleteAllInBatch();
        positionRepo.deleteAllInBatch();
        summaryRepo.deleteAllInBatch();
        eventRepo.saveAll(events.stream().map(LedgerStore::toEntity).toList());
        positionRepo.saveAll(positions.stream().map(LedgerStore::toEntity).toList());
        summaryRepo.saveAll(summaries.stream().map(LedgerStore::toEntity).toList());
        log.info("LedgerStore: replaced contents — {} events, {} positions, {} summaries",
            events.size(), positions.size(), summaries.size());
    }

    /**
     * Inserts events whose transaction id is not stored yet, replaces position state and
     * upserts the given summaries. Returns the number of events inserted.
     */
    @Transactional
    public int append(List<FinancialEvent> events, List<OpenPosition> positions, List<DailySummary> summaries) {
        int inserted = insertIgnoringExisting(events);
        positionRepo.saveAll(positions.stream().map(LedgerStore::toEntity).toList());
        upsertSummaries(summaries);
        log.info("LedgerStore: appended {} of {} events, {} positions, {} summaries upserted",
            inserted, events.size(), positions.size(), summaries.size());
        return inserted;
    }

    @Transactional
    public int insertIgnoringExisting(List<FinancialEvent> events) {
        Set<String> existing = new HashSet<>(eventRepo.findAllSourceTransactionIds());
        List<ChronologicalEvent> fresh = events.stream()
            .filter(e -> existing.add(e.sourceTransactionId()))
            .map(LedgerStore::toEntity)
            .toList();
        eventRepo.saveAll(fresh);
        return fresh.size();
    }

    @Transactional
    public void upsertSummaries(List<DailySummary> summaries) {
        // Keyed by date: save() merges over an existing row
        summaryRepo.saveAll(summaries.stream().map(LedgerStore::toEntity).toList());
    }

    // ── Reads ─────────────────────────────────────────────────────────────────

    /** Canonical ledger ordered by (timestamp, transaction id). */
    @Transactional(readOnly = true)
    public List<FinancialEvent> loadEvents() {
        return eventRepo.findAllByOrderByTimestampAscSourceTransactionIdAsc().stream()
            .map(LedgerStore::toModel)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<FinancialEvent> loadEvents(LocalDate date, ZoneId zone) {
        return eventRepo.findByTimestampGreaterThanEqualAndTimestampLessThanOrderByTimestampAscSourceTransactionIdAsc(
                date.atStartOfDay(zone).toInstant(), date.plusDays(1).atStartOfDay(zone).toInstant())
            .stream()
            .map(LedgerStore::toModel)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<OpenPosition> loadOpenPositions() {
        return positionRepo.findByStatusOrderByEntryTimestampAscPositionIdAsc(PositionStatus.OPEN).stream()
            .map(LedgerStore::toModel)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<OpenPosition> loadPositions() {
        return positionRepo.findAllByOrderByEntryTimestampAscPositionIdAsc().stream()
            .map(LedgerStore::toModel)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<DailySummary> loadSummaries() {
        return summaryRepo.findAllByOrderBySummaryDateAsc().stream()
            .map(LedgerStore::toModel)
            .toList();
    }

    /** Opening NAV recorded for the earliest stored day; null when unknown or the store is empty. */
    @Transactional(readOnly = true)
    public BigDecimal firstOpeningNav() {
        return summaryRepo.findTopByOrderBySummaryDateAsc()
            .map(DailySummaryRecord::getOpeningNav)
            .orElse(null);
    }

    public long eventCount() {
        return eventRepo.count();
    }

    // ── Mapping ───────────────────────────────────────────────────────────────

    static ChronologicalEvent toEntity(FinancialEvent e) {
        return ChronologicalEvent.builder()
            .sourceTransactionId(e.sourceTransactionId())
            .timestamp(e.timestamp())
            .kind(e.kind())
            .symbol(e.symbol())
            .description(e.description())
            .cashImpact(e.cashImpact())
            .realizedPnl(e.realizedPnl())
            .commission(e.commission())
            .runningNav(e.runningNav())
            .currency(e.currency())
            .fxRate(e.fxRate())
            .cashType(e.cashType())
            .linkedTransactionId(e.linkedTransactionId())
            .linkedPositionId(e.linkedPositionId())
            .synthetic(e.synthetic())
            .build();
    }

    static FinancialEvent toModel(ChronologicalEvent e) {
        return FinancialEvent.builder()
            .sourceTransactionId(e.getSourceTransactionId())
            .timestamp(e.getTimestamp())
            .kind(e.getKind())
            .symbol(e.getSymbol())
            .description(e.getDescription())
            .cashImpact(e.getCashImpact())
            .realizedPnl(e.getRealizedPnl())
            .commission(e.getCommission())
            .runningNav(e.getRunningNav())
            .currency(e.getCurrency())
            .fxRate(normalize(e.getFxRate()))
            .cashType(e.getCashType())
            .linkedTransactionId(e.getLinkedTransactionId())
            .linkedPositionId(e.getLinkedPositionId())
            .synthetic(e.isSynthetic())
            .build();
    }

    static StockPosition toEntity(OpenPosition p) {
        return StockPosition.builder()
            .positionId(p.getPositionId())
            .symbol(p.getSymbol())
            .quantity(p.getQuantity())
            .openQuantity(p.getOpenQuantity())
            .entryPrice(p.getEntryPrice())
            .entryTimestamp(p.getEntryTimestamp())
            .entryTransactionId(p.getEntryTransactionId())
            .fxRateAtEntry(p.getFxRateAtEntry())
            .fromAssignment(p.isFromAssignment())
            .status(p.getStatus())
            .exitPrice(p.getExitPrice())
            .exitTimestamp(p.getExitTimestamp())
            .exitTransactionId(p.getExitTransactionId())
            .realizedPnl(p.getRealizedPnl())
            .build();
    }

    static OpenPosition toModel(StockPosition p) {
        return OpenPosition.builder()
            .positionId(p.getPositionId())
            .symbol(p.getSymbol())
            .quantity(normalize(p.getQuantity()))
            .openQuantity(normalize(p.getOpenQuantity()))
            .entryPrice(normalize(p.getEntryPrice()))
            .entryTimestamp(p.getEntryTimestamp())
            .entryTransactionId(p.getEntryTransactionId())
            .fxRateAtEntry(normalize(p.getFxRateAtEntry()))
            .fromAssignment(p.isFromAssignment())
            .status(p.getStatus())
            .exitPrice(normalize(p.getExitPrice()))
            .exitTimestamp(p.getExitTimestamp())
            .exitTransactionId(p.getExitTransactionId())
            .realizedPnl(p.getRealizedPnl())
            .build();
    }

    static DailySummaryRecord toEntity(DailySummary s) {
        return DailySummaryRecord.builder()
            .summaryDate(s.date())
            .openingNav(s.openingNav())
            .closingNav(s.closingNav())
            .totalPnl(s.totalPnl())
            .netCashFlow(s.netCashFlow())
            .commissions(s.commissions())
            .depositsBeforeOpen(s.depositsBeforeOpen())
            .eventCount(s.eventCount())
            .status(s.status())
            .discrepancyFlag(s.discrepancyFlag())
            .build();
    }

    static DailySummary toModel(DailySummaryRecord r) {
        return DailySummary.builder()
            .date(r.getSummaryDate())
            .openingNav(r.getOpeningNav())
            .closingNav(r.getClosingNav())
            .totalPnl(r.getTotalPnl())
            .netCashFlow(r.getNetCashFlow())
            .commissions(r.getCommissions())
            .depositsBeforeOpen(r.getDepositsBeforeOpen())
            .eventCount(r.getEventCount())
            .status(r.getStatus())
            .discrepancyFlag(r.getDiscrepancyFlag())
            .build();
    }

    /** Column scale pads rates and quantities; strip it so loaded values equal parsed ones. */
    private static BigDecimal normalize(BigDecimal value) {
        if (value == null) return null;
        return value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }
}
