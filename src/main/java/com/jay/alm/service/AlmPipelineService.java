package com.jay.alm.service;

import com.jay.alm.exception.AlmException;
import com.jay.alm.layer1_ingest.FeedIngestor;
import com.jay.alm.layer1_ingest.FeedLocator;
import com.jay.alm.layer2_assignment.AssignmentPairDetector;
import com.jay.alm.layer4_timeline.EventTimelineBuilder;
import com.jay.alm.layer5_summary.DailySummaryAggregator;
import com.jay.alm.layer6_reconcile.ReconciliationReporter;
import com.jay.alm.model.AssignmentDetection;
import com.jay.alm.model.DailyReconciliation;
import com.jay.alm.model.DailySummary;
import com.jay.alm.model.FinancialEvent;
import com.jay.alm.model.Finding;
import com.jay.alm.model.IngestionResult;
import com.jay.alm.model.Ledger;
import com.jay.alm.model.PipelineRun;
import com.jay.alm.model.ReconciliationReport;
import com.jay.alm.model.enums.RunMode;
import com.jay.alm.model.enums.SummaryStatus;
import com.jay.alm.notification.TelegramService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives one engine run end to end:
 *   locate extracts → parallel ingest (barrier) → detect assignments → build timeline
 *   → aggregate days → reconcile → persist → alert when the gate fails.
 *
 * Summaries and the report are always rebuilt from the canonical event set: the in-memory
 * ledger for a full run, the stored ledger plus new events for an append run.
 * Only one run executes at a time; the engine is the store's single writer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlmPipelineService {

    private final FeedLocator feedLocator;
    private final FeedIngestor feedIngestor;
    private final AssignmentPairDetector assignmentDetector;
    private final EventTimelineBuilder timelineBuilder;
    private final DailySummaryAggregator summaryAggregator;
    private final ReconciliationReporter reconciliationReporter;
    private final LedgerStore ledgerStore;
    private final TelegramService telegramService;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile PipelineRun lastRun;

    // ── Public API ─────────────────────────────────────────────────────────────

    public PipelineRun run(RunMode mode) {
        return mode == RunMode.APPEND ? runAppend() : runFull();
    }

    /** Rebuilds the ledger, positions and summaries from the extracts and replaces the store. */
    public PipelineRun runFull() {
        return guarded(RunMode.FULL, started -> {
            IngestionResult ingestion = feedIngestor.ingest(feedLocator.locate());
            AssignmentDetection detection = assignmentDetector.detect(ingestion.trades(), ingestion.optionEvents());
            Ledger ledger = timelineBuilder.build(ingestion, detection);

            List<DailySummary> summaries = summaryAggregator.aggregate(ledger);
            ReconciliationReport report = reconcile(summaries, ingestion, detection);
            summaries = annotate(summaries, report);

            ledgerStore.replaceAll(ledger.events(), ledger.positions(), summaries);
            return new PipelineRun(RunMode.FULL, started, Instant.now(), ingestion, ledger, summaries, report,
                ledger.events().size());
        });
    }

    /**
     * Adds events for unseen transaction ids to the stored ledger, then re-aggregates and
     * re-reconciles the whole stored history. Falls back to a full run on an empty store.
     */
    public PipelineRun runAppend() {
        if (ledgerStore.eventCount() == 0) {
            log.info("Append requested on an empty store — running a full rebuild");
            return runFull();
        }
        return guarded(RunMode.APPEND, started -> {
            IngestionResult ingestion = feedIngestor.ingest(feedLocator.locate());
            AssignmentDetection detection = assignmentDetector.detect(ingestion.trades(), ingestion.optionEvents());
            List<FinancialEvent> persisted = ledgerStore.loadEvents();
            BigDecimal firstOpening = ledgerStore.firstOpeningNav();
            Ledger appended = timelineBuilder.append(ingestion, detection, persisted, ledgerStore.loadOpenPositions());

            List<FinancialEvent> canonical = new ArrayList<>(persisted);
            canonical.addAll(appended.events());
            canonical.sort(FinancialEvent.LEDGER_ORDER);

            List<DailySummary> summaries = summaryAggregator.aggregate(canonical, firstOpening);
            ReconciliationReport report = reconcile(summaries, ingestion, detection);
            summaries = annotate(summaries, report);

            int inserted = ledgerStore.append(appended.events(), appended.positions(), summaries);
            Ledger ledger = new Ledger(List.copyOf(canonical), firstOpening, ledgerStore.loadPositions(),
                appended.unresolved(), appended.ambiguousGroups());
            return new PipelineRun(RunMode.APPEND, started, Instant.now(), ingestion, ledger, summaries, report,
                inserted);
        });
    }

    public PipelineRun lastRun() {
        return lastRun;
    }

    public boolean isRunning() {
        return running.get();
    }

    // ── Internals ─────────────────────────────────────────────────────────────

    private PipelineRun guarded(RunMode mode, Function<Instant, PipelineRun> body) {
        if (!running.compareAndSet(false, true)) {
            throw new AlmException("A pipeline run is already in progress");
        }
        Instant started = Instant.now();
        log.info("=== ALM {} RUN started ===", mode);
        try {
            PipelineRun run = body.apply(started);
            lastRun = run;
            log.info("=== ALM {} RUN finished: {} new event(s), {} day(s), gate {} ===",
                mode, run.newEvents(), run.summaries().size(), run.report().status());
            if (!run.report().passed()) {
                telegramService.sendAlert("⚠️ ALM RECONCILIATION FAILED", describeFailure(run.report()));
            }
            return run;
        } catch (AlmException e) {
            log.error("ALM {} run aborted: {}", mode, e.getMessage());
            telegramService.sendAlert("⚠️ ALM RUN ABORTED", e.getMessage());
            throw e;
        } finally {
            running.set(false);
        }
    }

    private ReconciliationReport reconcile(List<DailySummary> summaries, IngestionResult ingestion,
                                           AssignmentDetection detection) {
        return reconciliationReporter.reconcile(summaries, ingestion.navSnapshots(),
            detection.ambiguousGroups(), ingestion.conflicts());
    }

    /** Copies each day's reconciliation outcome onto its summary row. */
    static List<DailySummary> annotate(List<DailySummary> summaries, ReconciliationReport report) {
        Map<LocalDate, DailyReconciliation> byDate = report.days().stream()
            .collect(Collectors.toMap(DailyReconciliation::date, Function.identity()));
        return summaries.stream().map(s -> {
            DailyReconciliation day = byDate.get(s.date());
            if (day == null) return s;
            Boolean flag = day.discrepancy() == null ? null
                : day.discrepancy().abs().compareTo(day.tolerance()) > 0;
            return s.toBuilder().status(day.status()).discrepancyFlag(flag).build();
        }).toList();
    }

    private static String describeFailure(ReconciliationReport report) {
        StringBuilder sb = new StringBuilder();
        for (DailyReconciliation day : report.failedDays()) {
            sb.append(day.date()).append(": ");
            sb.append(day.violations().stream().map(Finding::message).collect(Collectors.joining("; ")));
            sb.append('\n');
        }
        for (DailyReconciliation day : report.days()) {
            if (day.status() == SummaryStatus.MISSING_PRIOR_DAY_NAV) {
                sb.append(day.date()).append(": opening NAV unknown\n");
            }
        }
        report.periodFindings().forEach(f -> sb.append(f.message()).append('\n'));
        return sb.toString().trim();
    }
}
