package com.jay.alm.controller;

import com.jay.alm.config.AlmConfig;
import com.jay.alm.exception.AlmException;
import com.jay.alm.model.DailySummary;
import com.jay.alm.model.FinancialEvent;
import com.jay.alm.model.OpenPosition;
import com.jay.alm.model.PipelineRun;
import com.jay.alm.model.ReconciliationReport;
import com.jay.alm.model.enums.RunMode;
import com.jay.alm.service.AlmPipelineService;
import com.jay.alm.service.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API over the ledger store and the last run.
 *
 * Endpoints:
 *   GET  /api/alm/status          — store size, last run and gate status
 *   GET  /api/alm/summaries       — stored daily summaries
 *   GET  /api/alm/events?date=    — ledger events, optionally for one reporting-zone day
 *   GET  /api/alm/positions       — stock lots (open only unless all=true)
 *   GET  /api/alm/reconciliation  — report of the last run
 *   POST /api/alm/run?mode=       — trigger a FULL or APPEND run
 */
@Slf4j
@RestController
@RequestMapping("/api/alm")
@RequiredArgsConstructor
public class AlmController {

    private final AlmPipelineService pipelineService;
    private final LedgerStore ledgerStore;
    private final AlmConfig config;

    // ── GET /api/alm/status ────────────────────────────────────────────────────

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        PipelineRun last = pipelineService.lastRun();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", LocalDateTime.now().toString());
        body.put("running", pipelineService.isRunning());
        body.put("storedEvents", ledgerStore.eventCount());
        body.put("reportingCurrency", config.reporting().getCurrency());
        body.put("fxMode", config.fx().getMode());
        body.put("lastRunMode", last != null ? last.mode() : null);
        body.put("lastRunFinishedAt", last != null ? last.finishedAt() : null);
        body.put("lastRunGate", last != null ? last.report().status() : null);
        return ResponseEntity.ok(body);
    }

    // ── GET /api/alm/summaries ─────────────────────────────────────────────────

    @GetMapping("/summaries")
    public ResponseEntity<List<DailySummary>> summaries() {
        return ResponseEntity.ok(ledgerStore.loadSummaries());
    }

    // ── GET /api/alm/events ────────────────────────────────────────────────────

    @GetMapping("/events")
    public ResponseEntity<List<FinancialEvent>> events(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        if (date == null) return ResponseEntity.ok(ledgerStore.loadEvents());
        return ResponseEntity.ok(ledgerStore.loadEvents(date, config.reporting().zoneId()));
    }

    // ── GET /api/alm/positions ─────────────────────────────────────────────────

    @GetMapping("/positions")
    public ResponseEntity<List<OpenPosition>> positions(@RequestParam(defaultValue = "false") boolean all) {
        return ResponseEntity.ok(all ? ledgerStore.loadPositions() : ledgerStore.loadOpenPositions());
    }

    // ── GET /api/alm/reconciliation ────────────────────────────────────────────

    @GetMapping("/reconciliation")
    public ResponseEntity<ReconciliationReport> reconciliation() {
        PipelineRun last = pipelineService.lastRun();
        if (last == null) return ResponseEntity.noContent().build();
        return ResponseEntity.ok(last.report());
    }

    // ── POST /api/alm/run ──────────────────────────────────────────────────────

    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> run(@RequestParam(defaultValue = "APPEND") RunMode mode) {
        try {
            PipelineRun run = pipelineService.run(mode);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("mode", run.mode());
            body.put("newEvents", run.newEvents());
            body.put("days", run.summaries().size());
            body.put("gate", run.report().status());
            body.put("reviewItems", run.report().reviewItems().size());
            return ResponseEntity.ok(body);
        } catch (AlmException e) {
            log.error("Manual {} run failed: {}", mode, e.getMessage());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("mode", mode);
            body.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
        }
    }
}
