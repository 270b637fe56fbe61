package com.jay.alm.model;

import com.jay.alm.model.enums.RunMode;

import java.time.Instant;
import java.util.List;

/**
 * Everything one pipeline run produced.
 *
 * @param newEvents number of ledger rows written by this run (all rows for a full run)
 */
public record PipelineRun(
    RunMode mode,
    Instant startedAt,
    Instant finishedAt,
    IngestionResult ingestion,
    Ledger ledger,
    List<DailySummary> summaries,
    ReconciliationReport report,
    int newEvents
) {}
