package com.jay.alm.layer1_ingest;

import com.jay.alm.config.AlmConfig;
import com.jay.alm.exception.AlmException;
import com.jay.alm.exception.FeedParseException;
import com.jay.alm.model.CashTransaction;
import com.jay.alm.model.DuplicateConflict;
import com.jay.alm.model.IngestionResult;
import com.jay.alm.model.NavSnapshot;
import com.jay.alm.model.OptionLifecycleEvent;
import com.jay.alm.model.RawRecord;
import com.jay.alm.model.TradeExecution;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Layer 1 — Feed Ingestor.
 * Parses the trade, cash and NAV extracts, plus the optional exercises-and-expiries and
 * interest-accrual extracts, and collapses overlapping extracts (e.g. month-to-date and
 * last-business-day) into one record per transaction id. Interest accruals join the cash feed.
 *
 * All feeds are parsed in parallel; {@link #ingest} returns only after all of them
 * finished, and any parse failure aborts the whole ingestion.
 * Dedup rule: first-seen wins, extracts consumed in the order given. Differing duplicates
 * are reported as {@link DuplicateConflict}s.
 */
@Slf4j
@Service
public class FeedIngestor {

    private final FlexFeedParser parser;
    private final ExecutorService parseExecutor;

    public FeedIngestor(FlexFeedParser parser, AlmConfig config) {
        this.parser = parser;
        this.parseExecutor = Executors.newFixedThreadPool(Math.max(1, config.feeds().getParserThreads()));
    }

    /** A parsed extract: its records plus the name used to report conflicts. */
    public record Extract<T extends RawRecord>(String source, List<T> records) {}

    // ── Public API ─────────────────────────────────────────────────────────────

    public IngestionResult ingest(FeedLocator.FeedFiles files) {
        log.info("FeedIngestor: parsing {} extracts", files.size());
        CompletableFuture<List<Extract<TradeExecution>>> trades =
            CompletableFuture.supplyAsync(() -> parseAll(files.trades(), parser::parseTrades), parseExecutor);
        CompletableFuture<List<Extract<CashTransaction>>> cash =
            CompletableFuture.supplyAsync(() -> parseAll(files.cash(), parser::parseCashTransactions), parseExecutor);
        CompletableFuture<List<Extract<NavSnapshot>>> nav =
            CompletableFuture.supplyAsync(() -> parseAll(files.nav(), parser::parseNavSnapshots), parseExecutor);
        CompletableFuture<List<Extract<OptionLifecycleEvent>>> exercises =
            CompletableFuture.supplyAsync(() -> parseAll(files.exercises(), parser::parseOptionEvents), parseExecutor);
        CompletableFuture<List<Extract<CashTransaction>>> interest =
            CompletableFuture.supplyAsync(() -> parseAll(files.interest(), parser::parseInterestAccruals), parseExecutor);

        // Barrier: nothing is merged until every feed parsed cleanly
        try {
            CompletableFuture.allOf(trades, cash, nav, exercises, interest).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof AlmException alm) throw alm;
            throw new FeedParseException("ingest", "feed parsing failed: " + e.getCause(), e.getCause());
        }
        // Interest accruals are cash movements; deduplicated together with the cash feed
        List<Extract<CashTransaction>> allCash = new ArrayList<>(cash.join());
        allCash.addAll(interest.join());
        return merge(trades.join(), allCash, nav.join(), exercises.join());
    }

    public IngestionResult merge(List<Extract<TradeExecution>> trades,
                                 List<Extract<CashTransaction>> cash,
                                 List<Extract<NavSnapshot>> nav) {
        return merge(trades, cash, nav, List.of());
    }

    /** Deduplicates already-parsed extracts. Pure: same input, same output. */
    public IngestionResult merge(List<Extract<TradeExecution>> trades,
                                 List<Extract<CashTransaction>> cash,
                                 List<Extract<NavSnapshot>> nav,
                                 List<Extract<OptionLifecycleEvent>> optionEvents) {
        List<DuplicateConflict> conflicts = new ArrayList<>();
        List<TradeExecution> uniqueTrades = dedupe(trades, conflicts);
        List<CashTransaction> uniqueCash = dedupe(cash, conflicts);
        List<NavSnapshot> uniqueNav = dedupe(nav, conflicts);
        List<OptionLifecycleEvent> uniqueOptionEvents = dedupe(optionEvents, conflicts);
        IngestionResult result = new IngestionResult(uniqueTrades, uniqueCash, uniqueNav, uniqueOptionEvents,
            List.copyOf(conflicts));
        log.info("FeedIngestor: {} trades, {} cash transactions, {} NAV snapshots, {} option events ({} conflicts)",
            uniqueTrades.size(), uniqueCash.size(), uniqueNav.size(), uniqueOptionEvents.size(), conflicts.size());
        return result;
    }

    @PreDestroy
    public void shutdown() {
        parseExecutor.shutdownNow();
    }

    // ── Internals ─────────────────────────────────────────────────────────────

    private static <T extends RawRecord> List<Extract<T>> parseAll(List<Path> files, Function<Path, List<T>> parse) {
        List<Extract<T>> extracts = new ArrayList<>();
        for (Path file : files) {
            extracts.add(new Extract<>(String.valueOf(file.getFileName()), parse.apply(file)));
        }
        return extracts;
    }

    static <T extends RawRecord> List<T> dedupe(List<Extract<T>> extracts, List<DuplicateConflict> conflicts) {
        Map<String, T> kept = new LinkedHashMap<>();
        Map<String, String> keptFrom = new LinkedHashMap<>();
        for (Extract<T> extract : extracts) {
            for (T record : extract.records()) {
                String id = record.transactionId();
                T existing = kept.get(id);
                if (existing == null) {
                    kept.put(id, record);
                    keptFrom.put(id, extract.source());
                } else if (!existing.equals(record)) {
                    DuplicateConflict conflict = new DuplicateConflict(
                        record.sourceType(), id, keptFrom.get(id), extract.source());
                    log.warn("Duplicate {} {} differs between {} and {} — keeping the first",
                        record.sourceType(), id, conflict.keptFrom(), conflict.discardedFrom());
                    conflicts.add(conflict);
                }
            }
        }
        return List.copyOf(kept.values());
    }
}
