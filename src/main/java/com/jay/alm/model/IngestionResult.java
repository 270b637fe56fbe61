package com.jay.alm.model;

import java.util.List;

/**
 * Deduplicated output of one ingestion pass, in first-seen order per source type.
 * {@code optionEvents} is empty when no exercises-and-expiries extract was supplied.
 */
public record IngestionResult(
    List<TradeExecution> trades,
    List<CashTransaction> cashTransactions,
    List<NavSnapshot> navSnapshots,
    List<OptionLifecycleEvent> optionEvents,
    List<DuplicateConflict> conflicts
) {
    public IngestionResult(List<TradeExecution> trades, List<CashTransaction> cashTransactions,
                           List<NavSnapshot> navSnapshots, List<DuplicateConflict> conflicts) {
        this(trades, cashTransactions, navSnapshots, List.of(), conflicts);
    }

    public int recordCount() {
        return trades.size() + cashTransactions.size() + navSnapshots.size() + optionEvents.size();
    }
}
