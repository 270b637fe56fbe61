package com.jay.alm.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of applying one stock event to the position tracker.
 *
 * @param closed      lots fully closed by the event, in FIFO order
 * @param reduced     lots partially closed and still open
 * @param opened      the lot opened by the event (or its unmatched remainder), may be null
 * @param realizedPnl realized P&L in the reporting currency
 */
public record PositionOutcome(List<OpenPosition> closed, List<OpenPosition> reduced,
                              OpenPosition opened, BigDecimal realizedPnl) {

    public boolean closedAny() {
        return !closed.isEmpty() || !reduced.isEmpty();
    }

    /** Position the ledger row links to: the first lot touched, else the opened lot. */
    public String linkedPositionId() {
        if (!closed.isEmpty()) return closed.get(0).getPositionId();
        if (!reduced.isEmpty()) return reduced.get(0).getPositionId();
        return opened != null ? opened.getPositionId() : null;
    }
}
