package com.jay.alm.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * The merged chronological ledger of one run.
 *
 * @param events          ledger rows in (timestamp, transaction id) order
 * @param seedNav         reported starting NAV the running NAV was seeded with; null if unknown
 * @param positions       every lot touched by the run (open and closed), in entry order
 * @param unresolved      bookings excluded from the ledger pending manual review
 * @param ambiguousGroups the groups those bookings belong to
 */
public record Ledger(
    List<FinancialEvent> events,
    BigDecimal seedNav,
    List<OpenPosition> positions,
    List<TradeExecution> unresolved,
    List<AmbiguousAssignmentGroup> ambiguousGroups
) {
    public boolean seedKnown() {
        return seedNav != null;
    }

    public List<OpenPosition> openPositions() {
        return positions.stream().filter(OpenPosition::isOpen).toList();
    }

    public BigDecimal finalNav() {
        if (events.isEmpty()) return seedNav;
        return events.get(events.size() - 1).runningNav();
    }
}
