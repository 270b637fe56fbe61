package com.jay.alm.layer6_reconcile;

import com.jay.alm.config.AlmConfig;
import com.jay.alm.model.AmbiguousAssignmentGroup;
import com.jay.alm.model.DailyReconciliation;
import com.jay.alm.model.DailySummary;
import com.jay.alm.model.DuplicateConflict;
import com.jay.alm.model.Finding;
import com.jay.alm.model.Money;
import com.jay.alm.model.NavSnapshot;
import com.jay.alm.model.ReconciliationReport;
import com.jay.alm.model.ReportedDay;
import com.jay.alm.model.enums.FindingType;
import com.jay.alm.model.enums.SummaryStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layer 6 — Reconciliation Reporter.
 * Compares computed daily summaries with the broker's NAV snapshots and produces the
 * pre-refresh safety gate: any failing day or period check makes the report FAILED.
 *
 * Per day:
 *   discrepancy = computed closing − reported closing, failing beyond the NAV tolerance
 *   naive return   = gross P&L ÷ opening NAV
 *   correct return = (gross P&L − commissions) ÷ (opening NAV + deposits before open)
 * The two returns must agree within the return tolerance (percentage points); a gap means
 * a consumer dividing by the unadjusted opening NAV would publish the wrong figure.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationReporter {

    private final AlmConfig config;

    /** Both ways of computing a day's return, in percent (scale 4). */
    public record ReturnComparison(BigDecimal naivePct, BigDecimal correctPct, BigDecimal adjustedBase,
                                   BigDecimal netPnl) {
        public BigDecimal divergence() {
            if (naivePct == null || correctPct == null) return null;
            return naivePct.subtract(correctPct).abs();
        }
    }

    public static ReturnComparison compareReturns(BigDecimal openingNav, BigDecimal depositsBeforeOpen,
                                                  BigDecimal grossPnl, BigDecimal commissions) {
        BigDecimal netPnl = Money.of(grossPnl.subtract(commissions.abs()));
        if (openingNav == null) return new ReturnComparison(null, null, null, netPnl);
        BigDecimal adjustedBase = Money.of(openingNav.add(depositsBeforeOpen));
        return new ReturnComparison(Money.percent(grossPnl, openingNav),
            Money.percent(netPnl, adjustedBase), adjustedBase, netPnl);
    }

    public List<ReportedDay> reportedDays(List<NavSnapshot> snapshots) {
        return snapshots.stream()
            .filter(NavSnapshot::isSingleDay)
            .sorted(Comparator.comparing(NavSnapshot::toDate))
            .map(ReportedDay::from)
            .toList();
    }

    public ReconciliationReport reconcile(List<DailySummary> summaries, List<NavSnapshot> snapshots,
                                          List<AmbiguousAssignmentGroup> ambiguousGroups,
                                          List<DuplicateConflict> conflicts) {
        Map<LocalDate, ReportedDay> reported = new LinkedHashMap<>();
        reportedDays(snapshots).forEach(r -> reported.putIfAbsent(r.date(), r));

        List<DailyReconciliation> days = new ArrayList<>();
        for (DailySummary summary : summaries) {
            days.add(reconcileDay(summary, reported.get(summary.date())));
        }
        List<Finding> periodFindings = checkPeriods(summaries, snapshots);
        List<Finding> reviewItems = reviewItems(ambiguousGroups, conflicts);

        boolean failed = days.stream().anyMatch(d -> d.status() == SummaryStatus.FAILED
                || d.status() == SummaryStatus.MISSING_PRIOR_DAY_NAV)
            || !periodFindings.isEmpty()
            || (config.reconciliation().isFailOnUnresolvedAssignments() && !ambiguousGroups.isEmpty());
        SummaryStatus overall = failed ? SummaryStatus.FAILED : SummaryStatus.PASSED;

        if (failed) {
            log.warn("Reconciliation FAILED: {} failing day(s), {} period finding(s), {} review item(s)",
                days.stream().filter(d -> d.status() != SummaryStatus.PASSED && d.status() != SummaryStatus.NO_REFERENCE).count(),
                periodFindings.size(), reviewItems.size());
        } else {
            log.info("Reconciliation PASSED: {} day(s), {} review item(s)", days.size(), reviewItems.size());
        }
        return new ReconciliationReport(List.copyOf(days), periodFindings, reviewItems, overall);
    }

    // ── Per-day check ─────────────────────────────────────────────────────────

    DailyReconciliation reconcileDay(DailySummary summary, ReportedDay reported) {
        AlmConfig.Reconciliation rules = config.reconciliation();
        List<Finding> violations = new ArrayList<>();
        boolean failing = false;

        if (summary.status() == SummaryStatus.MISSING_PRIOR_DAY_NAV) {
            violations.add(new Finding(FindingType.MISSING_PRIOR_DAY_NAV, summary.date(), null,
                "No prior-day or reported opening NAV for " + summary.date()));
        }

        BigDecimal discrepancy = null;
        if (reported != null && reported.closingNav() != null) {
            discrepancy = Money.of(summary.closingNav().subtract(reported.closingNav()));
            if (discrepancy.abs().compareTo(rules.getNavTolerance()) > 0) {
                failing = true;
                violations.add(new Finding(FindingType.RECONCILIATION_DISCREPANCY, summary.date(), null,
                    String.format("Computed closing NAV %s vs reported %s (discrepancy %s, tolerance %s)",
                        summary.closingNav(), reported.closingNav(), discrepancy, rules.getNavTolerance())));
            }
        }

        ReturnComparison returns = compareReturns(summary.openingNav(), summary.depositsBeforeOpen(),
            summary.totalPnl(), summary.commissions());
        BigDecimal divergence = returns.divergence();
        if (divergence != null && divergence.compareTo(rules.getReturnTolerancePct()) > 0) {
            failing |= rules.isFailOnReturnDivergence();
            violations.add(new Finding(FindingType.RETURN_DIVERGENCE, summary.date(), null,
                String.format("Naive return %s%% (gross %s ÷ opening %s) differs from correct return %s%% "
                        + "(net %s ÷ adjusted base %s)",
                    returns.naivePct(), summary.totalPnl(), summary.openingNav(),
                    returns.correctPct(), returns.netPnl(), returns.adjustedBase())));
        }

        SummaryStatus status;
        if (summary.status() == SummaryStatus.MISSING_PRIOR_DAY_NAV) status = SummaryStatus.MISSING_PRIOR_DAY_NAV;
        else if (failing) status = SummaryStatus.FAILED;
        else if (reported == null) status = SummaryStatus.NO_REFERENCE;
        else status = SummaryStatus.PASSED;

        return DailyReconciliation.builder()
            .date(summary.date())
            .openingNav(summary.openingNav())
            .closingNav(summary.closingNav())
            .totalPnl(summary.totalPnl())
            .netCashFlow(summary.netCashFlow())
            .reportedClosingNav(reported != null ? reported.closingNav() : null)
            .discrepancy(discrepancy)
            .tolerance(rules.getNavTolerance())
            .naiveReturnPct(returns.naivePct())
            .correctReturnPct(returns.correctPct())
            .status(status)
            .violations(List.copyOf(violations))
            .build();
    }

    // ── Period and review checks ──────────────────────────────────────────────

    private List<Finding> checkPeriods(List<DailySummary> summaries, List<NavSnapshot> snapshots) {
        List<Finding> findings = new ArrayList<>();
        BigDecimal tolerance = config.reconciliation().getNavTolerance();
        for (NavSnapshot period : snapshots) {
            if (period.isSingleDay()) continue;
            DailySummary lastDay = summaries.stream()
                .filter(s -> period.covers(s.date()))
                .reduce((a, b) -> b)
                .orElse(null);
            if (lastDay == null) continue;
            BigDecimal diff = Money.of(lastDay.closingNav().subtract(period.endingValue()));
            if (diff.abs().compareTo(tolerance) > 0) {
                findings.add(new Finding(FindingType.PERIOD_NAV_DISCREPANCY, null, period.transactionId(),
                    String.format("Closing NAV %s on %s vs reported period ending value %s for %s..%s (difference %s)",
                        lastDay.closingNav(), lastDay.date(), period.endingValue(),
                        period.fromDate(), period.toDate(), diff)));
            }
        }
        return List.copyOf(findings);
    }

    private List<Finding> reviewItems(List<AmbiguousAssignmentGroup> groups, List<DuplicateConflict> conflicts) {
        List<Finding> items = new ArrayList<>();
        for (AmbiguousAssignmentGroup g : groups) {
            items.add(new Finding(FindingType.AMBIGUOUS_ASSIGNMENT_GROUP, null, String.join(",", g.allTransactionIds()),
                String.format("%d stock and %d option BookTrade legs at %s excluded from the ledger",
                    g.stockTransactionIds().size(), g.optionTransactionIds().size(), g.timestamp())));
        }
        for (DuplicateConflict c : conflicts) {
            items.add(new Finding(FindingType.DUPLICATE_TRANSACTION_CONFLICT, null, c.transactionId(),
                String.format("%s %s differs between %s (kept) and %s", c.sourceType(), c.transactionId(),
                    c.keptFrom(), c.discardedFrom())));
        }
        return List.copyOf(items);
    }
}
