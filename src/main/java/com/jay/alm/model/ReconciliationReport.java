package com.jay.alm.model;

import com.jay.alm.model.enums.SummaryStatus;

import java.util.List;

/**
 * Result of one reconciliation pass. {@link #passed()} is the pre-refresh safety gate.
 *
 * @param days           one record per computed day, ascending
 * @param periodFindings findings not tied to a single day
 * @param reviewItems    ambiguous groups and duplicate conflicts for manual review
 * @param status         PASSED or FAILED
 */
public record ReconciliationReport(List<DailyReconciliation> days, List<Finding> periodFindings,
                                   List<Finding> reviewItems, SummaryStatus status) {

    public boolean passed() {
        return status == SummaryStatus.PASSED;
    }

    public List<DailyReconciliation> failedDays() {
        return days.stream().filter(DailyReconciliation::failed).toList();
    }
}
