package com.jay.alm.model.enums;

public enum SummaryStatus {
    COMPUTED,
    MISSING_PRIOR_DAY_NAV,
    PASSED,
    FAILED,
    NO_REFERENCE   // No broker-reported NAV for the day to compare against
}
