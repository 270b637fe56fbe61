package com.jay.alm.model.enums;

public enum FindingType {
    RECONCILIATION_DISCREPANCY,  // |computed - reported closing NAV| above tolerance
    RETURN_DIVERGENCE,           // naive and adjusted daily returns disagree
    MISSING_PRIOR_DAY_NAV,       // no prior closing and no reported opening for the day
    PERIOD_NAV_DISCREPANCY,      // final closing NAV vs a multi-day snapshot's ending value
    AMBIGUOUS_ASSIGNMENT_GROUP,
    DUPLICATE_TRANSACTION_CONFLICT
}
