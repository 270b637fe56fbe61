package com.jay.alm.model.enums;

public enum BookingClassification {
    ASSIGNMENT,
    EXPIRATION,
    UNRESOLVED   // More than one stock leg at the same timestamp — left for manual review
}
