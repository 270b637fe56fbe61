package com.jay.alm.model;

import com.jay.alm.model.enums.FindingType;

import java.time.LocalDate;

/**
 * A business signal for the human reconciler. {@code date} is null for period-level findings.
 */
public record Finding(FindingType type, LocalDate date, String reference, String message) {}
