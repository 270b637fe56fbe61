package com.jay.alm.model;

import com.jay.alm.model.enums.SourceType;

/**
 * Same transaction id seen with differing attributes in overlapping extracts.
 * The first-seen record was kept.
 */
public record DuplicateConflict(SourceType sourceType, String transactionId,
                                String keptFrom, String discardedFrom) {}
