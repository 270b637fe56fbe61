package com.jay.alm.model;

import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/**
 * BookTrade legs that could not be paired automatically: several stock legs at one timestamp,
 * or option legs whose same-day stock legs were booked at another timestamp. The timestamp is
 * that of the option legs' bucket.
 */
public record AmbiguousAssignmentGroup(Instant timestamp, List<String> stockTransactionIds,
                                       List<String> optionTransactionIds) {

    public List<String> allTransactionIds() {
        return Stream.concat(stockTransactionIds.stream(), optionTransactionIds.stream())
            .toList();
    }
}
