package com.jay.alm.model;

import com.jay.alm.model.enums.BookingClassification;

import java.util.List;
import java.util.Map;

/**
 * Classification of BookTrade legs.
 *
 * @param classifications transaction id → classification (unlisted bookings are ordinary trades)
 * @param optionToStock   option-leg transaction id → stock-leg transaction id
 * @param ambiguousGroups groups left UNRESOLVED
 */
public record AssignmentDetection(Map<String, BookingClassification> classifications,
                                  Map<String, String> optionToStock,
                                  List<AmbiguousAssignmentGroup> ambiguousGroups) {

    public BookingClassification classificationOf(String transactionId) {
        return classifications.get(transactionId);
    }

    public boolean isUnresolved(String transactionId) {
        return classifications.get(transactionId) == BookingClassification.UNRESOLVED;
    }
}
