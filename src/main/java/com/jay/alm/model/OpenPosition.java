package com.jay.alm.model;

import com.jay.alm.model.enums.PositionStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A FIFO stock lot. {@code quantity} is the signed size at entry,
 * {@code openQuantity} what remains after partial closes.
 */
@Data
@Builder(toBuilder = true)
public class OpenPosition {
    private String positionId;
    private String symbol;
    private BigDecimal quantity;
    private BigDecimal openQuantity;
    private BigDecimal entryPrice;
    private Instant entryTimestamp;
    private String entryTransactionId;
    private BigDecimal fxRateAtEntry;
    private boolean fromAssignment;

    @Builder.Default
    private PositionStatus status = PositionStatus.OPEN;

    // Exit details (filled when closed)
    private BigDecimal exitPrice;
    private Instant exitTimestamp;
    private String exitTransactionId;
    @Builder.Default
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    public static String idFor(String entryTransactionId) {
        return "POS-" + entryTransactionId;
    }

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    /** +1 for long lots, -1 for short lots. */
    public int sign() {
        return quantity.signum();
    }

    /** Detached snapshot of the lot as it is now. */
    public OpenPosition copy() {
        return toBuilder().build();
    }
}
