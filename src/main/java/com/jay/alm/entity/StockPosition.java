package com.jay.alm.entity;

import com.jay.alm.model.enums.PositionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "stock_positions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockPosition {

    @Id
    @Column(name = "position_id", length = 90)
    private String positionId;

    @Column(length = 40, nullable = false)
    private String symbol;

    @Column(precision = 19, scale = 4)
    private BigDecimal quantity;        // Signed size at entry
    @Column(precision = 19, scale = 4)
    private BigDecimal openQuantity;    // What is left after partial closes
    @Column(precision = 19, scale = 6)
    private BigDecimal entryPrice;
    private Instant entryTimestamp;
    @Column(length = 80)
    private String entryTransactionId;
    @Column(precision = 19, scale = 8)
    private BigDecimal fxRateAtEntry;
    private boolean fromAssignment;

    @Enumerated(EnumType.STRING)
    @Column(length = 10, nullable = false)
    private PositionStatus status;

    // Outcome (filled when the lot is closed)
    @Column(precision = 19, scale = 6)
    private BigDecimal exitPrice;
    private Instant exitTimestamp;
    @Column(length = 80)
    private String exitTransactionId;
    @Column(precision = 19, scale = 2)
    private BigDecimal realizedPnl;
}
