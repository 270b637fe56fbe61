package com.jay.alm.entity;

import com.jay.alm.model.enums.EventKind;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "chronological_events",
    uniqueConstraints = @UniqueConstraint(name = "uk_event_source_tx", columnNames = "source_transaction_id"),
    indexes = @Index(name = "idx_event_timestamp", columnList = "event_timestamp"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChronologicalEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_transaction_id", nullable = false, length = 80)
    private String sourceTransactionId;

    @Column(name = "event_timestamp", nullable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private EventKind kind;

    @Column(length = 40)
    private String symbol;
    @Column(length = 300)
    private String description;

    // Reporting-currency amounts
    @Column(precision = 19, scale = 2)
    private BigDecimal cashImpact;
    @Column(precision = 19, scale = 2)
    private BigDecimal realizedPnl;
    @Column(precision = 19, scale = 2)
    private BigDecimal commission;
    @Column(precision = 19, scale = 2)
    private BigDecimal runningNav;

    @Column(length = 3)
    private String currency;
    @Column(precision = 19, scale = 8)
    private BigDecimal fxRate;

    @Column(length = 40)
    private String cashType;            // CashTransaction type, cash movements only
    @Column(length = 80)
    private String linkedTransactionId; // Option leg → stock leg of an assignment
    @Column(length = 90)
    private String linkedPositionId;
    private boolean synthetic;
}
