package com.jay.alm.entity;

import com.jay.alm.model.enums.SummaryStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Table(name = "daily_summary")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailySummaryRecord {

    @Id
    @Column(name = "summary_date")
    private LocalDate summaryDate;

    @Column(precision = 19, scale = 2)
    private BigDecimal openingNav;     // Null when no prior-day NAV was known
    @Column(precision = 19, scale = 2)
    private BigDecimal closingNav;
    @Column(precision = 19, scale = 2)
    private BigDecimal totalPnl;
    @Column(precision = 19, scale = 2)
    private BigDecimal netCashFlow;
    @Column(precision = 19, scale = 2)
    private BigDecimal commissions;
    @Column(precision = 19, scale = 2)
    private BigDecimal depositsBeforeOpen;
    private int eventCount;

    @Enumerated(EnumType.STRING)
    @Column(length = 30)
    private SummaryStatus status;
    private Boolean discrepancyFlag;
}
