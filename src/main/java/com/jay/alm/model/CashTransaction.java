package com.jay.alm.model;

import com.jay.alm.model.enums.SourceType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

@Builder(toBuilder = true)
public record CashTransaction(
    String transactionId,
    Instant timestamp,
    String type,
    String description,
    BigDecimal amount,
    String currency,
    BigDecimal fxRateToBase
) implements RawRecord {

    @Override
    public SourceType sourceType() {
        return SourceType.CASH_TRANSACTION;
    }
}
