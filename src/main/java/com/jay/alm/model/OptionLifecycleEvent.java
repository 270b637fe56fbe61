package com.jay.alm.model;

import com.jay.alm.model.enums.OptionEventType;
import com.jay.alm.model.enums.OptionRight;
import com.jay.alm.model.enums.SourceType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One row of the broker's exercises-and-expiries statement ({@code OptionEAE}).
 * Used to confirm or settle how BookTrade legs are classified; never a ledger event itself.
 * Rows are identified by (symbol, date, type, trade id), as the statement repeats them
 * across overlapping extracts without a transaction id of their own.
 */
@Builder(toBuilder = true)
public record OptionLifecycleEvent(
    String tradeId,
    LocalDate date,
    OptionEventType type,
    String symbol,
    String underlyingSymbol,
    BigDecimal quantity,
    BigDecimal strike,
    OptionRight right,
    BigDecimal tradePrice,
    BigDecimal markPrice,
    String currency
) implements RawRecord {

    @Override
    public SourceType sourceType() {
        return SourceType.OPTION_EVENT;
    }

    @Override
    public String transactionId() {
        return symbol + "|" + date + "|" + type + "|" + (tradeId != null ? tradeId : "");
    }
}
