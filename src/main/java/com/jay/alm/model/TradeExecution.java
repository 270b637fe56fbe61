package com.jay.alm.model;

import com.jay.alm.model.enums.AssetCategory;
import com.jay.alm.model.enums.OptionRight;
import com.jay.alm.model.enums.SourceType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A trade execution or internal booking from the Trades extract.
 * Quantity is signed (negative = sell). Monetary fields are in the trade currency.
 */
@Builder(toBuilder = true)
public record TradeExecution(
    String transactionId,
    Instant timestamp,
    String symbol,
    String underlyingSymbol,
    String description,
    BigDecimal quantity,
    BigDecimal tradePrice,
    BigDecimal proceeds,
    BigDecimal commission,
    BigDecimal fifoPnlRealized,
    AssetCategory assetCategory,
    String transactionType,
    String currency,
    BigDecimal fxRateToBase,   // null when the extract does not carry one
    BigDecimal strike,
    OptionRight right,
    LocalDate expiry,
    BigDecimal multiplier
) implements RawRecord {

    public static final String BOOK_TRADE = "BookTrade";

    @Override
    public SourceType sourceType() {
        return SourceType.TRADE;
    }

    public boolean isBookTrade() {
        return BOOK_TRADE.equalsIgnoreCase(transactionType);
    }

    public boolean isStock() {
        return assetCategory == AssetCategory.STK;
    }

    public boolean isOption() {
        return assetCategory == AssetCategory.OPT;
    }
}
