package com.jay.alm;

import com.jay.alm.config.AlmConfig;
import com.jay.alm.model.CashTransaction;
import com.jay.alm.model.NavSnapshot;
import com.jay.alm.model.TradeExecution;
import com.jay.alm.model.enums.AssetCategory;
import com.jay.alm.model.enums.OptionRight;

import java.math.BigDecimal;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;

/** Shared builders for engine tests. Timestamps are New York local time. */
public final class TestData {

    public static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private TestData() {}

    /** Defaults with USD as reporting currency, so amounts need no conversion. */
    public static AlmConfig usdConfig() {
        AlmConfig config = new AlmConfig();
        config.reporting().setCurrency("USD");
        return config;
    }

    public static Path feedsDir() {
        try {
            return Path.of(TestData.class.getResource("/feeds").toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static Instant ny(String localDateTime) {
        return LocalDateTime.parse(localDateTime).atZone(NEW_YORK).toInstant();
    }

    public static BigDecimal d(String value) {
        return new BigDecimal(value);
    }

    public static TradeExecution stock(String id, String at, String symbol, String qty, String price,
                                       String commission) {
        BigDecimal quantity = d(qty);
        BigDecimal tradePrice = d(price);
        return TradeExecution.builder()
            .transactionId(id)
            .timestamp(ny(at))
            .symbol(symbol)
            .underlyingSymbol(symbol)
            .quantity(quantity)
            .tradePrice(tradePrice)
            .proceeds(quantity.multiply(tradePrice).negate())
            .commission(d(commission))
            .fifoPnlRealized(BigDecimal.ZERO)
            .assetCategory(AssetCategory.STK)
            .transactionType("ExchTrade")
            .currency("USD")
            .build();
    }

    public static TradeExecution stockBooking(String id, String at, String symbol, String qty, String price) {
        return stock(id, at, symbol, qty, price, "0").toBuilder().transactionType("BookTrade").build();
    }

    public static TradeExecution option(String id, String at, String underlying, String strike, OptionRight right,
                                        String qty, String price, String commission, String reportedPnl) {
        BigDecimal quantity = d(qty);
        return TradeExecution.builder()
            .transactionId(id)
            .timestamp(ny(at))
            .symbol(underlying + " " + strike + (right == OptionRight.PUT ? "P" : "C"))
            .underlyingSymbol(underlying)
            .quantity(quantity)
            .tradePrice(d(price))
            .proceeds(quantity.multiply(d(price)).multiply(d("100")).negate())
            .commission(d(commission))
            .fifoPnlRealized(d(reportedPnl))
            .assetCategory(AssetCategory.OPT)
            .transactionType("ExchTrade")
            .currency("USD")
            .strike(d(strike))
            .right(right)
            .expiry(ny(at).atZone(NEW_YORK).toLocalDate())
            .multiplier(d("100"))
            .build();
    }

    public static TradeExecution optionBooking(String id, String at, String underlying, String strike,
                                               OptionRight right, String qty, String reportedPnl) {
        return option(id, at, underlying, strike, right, qty, "0", "0", reportedPnl)
            .toBuilder().transactionType("BookTrade").build();
    }

    public static CashTransaction cash(String id, String at, String type, String amount) {
        return CashTransaction.builder()
            .transactionId(id)
            .timestamp(ny(at))
            .type(type)
            .description(type)
            .amount(d(amount))
            .currency("USD")
            .build();
    }

    public static CashTransaction deposit(String id, String at, String amount) {
        return cash(id, at, "Deposits/Withdrawals", amount);
    }

    public static NavSnapshot nav(String from, String to, String starting, String ending, String deposits) {
        return NavSnapshot.builder()
            .fromDate(LocalDate.parse(from))
            .toDate(LocalDate.parse(to))
            .startingValue(d(starting))
            .endingValue(d(ending))
            .depositsWithdrawals(d(deposits))
            .markToMarket(BigDecimal.ZERO)
            .realized(BigDecimal.ZERO)
            .fees(BigDecimal.ZERO)
            .commissions(BigDecimal.ZERO)
            .interest(BigDecimal.ZERO)
            .changeInInterestAccruals(BigDecimal.ZERO)
            .currency("USD")
            .build();
    }
}
