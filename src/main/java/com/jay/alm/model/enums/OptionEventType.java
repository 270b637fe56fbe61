package com.jay.alm.model.enums;

/**
 * Row types of the broker's exercises-and-expiries statement. An ASSIGNMENT or EXERCISE
 * row is followed by the BUY/SELL row of the stock it delivered.
 */
public enum OptionEventType {
    ASSIGNMENT,
    EXERCISE,
    EXPIRATION,
    BUY,
    SELL;

    /** Null for row types the engine does not use. */
    public static OptionEventType fromCode(String code) {
        if (code == null) return null;
        return switch (code.trim().toUpperCase()) {
            case "ASSIGNMENT" -> ASSIGNMENT;
            case "EXERCISE" -> EXERCISE;
            case "EXPIRATION", "EXPIRY" -> EXPIRATION;
            case "BUY" -> BUY;
            case "SELL" -> SELL;
            default -> null;
        };
    }

    public boolean delivers() {
        return this == ASSIGNMENT || this == EXERCISE;
    }

    public boolean isStockDelivery() {
        return this == BUY || this == SELL;
    }
}
