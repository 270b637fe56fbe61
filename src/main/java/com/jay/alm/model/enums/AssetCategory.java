package com.jay.alm.model.enums;

public enum AssetCategory {
    STK,    // Stock / ETF
    OPT,    // Equity or index option
    OTHER;  // Futures, cash (FX) and anything else the engine does not track

    public static AssetCategory fromCode(String code) {
        if ("STK".equalsIgnoreCase(code)) return STK;
        if ("OPT".equalsIgnoreCase(code)) return OPT;
        return OTHER;
    }
}
