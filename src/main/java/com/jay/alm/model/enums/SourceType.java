package com.jay.alm.model.enums;

public enum SourceType {
    TRADE,
    CASH_TRANSACTION,
    NAV_SNAPSHOT,
    OPTION_EVENT
}
