package com.jay.alm.model.enums;

public enum EventKind {
    TRADE,
    CASH_MOVEMENT,
    ASSIGNMENT,
    EXPIRATION
}
