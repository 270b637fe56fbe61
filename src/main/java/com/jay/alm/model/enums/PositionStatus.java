package com.jay.alm.model.enums;

public enum PositionStatus {
    OPEN,
    CLOSED
}
