package com.jay.alm.model.enums;

public enum RunMode {
    FULL,
    APPEND
}
