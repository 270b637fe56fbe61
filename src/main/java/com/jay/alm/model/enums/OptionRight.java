package com.jay.alm.model.enums;

public enum OptionRight {
    PUT,
    CALL;

    public static OptionRight fromCode(String code) {
        if (code == null) return null;
        return switch (code.trim().toUpperCase()) {
            case "P", "PUT" -> PUT;
            case "C", "CALL" -> CALL;
            default -> throw new IllegalArgumentException("Unknown option right: " + code);
        };
    }
}
