package com.example.transfersim.service;

import java.util.Locale;

/**
 * 查詢轉帳歷史的方向（相對於查詢者）
 */
public enum TransferDirection {
    SENT,
    RECEIVED,
    ALL;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param value sent | received | all（不分大小寫），null 視為 all
     */
    public static TransferDirection fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid direction: " + value + ". Expected sent, received or all");
        }
    }
}
