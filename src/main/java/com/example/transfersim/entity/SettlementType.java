package com.example.transfersim.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * 結算類型（對外使用小寫 snake_case）
 */
public enum SettlementType {
    WINNER_PAYOUT("winner_payout"),
    REFUND("refund"),
    PARTIAL("partial"),
    DISPUTE_RESOLUTION("dispute_resolution");

    private final String code;

    SettlementType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static SettlementType fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported settlement type: " + code));
    }
}
