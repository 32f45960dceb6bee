package com.example.transfersim.exception;

/**
 * 結算不存在異常
 */
public class SettlementNotFoundException extends RuntimeException {

    public SettlementNotFoundException(String settlementId) {
        super("Settlement not found: " + settlementId);
    }
}
