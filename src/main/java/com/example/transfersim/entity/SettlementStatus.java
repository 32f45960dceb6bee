package com.example.transfersim.entity;

/**
 * 結算狀態
 *
 * PENDING → PROCESSING → COMPLETED / FAILED
 */
public enum SettlementStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
