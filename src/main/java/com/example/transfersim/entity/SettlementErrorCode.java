package com.example.transfersim.entity;

/**
 * 結算失敗錯誤碼
 */
public enum SettlementErrorCode {
    BANK_UNAVAILABLE,
    ESCROW_RELEASE_FAILED,
    DEBIT_FAILED,
    CREDIT_FAILED
}
