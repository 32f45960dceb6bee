package com.example.transfersim.entity;

/**
 * 轉帳類型
 *
 * - P2P: 一般個人轉帳
 * - MERCHANT: 收款人為 Micro Merchant
 * - REFUND: 退款（保留）
 * - CONTRACT_SETTLEMENT: 合約結算產生的轉帳
 */
public enum TransferType {
    P2P,
    MERCHANT,
    REFUND,
    CONTRACT_SETTLEMENT
}
