package com.example.transfersim.entity;

/**
 * 收款人分類
 */
public enum RecipientType {
    INDIVIDUAL,
    MICRO_MERCHANT
}
