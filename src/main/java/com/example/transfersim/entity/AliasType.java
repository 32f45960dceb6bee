package com.example.transfersim.entity;

/**
 * 別名類型
 */
public enum AliasType {
    EMAIL,
    PHONE,
    USERNAME,
    RANDOM_KEY
}
