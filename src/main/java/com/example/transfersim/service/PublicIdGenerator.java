package com.example.transfersim.service;

import java.util.UUID;

/**
 * 對外 ID 產生器
 *
 * 格式：{prefix}_{UUID 去除 - 後的前 24 個 hex 字元}
 */
public final class PublicIdGenerator {

    private static final int ID_LENGTH = 24;

    private PublicIdGenerator() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String transferId() {
        return "p2p_" + randomHex();
    }

    public static String settlementId() {
        return "stl_" + randomHex();
    }

    private static String randomHex() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, ID_LENGTH);
    }
}
