package com.example.transfersim.mq.constants;

/**
 * RocketMQ 常數定義
 *
 * 集中管理 Topic、Consumer Group 等常數
 */
public final class MQConstants {

    private MQConstants() {
        throw new UnsupportedOperationException("Utility class");
    }

    // ==================== Topics ====================

    /**
     * 轉帳 saga 請求 Topic
     * 用途：建立轉帳後把 saga 交給背景執行
     */
    public static final String TOPIC_TRANSFER_SAGA_REQUESTS = "transfer-saga-requests";

    // ==================== Consumer Groups ====================

    /**
     * Transfer Saga Consumer Group
     * 消費 transfer-saga-requests，執行 TransferSaga
     */
    public static final String GROUP_TRANSFER_SAGA = "transfer-saga-consumer-group";

    /**
     * 訊息分片用的 user property
     */
    public static final String SHARDING_KEY_PROPERTY = "__SHARDINGKEY";
}
