package com.example.transfersim.mq.msg;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 轉帳 saga 請求
 *
 * Topic: transfer-saga-requests
 * 消息流向：TransferStatusChangedListener / 維護排程 → TransferSagaConsumer
 *
 * 重複投遞無害：saga 只會接手 PENDING 的轉帳
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferSagaMsg implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * 轉帳內部 ID
     */
    private Long id;

    /**
     * 對外轉帳 ID（p2p_...），同時作為 sharding key
     */
    private String transferId;

    /**
     * 時間戳（Unix epoch milliseconds）
     */
    private long timestamp;
}
