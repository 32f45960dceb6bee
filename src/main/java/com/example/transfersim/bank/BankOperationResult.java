package com.example.transfersim.bank;

import lombok.Builder;
import lombok.Value;

/**
 * 銀行操作結果（debit / credit / escrow release 共用）
 *
 * 成功時帶外部交易 ID；失敗時帶錯誤碼與訊息
 */
@Value
@Builder
public class BankOperationResult {

    boolean success;
    String transactionId;
    String error;
    String message;

    public static BankOperationResult success(String transactionId) {
        return BankOperationResult.builder()
                .success(true)
                .transactionId(transactionId)
                .build();
    }

    public static BankOperationResult failure(String error, String message) {
        return BankOperationResult.builder()
                .success(false)
                .error(error)
                .message(message)
                .build();
    }

    /**
     * 寫入狀態訊息用：message → error → fallback
     */
    public String describeFailure(String fallback) {
        if (message != null && !message.isBlank()) {
            return message;
        }
        if (error != null && !error.isBlank()) {
            return error;
        }
        return fallback;
    }
}
