package com.example.transfersim.webhook.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * transfer.completed 事件（送往錢包推播服務）
 *
 * idempotencyKey 固定為 transferId，接收端以此去重
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class TransferCompletedPayload {

    public static final String EVENT_TYPE = "transfer.completed";

    private String eventType;
    private String timestamp;
    private String idempotencyKey;
    private TransferData data;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public static class TransferData {
        private String transferId;
        private String recipientUserId;
        private String recipientBsimId;
        private String recipientAlias;
        private String recipientAliasType;

        /**
         * individual | merchant
         */
        private String recipientType;
        private String merchantName;
        private String senderDisplayName;
        private String senderAlias;
        private String senderProfileImageUrl;
        private String recipientProfileImageUrl;
        private String senderBankName;
        private String recipientBankName;

        /**
         * 字串避免浮點誤差
         */
        private String amount;
        private String currency;
        private String description;

        @JsonProperty("isCrossBank")
        private boolean crossBank;
    }
}
