package com.example.transfersim.webhook.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * settlement.completed / settlement.failed 事件（送往合約服務）
 *
 * error / error_message 只在 failed 時出現
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class SettlementWebhookPayload {

    public static final String EVENT_COMPLETED = "settlement.completed";
    public static final String EVENT_FAILED = "settlement.failed";

    @JsonProperty("event_id")
    private String eventId;

    @JsonProperty("event_type")
    private String eventType;

    private String timestamp;

    private SettlementData data;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public static class SettlementData {

        @JsonProperty("settlement_id")
        private String settlementId;

        @JsonProperty("transfer_id")
        private String transferId;

        @JsonProperty("contract_id")
        private String contractId;

        /**
         * completed | failed
         */
        private String status;

        private String amount;

        @JsonProperty("from_wallet_id")
        private String fromWalletId;

        @JsonProperty("to_wallet_id")
        private String toWalletId;

        @JsonInclude(JsonInclude.Include.NON_NULL)
        private String error;

        @JsonProperty("error_message")
        @JsonInclude(JsonInclude.Include.NON_NULL)
        private String errorMessage;
    }
}
