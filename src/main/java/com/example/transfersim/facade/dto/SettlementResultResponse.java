package com.example.transfersim.facade.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 結算執行結果（建立與冪等重送共用）
 *
 * error / error_message 只在 failed 時出現
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class SettlementResultResponse {

    @JsonProperty("settlement_id")
    private String settlementId;

    @JsonProperty("transfer_id")
    private String transferId;

    /**
     * pending | processing | completed | failed
     */
    private String status;

    private String amount;

    @JsonProperty("from_wallet_id")
    private String fromWalletId;

    @JsonProperty("to_wallet_id")
    private String toWalletId;

    @JsonProperty("completed_at")
    private LocalDateTime completedAt;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String error;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("error_message")
    private String errorMessage;
}
