package com.example.transfersim.facade.dto;

import com.example.transfersim.entity.SettlementMetadata;
import com.example.transfersim.entity.SettlementType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 結算狀態查詢結果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class SettlementDetailResponse {

    @JsonProperty("settlement_id")
    private String settlementId;

    @JsonProperty("contract_id")
    private String contractId;

    @JsonProperty("transfer_id")
    private String transferId;

    private String status;

    @JsonProperty("settlement_type")
    private SettlementType settlementType;

    private String amount;

    private String currency;

    @JsonProperty("from_wallet_id")
    private String fromWalletId;

    @JsonProperty("from_bank_id")
    private String fromBankId;

    @JsonProperty("to_wallet_id")
    private String toWalletId;

    @JsonProperty("to_bank_id")
    private String toBankId;

    private SettlementMetadata metadata;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("completed_at")
    private LocalDateTime completedAt;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String error;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("error_message")
    private String errorMessage;
}
