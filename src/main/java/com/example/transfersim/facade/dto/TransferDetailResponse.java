package com.example.transfersim.facade.dto;

import com.example.transfersim.entity.AliasType;
import com.example.transfersim.entity.TransferStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 單筆轉帳狀態查詢結果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class TransferDetailResponse {
    private String transferId;
    private TransferStatus status;
    private String statusMessage;
    private String amount;
    private String currency;
    private String description;
    private String recipientAlias;
    private AliasType recipientAliasType;

    /**
     * 相對於查詢者：sent | received
     */
    private String direction;

    private LocalDateTime createdAt;
    private LocalDateTime completedAt;
    private LocalDateTime expiresAt;
}
