package com.example.transfersim.facade.dto;

import com.example.transfersim.entity.TransferStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Create Transfer Response DTO
 *
 * 建立後立即回傳的 PENDING 轉帳，後續狀態需輪詢查詢
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class CreateTransferResponse {
    private String transferId;
    private TransferStatus status;
    private String amount;
    private String currency;
    private String recipientAlias;
    private LocalDateTime createdAt;
}
