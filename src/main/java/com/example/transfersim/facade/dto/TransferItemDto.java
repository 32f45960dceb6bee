package com.example.transfersim.facade.dto;

import com.example.transfersim.entity.AliasType;
import com.example.transfersim.entity.TransferStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 轉帳列表項目
 *
 * senderAlias / senderDisplayName / senderBankName 只在 direction=received 時填入
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferItemDto {
    private String transferId;
    private TransferStatus status;
    private String amount;
    private String currency;
    private String description;
    private String recipientAlias;
    private AliasType recipientAliasType;
    private String direction;
    private LocalDateTime createdAt;
    private LocalDateTime completedAt;
    private String senderProfileImageUrl;
    private String recipientProfileImageUrl;
    private String senderAlias;
    private String senderDisplayName;
    private String senderBankName;
}
