package com.example.transfersim.service.command;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * 結算撥款對應的轉帳（收款人已知，直接從 DEBITING 開始）
 */
@Value
@Builder
public class SettlementTransferCommand {
    String senderUserId;
    String senderBankId;
    String recipientUserId;
    String recipientBankId;
    BigDecimal amount;
    String currency;
    String description;
    String contractId;
    String settlementId;
}
