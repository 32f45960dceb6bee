package com.example.transfersim.service.command;

import com.example.transfersim.entity.AliasType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * 建立 PENDING 轉帳所需的資料（別名已正規化、金額已驗證）
 */
@Value
@Builder
public class CreateTransferCommand {
    String senderUserId;
    String senderBankId;
    String senderAccountId;
    String recipientAlias;
    AliasType recipientAliasType;
    BigDecimal amount;
    String currency;
    String description;
}
