package com.example.transfersim.service.command;

import com.example.transfersim.entity.SettlementMetadata;
import com.example.transfersim.entity.SettlementType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class CreateSettlementCommand {
    String idempotencyKey;
    String contractId;
    SettlementType settlementType;
    String fromWalletId;
    String fromBankId;
    String fromEscrowId;
    String toWalletId;
    String toBankId;
    BigDecimal amount;
    String currency;
    SettlementMetadata metadata;
}
