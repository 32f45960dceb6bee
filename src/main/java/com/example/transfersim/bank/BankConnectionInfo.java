package com.example.transfersim.bank;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;

/**
 * 銀行連線設定（快取於 Redis，使用 JDK 序列化）
 */
@Value
@Builder
public class BankConnectionInfo implements Serializable {
    private static final long serialVersionUID = 1L;

    String bankId;
    String name;
    String baseUrl;
    String apiKey;
    boolean supportsPaymentInitiation;
    boolean supportsInstantTransfer;
}
