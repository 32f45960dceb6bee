package com.example.transfersim.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * BankConnection 實體（銀行連線註冊表）
 *
 * 由管理端維護；本服務只讀取，不做任何寫入
 */
@Entity
@Table(name = "bank_connections", indexes = {
        @Index(name = "uk_bank_id", columnList = "bank_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BankConnection {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "bank_id", nullable = false, length = 100)
    private String bankId;

    /**
     * 顯示用銀行名稱
     */
    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "base_url", nullable = false, length = 255)
    private String baseUrl;

    @Column(name = "api_key", nullable = false, length = 255)
    private String apiKey;

    @Column(name = "supports_payment_initiation", nullable = false)
    private boolean supportsPaymentInitiation;

    @Column(name = "supports_instant_transfer", nullable = false)
    private boolean supportsInstantTransfer;

    @Column(name = "is_active", nullable = false)
    private boolean active;
}
