package com.example.transfersim.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * MicroMerchant 實體（小商家表）
 *
 * 商家註冊由外部系統負責；本服務只讀取商家資料並累加統計欄位
 */
@Entity
@Table(name = "micro_merchants", indexes = {
        @Index(name = "uk_merchant_id", columnList = "merchant_id", unique = true),
        @Index(name = "uk_merchant_user", columnList = "user_id, bank_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MicroMerchant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "merchant_id", nullable = false, length = 40)
    private String merchantId;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "bank_id", nullable = false, length = 100)
    private String bankId;

    @Column(name = "merchant_name", nullable = false, length = 100)
    private String merchantName;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    /**
     * 統計欄位（只會遞增）
     */
    @Builder.Default
    @Column(name = "total_received", nullable = false, precision = 15, scale = 2)
    private BigDecimal totalReceived = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "total_transactions", nullable = false)
    private long totalTransactions = 0L;

    @Builder.Default
    @Column(name = "total_fees", nullable = false, precision = 15, scale = 2)
    private BigDecimal totalFees = BigDecimal.ZERO;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
