package com.example.transfersim.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Settlement 實體（合約結算表）
 *
 * 功能：記錄一次由合約服務發起的撥款，每個冪等鍵只會對應一筆
 * 狀態流程：PENDING → PROCESSING → COMPLETED / FAILED
 *
 * 撥款本身會產生一筆 CONTRACT_SETTLEMENT 類型的 Transfer，透過 transferId 關聯
 */
@Entity
@Table(name = "settlements", indexes = {
        @Index(name = "uk_settlement_id", columnList = "settlement_id", unique = true),
        @Index(name = "uk_idempotency_key", columnList = "idempotency_key", unique = true),
        @Index(name = "idx_contract_id", columnList = "contract_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Settlement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 對外結算 ID（stl_ 前綴）
     */
    @Column(name = "settlement_id", nullable = false, length = 40, updatable = false)
    private String settlementId;

    /**
     * 呼叫端提供的冪等鍵（唯一）
     */
    @Column(name = "idempotency_key", nullable = false, length = 255, updatable = false)
    private String idempotencyKey;

    @Column(name = "contract_id", nullable = false, length = 100)
    private String contractId;

    @Enumerated(EnumType.STRING)
    @Column(name = "settlement_type", nullable = false, length = 30)
    private SettlementType settlementType;

    /**
     * 付款方（可選 escrow）
     */
    @Column(name = "from_wallet_id", nullable = false, length = 100)
    private String fromWalletId;

    @Column(name = "from_bank_id", nullable = false, length = 100)
    private String fromBankId;

    @Column(name = "from_escrow_id", length = 100)
    private String fromEscrowId;

    @Column(name = "from_user_id", length = 100)
    private String fromUserId;

    /**
     * 收款方
     */
    @Column(name = "to_wallet_id", nullable = false, length = 100)
    private String toWalletId;

    @Column(name = "to_bank_id", nullable = false, length = 100)
    private String toBankId;

    @Column(name = "to_user_id", length = 100)
    private String toUserId;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    /**
     * 顯示用的附加資訊（以 JSON 儲存）
     */
    @Convert(converter = SettlementMetadataConverter.class)
    @Column(columnDefinition = "TEXT")
    private SettlementMetadata metadata;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SettlementStatus status;

    @Column(name = "status_message", length = 255)
    private String statusMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_code", length = 30)
    private SettlementErrorCode errorCode;

    /**
     * 關聯的 Transfer 對外 ID
     */
    @Column(name = "transfer_id", length = 40)
    private String transferId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

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

    public boolean hasEscrow() {
        return fromEscrowId != null && !fromEscrowId.isBlank();
    }

    public boolean isCrossBank() {
        return !fromBankId.equals(toBankId);
    }
}
