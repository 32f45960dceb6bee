package com.example.transfersim.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Transfer 實體（轉帳表）
 *
 * 功能：記錄一筆跨 BSIM 的 P2P 轉帳
 * 狀態流程：PENDING → RESOLVING → DEBITING → CREDITING → COMPLETED
 * 失敗狀態：RECIPIENT_NOT_FOUND, DEBIT_FAILED, CREDIT_FAILED, CANCELLED, EXPIRED
 *
 * 不變量：
 * - creditTransactionId 只有在 debitTransactionId 已設定時才會設定
 * - COMPLETED 時兩個交易 ID 與 completedAt 都已設定
 * - 離開 RESOLVING 前 recipientUserId / recipientBankId 已設定（找不到收款人除外）
 */
@Entity
@Table(name = "transfers", indexes = {
        @Index(name = "uk_transfer_id", columnList = "transfer_id", unique = true),

        // Covers: WHERE status = ? AND created_at <= ? ORDER BY created_at ASC
        @Index(name = "idx_status_created_at", columnList = "status, created_at"),

        // Covers: WHERE status IN (?) AND expires_at <= ?
        @Index(name = "idx_status_expires_at", columnList = "status, expires_at"),

        @Index(name = "idx_sender_created_at", columnList = "sender_user_id, sender_bank_id, created_at DESC"),
        @Index(name = "idx_recipient_created_at", columnList = "recipient_user_id, recipient_bank_id, created_at DESC"),

        @Index(name = "idx_settlement_id", columnList = "settlement_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Transfer {

    /**
     * 內部 ID（主鍵，自增），同時作為銀行端的 reference / 冪等鍵
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 對外轉帳 ID（p2p_ 前綴）
     */
    @Column(name = "transfer_id", nullable = false, length = 40, updatable = false)
    private String transferId;

    @Column(name = "sender_user_id", nullable = false, length = 100)
    private String senderUserId;

    @Column(name = "sender_bank_id", nullable = false, length = 100)
    private String senderBankId;

    @Column(name = "sender_account_id", nullable = false, length = 100)
    private String senderAccountId;

    /**
     * 收款人別名（已正規化）
     */
    @Column(name = "recipient_alias", nullable = false, length = 255)
    private String recipientAlias;

    @Enumerated(EnumType.STRING)
    @Column(name = "recipient_alias_type", nullable = false, length = 20)
    private AliasType recipientAliasType;

    /**
     * 收款人資訊（解析別名後才會設定）
     */
    @Column(name = "recipient_user_id", length = 100)
    private String recipientUserId;

    @Column(name = "recipient_bank_id", length = 100)
    private String recipientBankId;

    @Column(name = "recipient_account_id", length = 100)
    private String recipientAccountId;

    /**
     * 轉帳金額（DECIMAL(15,2)）
     */
    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(length = 200)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "transfer_type", nullable = false, length = 30)
    private TransferType transferType;

    @Enumerated(EnumType.STRING)
    @Column(name = "recipient_type", nullable = false, length = 20)
    private RecipientType recipientType;

    /**
     * 收款商家 ID 與手續費（僅統計用途，不從加帳金額扣除）
     */
    @Column(name = "merchant_id", length = 40)
    private String merchantId;

    @Column(name = "fee_amount", precision = 15, scale = 2)
    private BigDecimal feeAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private TransferStatus status;

    @Column(name = "status_message", length = 255)
    private String statusMessage;

    /**
     * 銀行端交易 ID（逐步設定）
     */
    @Column(name = "debit_transaction_id", length = 100)
    private String debitTransactionId;

    @Column(name = "credit_transaction_id", length = 100)
    private String creditTransactionId;

    @Column(name = "sender_profile_image_url", length = 512)
    private String senderProfileImageUrl;

    @Column(name = "recipient_profile_image_url", length = 512)
    private String recipientProfileImageUrl;

    /**
     * 合約結算關聯（僅 CONTRACT_SETTLEMENT）
     */
    @Column(name = "contract_id", length = 100)
    private String contractId;

    @Column(name = "settlement_id", length = 40)
    private String settlementId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    /**
     * 過期時間（僅 PENDING / RESOLVING 有意義）
     */
    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

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

    /**
     * 寄件人與收款人是否在不同銀行
     */
    public boolean isCrossBank() {
        return recipientBankId != null && !recipientBankId.equals(senderBankId);
    }

    /**
     * 判斷 (userId, bankId) 是否為寄件人
     */
    public boolean isSentBy(String userId, String bankId) {
        return senderUserId.equals(userId) && senderBankId.equals(bankId);
    }

    /**
     * 判斷 (userId, bankId) 是否為收款人
     */
    public boolean isReceivedBy(String userId, String bankId) {
        return userId.equals(recipientUserId) && bankId.equals(recipientBankId);
    }
}
