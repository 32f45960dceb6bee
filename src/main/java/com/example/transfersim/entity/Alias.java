package com.example.transfersim.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Alias 實體（別名表）
 *
 * 別名的新增與驗證由外部系統負責，本服務只做查詢
 */
@Entity
@Table(name = "aliases", indexes = {
        @Index(name = "uk_alias_type_value", columnList = "type, normalized_value", unique = true),
        @Index(name = "idx_alias_user", columnList = "user_id, bank_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alias {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AliasType type;

    /**
     * 使用者輸入的原始值
     */
    @Column(nullable = false, length = 255)
    private String value;

    @Column(name = "normalized_value", nullable = false, length = 255)
    private String normalizedValue;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "bank_id", nullable = false, length = 100)
    private String bankId;

    @Column(name = "account_id", length = 100)
    private String accountId;

    @Column(name = "is_verified", nullable = false)
    private boolean verified;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "is_primary", nullable = false)
    private boolean primary;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
