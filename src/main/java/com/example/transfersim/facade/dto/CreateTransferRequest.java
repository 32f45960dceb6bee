package com.example.transfersim.facade.dto;

import com.example.transfersim.entity.AliasType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Create Transfer Request DTO
 *
 * 用於接收建立轉帳的請求參數
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTransferRequest {

    /**
     * 寄件人（由上游驗證後帶入）
     */
    @NotBlank(message = "SenderUserId cannot be null or blank")
    @Size(max = 100, message = "SenderUserId must be at most 100 characters")
    private String senderUserId;

    @NotBlank(message = "SenderBankId cannot be null or blank")
    @Size(max = 100, message = "SenderBankId must be at most 100 characters")
    private String senderBankId;

    @NotBlank(message = "SenderAccountId cannot be null or blank")
    @Size(max = 100, message = "SenderAccountId must be at most 100 characters")
    private String senderAccountId;

    /**
     * 收款人別名（原始輸入，尚未正規化）
     */
    @NotBlank(message = "RecipientAlias cannot be null or blank")
    @Size(max = 255, message = "RecipientAlias must be at most 255 characters")
    private String recipientAlias;

    /**
     * 別名類型；未提供時依格式推斷
     */
    private AliasType recipientAliasType;

    /**
     * 轉帳金額
     * 要求：非空，必須 > 0，最多兩位小數
     */
    @NotNull(message = "Amount cannot be null")
    @DecimalMin(value = "0.0", inclusive = false, message = "Amount must be greater than 0")
    @Digits(integer = 13, fraction = 2, message = "Amount must have at most 2 decimal places")
    private BigDecimal amount;

    /**
     * 幣別；未提供時使用預設幣別
     */
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    private String currency;

    @Size(max = 200, message = "Description must be at most 200 characters")
    private String description;
}
