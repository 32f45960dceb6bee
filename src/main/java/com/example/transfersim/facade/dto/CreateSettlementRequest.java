package com.example.transfersim.facade.dto;

import com.example.transfersim.entity.SettlementMetadata;
import com.example.transfersim.entity.SettlementType;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 合約結算撥款請求（snake_case）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSettlementRequest {

    @NotBlank(message = "contract_id cannot be null or blank")
    @JsonProperty("contract_id")
    private String contractId;

    @NotNull(message = "settlement_type cannot be null")
    @JsonProperty("settlement_type")
    private SettlementType settlementType;

    @NotNull(message = "from cannot be null")
    @Valid
    private Source from;

    @NotNull(message = "to cannot be null")
    @Valid
    private Destination to;

    @NotNull(message = "amount cannot be null")
    @DecimalMin(value = "0.0", inclusive = false, message = "amount must be greater than 0")
    @Digits(integer = 13, fraction = 2, message = "amount must have at most 2 decimal places")
    private BigDecimal amount;

    /**
     * 未提供時使用預設幣別
     */
    @Pattern(regexp = "^[A-Z]{3}$", message = "currency must be a 3-letter ISO code")
    private String currency;

    private SettlementMetadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Source {

        @NotBlank(message = "from.wallet_id cannot be null or blank")
        @JsonProperty("wallet_id")
        private String walletId;

        @NotBlank(message = "from.bank_id cannot be null or blank")
        @JsonProperty("bank_id")
        private String bankId;

        /**
         * 有值時以 escrow release 取代一般扣款
         */
        @JsonProperty("escrow_id")
        private String escrowId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Destination {

        @NotBlank(message = "to.wallet_id cannot be null or blank")
        @JsonProperty("wallet_id")
        private String walletId;

        @NotBlank(message = "to.bank_id cannot be null or blank")
        @JsonProperty("bank_id")
        private String bankId;
    }
}
