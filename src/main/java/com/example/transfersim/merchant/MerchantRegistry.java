package com.example.transfersim.merchant;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * 小商家註冊資料查詢與統計累加
 */
public interface MerchantRegistry {

    /**
     * 查詢 (userId, bankId) 是否為已啟用的小商家
     */
    Optional<MerchantInfo> findActiveMerchant(String userId, String bankId);

    /**
     * 累加商家統計（收款總額 + 筆數 + 手續費）
     */
    void incrementStats(String merchantId, BigDecimal amount, BigDecimal feeAmount);
}
