package com.example.transfersim.merchant;

import java.math.BigDecimal;

/**
 * 小商家手續費（階梯式固定費用）
 *
 * - amount < 200 → 0.25
 * - amount >= 200 → 0.50
 *
 * 手續費只用於統計，不從加帳金額扣除
 */
public final class MerchantFeeCalculator {

    private static final BigDecimal TIER_THRESHOLD = new BigDecimal("200");
    private static final BigDecimal LOW_TIER_FEE = new BigDecimal("0.25");
    private static final BigDecimal HIGH_TIER_FEE = new BigDecimal("0.50");

    private MerchantFeeCalculator() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static BigDecimal calculateFee(BigDecimal amount) {
        return amount.compareTo(TIER_THRESHOLD) < 0 ? LOW_TIER_FEE : HIGH_TIER_FEE;
    }
}
