package com.example.transfersim.merchant;

import com.example.transfersim.repository.MicroMerchantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaMerchantRegistry implements MerchantRegistry {

    private final MicroMerchantRepository merchantRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<MerchantInfo> findActiveMerchant(String userId, String bankId) {
        return merchantRepository.findByUserIdAndBankIdAndActiveTrue(userId, bankId)
                .map(merchant -> MerchantInfo.builder()
                        .merchantId(merchant.getMerchantId())
                        .merchantName(merchant.getMerchantName())
                        .build());
    }

    @Override
    @Transactional
    public void incrementStats(String merchantId, BigDecimal amount, BigDecimal feeAmount) {
        BigDecimal fee = feeAmount != null ? feeAmount : BigDecimal.ZERO;
        int updated = merchantRepository.incrementStats(merchantId, amount, fee);
        if (updated == 0) {
            log.warn("Merchant not found for stats update: merchantId={}", merchantId);
            return;
        }
        log.info("Updated merchant stats: merchantId={}, amount={}, fee={}", merchantId, amount, fee);
    }
}
