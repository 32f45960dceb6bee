package com.example.transfersim.bank;

import com.example.transfersim.repository.BankConnectionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * 查詢已啟用的銀行連線設定
 *
 * 快取：bankConnections:{bankId}，TTL 依 RedisCacheConfig；找不到的結果不快取
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BankConnectionLookup {

    public static final String CACHE_NAME = "bankConnections";

    private final BankConnectionRepository bankConnectionRepository;

    @Transactional(readOnly = true)
    @Cacheable(value = CACHE_NAME, key = "#bankId", unless = "#result == null")
    public Optional<BankConnectionInfo> findActive(String bankId) {
        log.debug("Loading bank connection from database: bankId={}", bankId);
        return bankConnectionRepository.findByBankIdAndActiveTrue(bankId)
                .map(connection -> BankConnectionInfo.builder()
                        .bankId(connection.getBankId())
                        .name(connection.getName())
                        .baseUrl(connection.getBaseUrl())
                        .apiKey(connection.getApiKey())
                        .supportsPaymentInitiation(connection.isSupportsPaymentInitiation())
                        .supportsInstantTransfer(connection.isSupportsInstantTransfer())
                        .build());
    }
}
