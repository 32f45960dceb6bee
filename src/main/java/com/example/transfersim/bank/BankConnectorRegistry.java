package com.example.transfersim.bank;

import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 依銀行 ID 取得 BankConnector
 *
 * 每家銀行只保留一個 connector；連線設定變更（例如更換 API key）時以新的 connector 取代
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BankConnectorRegistry {

    private final BankConnectionLookup connectionLookup;
    private final RestClient.Builder restClientBuilder;

    private final Map<String, CachedConnector> connectors = new ConcurrentHashMap<>();

    /**
     * saga 用：找不到銀行代表轉帳會失敗，記 ERROR
     *
     * @param bankId 銀行 ID
     * @return 已啟用銀行的 connector；未設定或已停用時為 empty
     */
    public Optional<BankConnector> forBank(String bankId) {
        Optional<BankConnector> connector = findConnector(bankId);
        if (connector.isEmpty()) {
            log.error("No active bank connection found: bankId={}", bankId);
        }
        return connector;
    }

    /**
     * 顯示資訊查詢用（best-effort）：找不到只記 DEBUG
     */
    public Optional<BankConnector> findConnector(String bankId) {
        Optional<BankConnectionInfo> connection = connectionLookup.findActive(bankId);
        if (connection.isEmpty()) {
            log.debug("Bank connection not available: bankId={}", bankId);
            return Optional.empty();
        }

        BankConnectionInfo info = connection.get();
        CachedConnector cached = connectors.compute(bankId, (id, existing) -> {
            if (existing != null && existing.getInfo().equals(info)) {
                return existing;
            }
            if (existing != null) {
                log.info("Bank connection changed, replacing connector: bankId={}", bankId);
            }
            return new CachedConnector(info, new BsimBankConnector(info, restClientBuilder.clone()));
        });
        return Optional.of(cached.getConnector());
    }

    /**
     * 銀行顯示名稱（通知用）
     */
    public Optional<String> bankName(String bankId) {
        return connectionLookup.findActive(bankId).map(BankConnectionInfo::getName);
    }

    @Value
    private static class CachedConnector {
        BankConnectionInfo info;
        BankConnector connector;
    }
}
