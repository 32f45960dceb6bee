package com.example.transfersim.service;

import com.example.transfersim.alias.AliasResolver;
import com.example.transfersim.bank.BankConnectorRegistry;
import com.example.transfersim.bank.UserVerification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 轉帳參與者的顯示資訊（名稱、主要別名、銀行名稱）
 *
 * 只用於通知與列表顯示，查詢失敗時回傳預設值
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParticipantDirectory {

    public static final String UNKNOWN_USER = "Unknown";
    public static final String UNKNOWN_BANK = "Unknown Bank";

    private final BankConnectorRegistry connectorRegistry;
    private final AliasResolver aliasResolver;

    public String displayName(String userId, String bankId) {
        return connectorRegistry.findConnector(bankId)
                .map(connector -> connector.verifyUser(userId))
                .filter(UserVerification::isExists)
                .map(UserVerification::getDisplayName)
                .filter(name -> !name.isBlank())
                .orElse(UNKNOWN_USER);
    }

    /**
     * @return 主要別名，沒有時為 null
     */
    public String primaryAlias(String userId, String bankId) {
        return aliasResolver.findPrimaryAlias(userId, bankId).orElse(null);
    }

    public String bankName(String bankId) {
        return connectorRegistry.bankName(bankId).orElse(UNKNOWN_BANK);
    }
}
