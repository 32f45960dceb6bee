package com.example.transfersim.alias;

import lombok.Builder;
import lombok.Value;

/**
 * 別名解析結果：(userId, bankId, accountId)
 */
@Value
@Builder
public class ResolvedAlias {
    String userId;
    String bankId;

    /**
     * 可為 null，代表收款銀行使用預設帳戶
     */
    String accountId;
}
