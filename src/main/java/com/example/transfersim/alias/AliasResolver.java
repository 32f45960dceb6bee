package com.example.transfersim.alias;

import com.example.transfersim.entity.AliasType;

import java.util.Optional;

/**
 * 別名解析（唯讀）
 */
public interface AliasResolver {

    /**
     * 查詢已啟用且已驗證的別名
     *
     * @param type 別名類型
     * @param normalizedValue 已正規化的別名
     * @return 解析結果，找不到時為 empty
     */
    Optional<ResolvedAlias> findVerifiedAlias(AliasType type, String normalizedValue);

    /**
     * 查詢使用者的主要別名值（通知顯示用）
     */
    Optional<String> findPrimaryAlias(String userId, String bankId);
}
