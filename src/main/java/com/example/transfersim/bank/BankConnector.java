package com.example.transfersim.bank;

import java.math.BigDecimal;

/**
 * 單一銀行後端的操作介面
 *
 * 所有方法都不拋出例外：HTTP 錯誤與連線錯誤都轉成失敗結果
 * referenceId 由呼叫端提供，銀行端以此做冪等
 */
public interface BankConnector {

    /**
     * 從帳戶扣款
     */
    BankOperationResult debit(String userId, String accountId, BigDecimal amount, String currency,
                              String referenceId, String description);

    /**
     * 存入帳戶
     *
     * @param accountId 可為 null，由銀行端使用預設帳戶
     */
    BankOperationResult credit(String userId, String accountId, BigDecimal amount, String currency,
                               String referenceId, String description);

    /**
     * 從 escrow 扣除資金（不會入帳給任何人）
     */
    BankOperationResult escrowRelease(String escrowId, String contractId, String referenceId, String reason);

    /**
     * 查詢使用者是否存在以及顯示名稱（僅用於通知內容）
     */
    UserVerification verifyUser(String userId);
}
