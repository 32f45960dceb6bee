package com.example.transfersim.entity;

/**
 * 轉帳狀態枚舉
 *
 * 狀態轉換流程（Happy Path）：
 * PENDING → RESOLVING → DEBITING → CREDITING → COMPLETED
 *
 * 失敗 / 終止狀態：
 * - RECIPIENT_NOT_FOUND: 別名無法解析
 * - DEBIT_FAILED: 扣款失敗（或轉給自己），沒有資金移動
 * - CREDIT_FAILED: 扣款成功但加帳失敗，需人工沖正
 * - CANCELLED: 寄件人取消（僅限資金移動前）
 * - EXPIRED: 超過 expiresAt 仍未開始扣款
 */
public enum TransferStatus {

    /**
     * 已建立，等待 saga 接手
     * - 可轉換為：RESOLVING, CANCELLED, EXPIRED
     */
    PENDING,

    /**
     * 正在解析收款人別名
     * - 可轉換為：RECIPIENT_NOT_FOUND, DEBITING, DEBIT_FAILED, CANCELLED, EXPIRED
     */
    RESOLVING,

    /**
     * 找不到已驗證的別名
     * - saga 終態，但寄件人仍可取消
     */
    RECIPIENT_NOT_FOUND,

    /**
     * 收款人已確定，正在向寄件銀行扣款
     * - 可轉換為：CREDITING, DEBIT_FAILED, CREDIT_FAILED
     */
    DEBITING,

    /**
     * 扣款失敗
     * - 終態 ✗
     */
    DEBIT_FAILED,

    /**
     * 扣款成功，正在向收款銀行加帳
     * - 可轉換為：COMPLETED, CREDIT_FAILED
     */
    CREDITING,

    /**
     * 加帳失敗（扣款可能需要沖正）
     * - 終態 ✗
     */
    CREDIT_FAILED,

    /**
     * 轉帳完成（扣款和加帳都成功）
     * - 終態 ✓
     */
    COMPLETED,

    /**
     * 已取消
     * - 終態 ✗
     */
    CANCELLED,

    /**
     * 已過期
     * - 終態 ✗
     */
    EXPIRED
}
