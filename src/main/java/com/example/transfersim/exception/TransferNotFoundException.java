package com.example.transfersim.exception;

/**
 * 轉帳不存在異常
 *
 * 使用場景：
 * - 依 transferId / 內部 ID 找不到轉帳
 * - 查詢者既不是寄件人也不是收款人（不洩漏轉帳存在與否）
 */
public class TransferNotFoundException extends RuntimeException {

    public TransferNotFoundException(Long id) {
        super("Transfer not found: " + id);
    }

    public TransferNotFoundException(String transferId) {
        super("Transfer not found: " + transferId);
    }
}
