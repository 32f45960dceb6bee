package com.example.transfersim.exception;

/**
 * 轉帳狀態無效異常
 *
 * 當轉帳目前狀態不允許目標轉換時拋出
 *
 * 使用場景：
 * - 寄件人取消已開始扣款的轉帳
 * - saga 推進時發現轉帳已被取消或過期
 */
public class InvalidTransferStateException extends RuntimeException {

    public InvalidTransferStateException(String message) {
        super(message);
    }

    public InvalidTransferStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
