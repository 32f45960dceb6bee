package com.example.transfersim.exception;

/**
 * Webhook 暫時性失敗（5xx、429、連線錯誤），交由重試機制處理
 */
public class RetryableWebhookException extends RuntimeException {

    public RetryableWebhookException(String message) {
        super(message);
    }

    public RetryableWebhookException(String message, Throwable cause) {
        super(message, cause);
    }
}
