package com.example.transfersim.exception;

/**
 * 結算請求缺少 Idempotency-Key header
 */
public class MissingIdempotencyKeyException extends RuntimeException {

    public MissingIdempotencyKeyException() {
        super("Idempotency-Key header is required");
    }
}
