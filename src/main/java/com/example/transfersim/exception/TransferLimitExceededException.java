package com.example.transfersim.exception;

import java.math.BigDecimal;

/**
 * 單筆轉帳金額超過上限
 */
public class TransferLimitExceededException extends RuntimeException {

    public TransferLimitExceededException(BigDecimal limit) {
        super("Amount exceeds per-transfer limit of " + limit.toPlainString());
    }
}
