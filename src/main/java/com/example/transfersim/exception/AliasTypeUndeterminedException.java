package com.example.transfersim.exception;

/**
 * 無法從別名格式推斷別名類型，且呼叫端未提供類型
 */
public class AliasTypeUndeterminedException extends RuntimeException {

    public AliasTypeUndeterminedException() {
        super("Could not determine alias type. Please provide recipientAliasType.");
    }
}
