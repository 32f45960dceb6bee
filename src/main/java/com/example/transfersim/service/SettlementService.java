package com.example.transfersim.service;

import com.example.transfersim.entity.Settlement;
import com.example.transfersim.entity.SettlementErrorCode;
import com.example.transfersim.service.command.CreateSettlementCommand;

import java.util.Optional;

/**
 * SettlementService 介面
 *
 * 狀態流程：PENDING → PROCESSING → COMPLETED / FAILED
 */
public interface SettlementService {

    /**
     * 建立 PENDING 結算
     *
     * @throws org.springframework.dao.DataIntegrityViolationException 冪等鍵已存在（並發重送）
     */
    Settlement createSettlement(CreateSettlementCommand command);

    /**
     * PENDING → PROCESSING，記錄由錢包 ID 解析出的雙方 userId
     */
    Settlement markProcessing(Long id, String fromUserId, String toUserId);

    /**
     * PROCESSING → COMPLETED
     */
    Settlement completeSettlement(Long id, String transferId);

    /**
     * PROCESSING → FAILED
     *
     * @param transferId 尚未建立轉帳時為 null
     */
    Settlement failSettlement(Long id, SettlementErrorCode errorCode, String message, String transferId);

    Optional<Settlement> findByIdempotencyKey(String idempotencyKey);

    /**
     * 以對外 ID（stl_...）或內部 ID 查詢
     */
    Optional<Settlement> findSettlement(String settlementIdOrId);
}
