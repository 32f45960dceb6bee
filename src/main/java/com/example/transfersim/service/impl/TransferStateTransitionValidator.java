package com.example.transfersim.service.impl;

import com.example.transfersim.entity.TransferStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 轉帳狀態轉換規則管理器
 *
 * 設計原則：
 * - 單一真相來源（Single Source of Truth）
 * - 集中管理所有合法的狀態轉換
 * - 使用 EnumMap 提供 O(1) 查找性能
 * - 不可變設計，線程安全
 *
 * 狀態轉換規則：
 * PENDING → RESOLVING, CANCELLED, EXPIRED
 * RESOLVING → RECIPIENT_NOT_FOUND, DEBITING, DEBIT_FAILED, CANCELLED, EXPIRED
 * RECIPIENT_NOT_FOUND → CANCELLED
 * DEBITING → CREDITING, DEBIT_FAILED, CREDIT_FAILED
 * CREDITING → COMPLETED, CREDIT_FAILED
 * 終態（COMPLETED, DEBIT_FAILED, CREDIT_FAILED, CANCELLED, EXPIRED）→ 不允許轉換
 *
 * 注意：RECIPIENT_NOT_FOUND 對 saga 而言是終態，但寄件人仍可取消
 */
public class TransferStateTransitionValidator {

    private static final Map<TransferStatus, Set<TransferStatus>> ALLOWED_TRANSITIONS;

    /**
     * 寄件人可以取消的狀態（資金尚未移動）
     */
    private static final Set<TransferStatus> CANCELLABLE = Collections.unmodifiableSet(
        EnumSet.of(TransferStatus.PENDING, TransferStatus.RESOLVING, TransferStatus.RECIPIENT_NOT_FOUND));

    static {
        Map<TransferStatus, Set<TransferStatus>> transitions = new EnumMap<>(TransferStatus.class);

        transitions.put(TransferStatus.PENDING,
            EnumSet.of(TransferStatus.RESOLVING, TransferStatus.CANCELLED, TransferStatus.EXPIRED));

        // DEBIT_FAILED 用於自己轉給自己
        transitions.put(TransferStatus.RESOLVING,
            EnumSet.of(TransferStatus.RECIPIENT_NOT_FOUND, TransferStatus.DEBITING, TransferStatus.DEBIT_FAILED,
                TransferStatus.CANCELLED, TransferStatus.EXPIRED));

        transitions.put(TransferStatus.RECIPIENT_NOT_FOUND,
            EnumSet.of(TransferStatus.CANCELLED));

        // CREDIT_FAILED 用於跨行時收款銀行未設定
        transitions.put(TransferStatus.DEBITING,
            EnumSet.of(TransferStatus.CREDITING, TransferStatus.DEBIT_FAILED, TransferStatus.CREDIT_FAILED));

        transitions.put(TransferStatus.CREDITING,
            EnumSet.of(TransferStatus.COMPLETED, TransferStatus.CREDIT_FAILED));

        transitions.put(TransferStatus.DEBIT_FAILED, EnumSet.noneOf(TransferStatus.class));
        transitions.put(TransferStatus.CREDIT_FAILED, EnumSet.noneOf(TransferStatus.class));
        transitions.put(TransferStatus.COMPLETED, EnumSet.noneOf(TransferStatus.class));
        transitions.put(TransferStatus.CANCELLED, EnumSet.noneOf(TransferStatus.class));
        transitions.put(TransferStatus.EXPIRED, EnumSet.noneOf(TransferStatus.class));

        transitions.replaceAll((status, targets) -> Collections.unmodifiableSet(targets));
        ALLOWED_TRANSITIONS = Collections.unmodifiableMap(transitions);
    }

    /**
     * 驗證狀態轉換是否合法
     *
     * @param currentStatus 當前狀態
     * @param targetStatus 目標狀態
     * @return true if transition is allowed, false otherwise
     */
    public static boolean isTransitionAllowed(TransferStatus currentStatus, TransferStatus targetStatus) {
        if (currentStatus == null || targetStatus == null) {
            return false;
        }
        Set<TransferStatus> allowedTargets = ALLOWED_TRANSITIONS.get(currentStatus);
        return allowedTargets != null && allowedTargets.contains(targetStatus);
    }

    /**
     * @return 唯讀集合
     */
    public static Set<TransferStatus> getAllowedTransitions(TransferStatus currentStatus) {
        if (currentStatus == null) {
            return Collections.emptySet();
        }
        return ALLOWED_TRANSITIONS.getOrDefault(currentStatus, Collections.emptySet());
    }

    /**
     * 判斷狀態是否為終態（saga 不會再推進）
     */
    public static boolean isTerminalState(TransferStatus status) {
        if (status == null) {
            return false;
        }
        return status == TransferStatus.COMPLETED
            || status == TransferStatus.DEBIT_FAILED
            || status == TransferStatus.CREDIT_FAILED
            || status == TransferStatus.CANCELLED
            || status == TransferStatus.EXPIRED
            || status == TransferStatus.RECIPIENT_NOT_FOUND;
    }

    public static boolean isCancellable(TransferStatus status) {
        return status != null && CANCELLABLE.contains(status);
    }
}
