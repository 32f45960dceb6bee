package com.example.transfersim.repository;

import com.example.transfersim.entity.Transfer;
import com.example.transfersim.entity.TransferStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * TransferRepository
 *
 * 功能：提供 Transfer 實體的資料存取方法
 *
 * 自訂查詢方法：
 * 1. findByIdForUpdate - 悲觀鎖定查詢（saga 與取消流程的並發控制）
 * 2. findPendingTransfers - 查詢停滯的 PENDING 轉帳（重新派送）
 * 3. findExpiredTransfers - 查詢已過期但尚未開始扣款的轉帳
 * 4. findSentBy / findReceivedBy / findInvolving - 轉帳歷史（分頁）
 */
@Repository
public interface TransferRepository extends JpaRepository<Transfer, Long> {

    /**
     * 使用悲觀鎖定查詢轉帳記錄（FOR UPDATE）
     *
     * 用途：saga 推進狀態與寄件人取消可能同時發生，必須序列化
     *
     * @param id 轉帳內部 ID
     * @return Optional<Transfer> 轉帳記錄（帶鎖）
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Transfer t WHERE t.id = :id")
    Optional<Transfer> findByIdForUpdate(@Param("id") Long id);

    Optional<Transfer> findByTransferId(String transferId);

    /**
     * 查詢停滯的 PENDING 轉帳
     *
     * 條件：狀態為 PENDING 且建立時間 <= cutoffTime
     * 排序：按 createdAt 升序（最早的優先處理）
     */
    @Query("SELECT t FROM Transfer t WHERE t.status = :status " +
           "AND t.createdAt <= :cutoffTime " +
           "ORDER BY t.createdAt ASC")
    List<Transfer> findPendingTransfers(
            @Param("status") TransferStatus status,
            @Param("cutoffTime") LocalDateTime cutoffTime,
            Pageable pageable
    );

    /**
     * 查詢已過期的轉帳
     *
     * 條件：狀態在 statuses 中且 expiresAt <= now
     * 排序：按 expiresAt 升序
     */
    @Query("SELECT t FROM Transfer t WHERE t.status IN :statuses " +
           "AND t.expiresAt <= :now " +
           "ORDER BY t.expiresAt ASC")
    List<Transfer> findExpiredTransfers(
            @Param("statuses") Collection<TransferStatus> statuses,
            @Param("now") LocalDateTime now,
            Pageable pageable
    );

    /**
     * 寄件人的轉帳歷史（status 為 null 時不過濾）
     */
    @Query("SELECT t FROM Transfer t " +
           "WHERE t.senderUserId = :userId AND t.senderBankId = :bankId " +
           "AND (:status IS NULL OR t.status = :status) " +
           "ORDER BY t.createdAt DESC")
    Page<Transfer> findSentBy(
            @Param("userId") String userId,
            @Param("bankId") String bankId,
            @Param("status") TransferStatus status,
            Pageable pageable
    );

    /**
     * 收款人的轉帳歷史（status 為 null 時不過濾）
     */
    @Query("SELECT t FROM Transfer t " +
           "WHERE t.recipientUserId = :userId AND t.recipientBankId = :bankId " +
           "AND (:status IS NULL OR t.status = :status) " +
           "ORDER BY t.createdAt DESC")
    Page<Transfer> findReceivedBy(
            @Param("userId") String userId,
            @Param("bankId") String bankId,
            @Param("status") TransferStatus status,
            Pageable pageable
    );

    /**
     * 使用者作為寄件人或收款人的所有轉帳
     */
    @Query("SELECT t FROM Transfer t " +
           "WHERE ((t.senderUserId = :userId AND t.senderBankId = :bankId) " +
           "OR (t.recipientUserId = :userId AND t.recipientBankId = :bankId)) " +
           "AND (:status IS NULL OR t.status = :status) " +
           "ORDER BY t.createdAt DESC")
    Page<Transfer> findInvolving(
            @Param("userId") String userId,
            @Param("bankId") String bankId,
            @Param("status") TransferStatus status,
            Pageable pageable
    );
}
