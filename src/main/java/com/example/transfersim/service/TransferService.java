package com.example.transfersim.service;

import com.example.transfersim.alias.ResolvedAlias;
import com.example.transfersim.entity.Transfer;
import com.example.transfersim.entity.TransferStatus;
import com.example.transfersim.merchant.MerchantInfo;
import com.example.transfersim.service.command.CreateTransferCommand;
import com.example.transfersim.service.command.SettlementTransferCommand;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.Optional;

/**
 * TransferService 介面
 *
 * 功能：管理轉帳記錄的建立、狀態推進與查詢
 *
 * 所有狀態更新都是單一事務內的原子操作（悲觀鎖 + 轉換驗證 + 事件發布），
 * 不合法的轉換拋出 InvalidTransferStateException
 */
public interface TransferService {

    /**
     * 建立 PENDING 轉帳（24 小時後過期）
     *
     * 事務提交後由事件監聽器派送 saga
     */
    Transfer createPendingTransfer(CreateTransferCommand command);

    /**
     * 建立結算撥款用的轉帳（直接進入 DEBITING，不經過 saga 派送）
     */
    Transfer createSettlementTransfer(SettlementTransferCommand command);

    /**
     * saga 接手：PENDING → RESOLVING
     *
     * @return 轉帳不是 PENDING（重複投遞、已取消、已過期）時為 empty
     */
    Optional<Transfer> claimForResolution(Long id);

    /**
     * RESOLVING → RECIPIENT_NOT_FOUND
     */
    Transfer markRecipientNotFound(Long id, String message);

    /**
     * RESOLVING → DEBIT_FAILED（收款人就是寄件人本人）
     */
    Transfer markSelfTransfer(Long id, ResolvedAlias recipient);

    /**
     * RESOLVING → DEBITING，記錄收款人與商家分類
     *
     * @param merchant 收款人不是商家時為 null
     */
    Transfer markResolved(Long id, ResolvedAlias recipient, MerchantInfo merchant);

    /**
     * DEBITING → DEBIT_FAILED
     */
    Transfer markDebitFailed(Long id, String message);

    /**
     * DEBITING → CREDITING，記錄扣款交易 ID
     */
    Transfer markCrediting(Long id, String debitTransactionId);

    /**
     * DEBITING / CREDITING → CREDIT_FAILED
     */
    Transfer markCreditFailed(Long id, String message);

    /**
     * CREDITING → COMPLETED，記錄加帳交易 ID 與完成時間
     */
    Transfer completeTransfer(Long id, String creditTransactionId, String message);

    /**
     * 記錄雙方頭像（不改變狀態）
     */
    void recordProfileImages(Long id, String senderProfileImageUrl, String recipientProfileImageUrl);

    /**
     * 寄件人取消（僅 PENDING / RESOLVING / RECIPIENT_NOT_FOUND）
     *
     * @throws com.example.transfersim.exception.TransferNotFoundException 轉帳不存在或不是寄件人
     * @throws com.example.transfersim.exception.InvalidTransferStateException 目前狀態不可取消
     */
    Transfer cancelTransfer(String transferId, String userId, String bankId);

    /**
     * 過期：PENDING / RESOLVING → EXPIRED
     *
     * @return false 表示轉帳已不在可過期狀態（例如剛被 saga 推進）
     */
    boolean expireTransfer(Long id);

    Transfer getTransfer(Long id);

    Optional<Transfer> findByTransferId(String transferId);

    /**
     * 查詢使用者可見的單筆轉帳（寄件人或收款人）
     */
    Optional<Transfer> findVisibleTransfer(String transferId, String userId, String bankId);

    /**
     * 轉帳歷史（createdAt 降序）
     *
     * @param status 為 null 時不過濾
     */
    Page<Transfer> findHistory(String userId, String bankId, TransferDirection direction,
                               TransferStatus status, int page, int size);

    /**
     * 建立超過 delaySeconds 仍為 PENDING 的轉帳
     */
    List<Transfer> findStalePendingTransfers(int delaySeconds, int batchSize);

    /**
     * expiresAt 已過且仍為 PENDING / RESOLVING 的轉帳
     */
    List<Transfer> findExpiredTransfers(int batchSize);
}
