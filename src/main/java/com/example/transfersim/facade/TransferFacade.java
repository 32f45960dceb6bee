package com.example.transfersim.facade;

import com.example.transfersim.facade.dto.CancelTransferResponse;
import com.example.transfersim.facade.dto.CreateTransferRequest;
import com.example.transfersim.facade.dto.CreateTransferResponse;
import com.example.transfersim.facade.dto.TransferDetailResponse;
import com.example.transfersim.facade.dto.TransferListResponse;
import com.example.transfersim.mq.msg.TransferSagaMsg;

/**
 * Transfer Facade
 *
 * 職責：
 * 1. 建立轉帳前的業務驗證（金額上限、別名類型推斷與正規化）
 * 2. 協調 TransferService 與 TransferSaga
 * 3. 將 Transfer 實體轉換為 API DTO
 * 4. 提供維護排程的單一入口
 *
 * 設計原則：
 * - 建立轉帳只寫入 PENDING，saga 由事件驅動的 MQ 訊息在背景執行
 * - 呼叫端以輪詢狀態查詢觀察最終結果
 */
public interface TransferFacade {

    /**
     * 建立轉帳
     *
     * 職責：
     * 1. 檢查金額不超過單筆上限
     * 2. 未提供別名類型時依格式推斷，並依類型正規化別名
     * 3. 未提供幣別時使用預設幣別
     * 4. 委派給 TransferService.createPendingTransfer()
     *
     * @param request 建立轉帳請求（基本欄位驗證已在 controller 層完成）
     * @return CreateTransferResponse PENDING 轉帳
     * @throws com.example.transfersim.exception.TransferLimitExceededException 金額超過單筆上限
     * @throws com.example.transfersim.exception.AliasTypeUndeterminedException 無法推斷別名類型
     */
    CreateTransferResponse createTransfer(CreateTransferRequest request);

    /**
     * 查詢單筆轉帳狀態（僅寄件人或收款人可見）
     *
     * @throws com.example.transfersim.exception.TransferNotFoundException 不存在或不可見
     */
    TransferDetailResponse getTransfer(String transferId, String userId, String bankId);

    /**
     * 取得轉帳歷史
     *
     * 驗證規則：
     * - direction: sent | received | all（預設 all）
     * - status: TransferStatus 名稱（不分大小寫，可省略）
     * - page: >= 0
     * - size: 1-100
     *
     * 收到的轉帳會補上寄件人的主要別名、顯示名稱與銀行名稱
     *
     * @throws IllegalArgumentException 參數驗證失敗
     */
    TransferListResponse listTransfers(String userId, String bankId, String direction, String status,
                                       int page, int size);

    /**
     * 取消轉帳（僅寄件人，僅 PENDING / RESOLVING / RECIPIENT_NOT_FOUND）
     *
     * @throws com.example.transfersim.exception.TransferNotFoundException 不存在或不是寄件人
     * @throws com.example.transfersim.exception.InvalidTransferStateException 已開始扣款或已結束
     */
    CancelTransferResponse cancelTransfer(String transferId, String userId, String bankId);

    /**
     * 處理 saga 請求（MQ consumer 入口）
     *
     * 轉帳已不在 PENDING 時直接略過，因此重複投遞是安全的
     */
    void handleSagaRequest(TransferSagaMsg msg);

    /**
     * 重送卡在 PENDING 的 saga 請求
     *
     * 涵蓋交易提交後 MQ 發送失敗的情況；單筆失敗不影響其他轉帳
     *
     * @param delaySeconds 只處理建立時間早於（當前時間 - delaySeconds）的轉帳
     * @param batchSize 單次處理的最大轉帳數量
     * @return 成功重送的數量
     */
    int redispatchStalePendingTransfers(int delaySeconds, int batchSize);

    /**
     * 將已過期的 PENDING / RESOLVING 轉帳標記為 EXPIRED
     *
     * @param batchSize 單次處理的最大轉帳數量
     * @return 成功標記的數量
     */
    int expireOverdueTransfers(int batchSize);
}
