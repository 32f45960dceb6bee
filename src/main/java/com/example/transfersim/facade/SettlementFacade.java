package com.example.transfersim.facade;

import com.example.transfersim.facade.dto.CreateSettlementRequest;
import com.example.transfersim.facade.dto.SettlementDetailResponse;
import com.example.transfersim.facade.dto.SettlementResultResponse;

/**
 * Settlement Facade
 *
 * 職責：
 * 1. 以 Idempotency-Key 去重：同一個 key 永遠回傳已儲存的結果，不重新執行
 * 2. 建立結算並同步執行 SettlementSaga
 * 3. 將 Settlement 實體轉換為 snake_case DTO
 */
public interface SettlementFacade {

    /**
     * 建立並執行結算
     *
     * @param idempotencyKey 呼叫端提供的冪等鍵
     * @param request 結算請求
     * @return 結算結果（completed / failed；並發重送時可能為 processing）
     * @throws com.example.transfersim.exception.MissingIdempotencyKeyException 未提供冪等鍵
     */
    SettlementResultResponse createSettlement(String idempotencyKey, CreateSettlementRequest request);

    /**
     * 以對外 ID 或內部 ID 查詢結算
     *
     * @throws com.example.transfersim.exception.SettlementNotFoundException 結算不存在
     */
    SettlementDetailResponse getSettlement(String settlementId);
}
