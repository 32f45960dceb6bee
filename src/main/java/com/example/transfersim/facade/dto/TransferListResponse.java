package com.example.transfersim.facade.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 轉帳歷史（含分頁資訊）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferListResponse {
    private List<TransferItemDto> transfers;
    private PaginationMeta pagination;
}
