package com.example.transfersim.facade.dto;

import com.example.transfersim.entity.TransferStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cancel Transfer Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancelTransferResponse {
    private boolean success;
    private String transferId;
    private TransferStatus status;
    private String statusMessage;
}
