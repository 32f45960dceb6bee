package com.example.transfersim.facade.impl;

import com.example.transfersim.config.TransferProperties;
import com.example.transfersim.entity.Settlement;
import com.example.transfersim.entity.SettlementStatus;
import com.example.transfersim.exception.MissingIdempotencyKeyException;
import com.example.transfersim.exception.SettlementNotFoundException;
import com.example.transfersim.facade.SettlementFacade;
import com.example.transfersim.facade.dto.CreateSettlementRequest;
import com.example.transfersim.facade.dto.SettlementDetailResponse;
import com.example.transfersim.facade.dto.SettlementResultResponse;
import com.example.transfersim.saga.SettlementSaga;
import com.example.transfersim.service.SettlementService;
import com.example.transfersim.service.command.CreateSettlementCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * SettlementFacade 實作
 *
 * 冪等處理：
 * - 先以 Idempotency-Key 查詢，存在則直接回傳已儲存的結果
 * - 兩個相同 key 的請求同時建立時，唯一索引會讓後到者失敗，改回傳先到者的結果
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SettlementFacadeImpl implements SettlementFacade {

    private final SettlementService settlementService;
    private final SettlementSaga settlementSaga;
    private final TransferProperties transferProperties;

    @Override
    public SettlementResultResponse createSettlement(String idempotencyKey, CreateSettlementRequest request) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new MissingIdempotencyKeyException();
        }

        Optional<Settlement> existing = settlementService.findByIdempotencyKey(idempotencyKey);
        if (existing.isPresent()) {
            log.info("Returning stored settlement for idempotency key: key={}, settlementId={}, status={}",
                    idempotencyKey, existing.get().getSettlementId(), existing.get().getStatus());
            return toResult(existing.get());
        }

        Settlement pending;
        try {
            pending = settlementService.createSettlement(CreateSettlementCommand.builder()
                    .idempotencyKey(idempotencyKey)
                    .contractId(request.getContractId())
                    .settlementType(request.getSettlementType())
                    .fromWalletId(request.getFrom().getWalletId())
                    .fromBankId(request.getFrom().getBankId())
                    .fromEscrowId(blankToNull(request.getFrom().getEscrowId()))
                    .toWalletId(request.getTo().getWalletId())
                    .toBankId(request.getTo().getBankId())
                    .amount(request.getAmount())
                    .currency(request.getCurrency() != null ? request.getCurrency() : transferProperties.getDefaultCurrency())
                    .metadata(request.getMetadata())
                    .build());
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent settlement request with same idempotency key: key={}", idempotencyKey);
            return settlementService.findByIdempotencyKey(idempotencyKey)
                    .map(SettlementFacadeImpl::toResult)
                    .orElseThrow(() -> e);
        }

        return toResult(settlementSaga.execute(pending));
    }

    @Override
    public SettlementDetailResponse getSettlement(String settlementId) {
        Settlement settlement = settlementService.findSettlement(settlementId)
                .orElseThrow(() -> new SettlementNotFoundException(settlementId));

        boolean failed = settlement.getStatus() == SettlementStatus.FAILED;

        return SettlementDetailResponse.builder()
                .settlementId(settlement.getSettlementId())
                .contractId(settlement.getContractId())
                .transferId(settlement.getTransferId())
                .status(statusValue(settlement))
                .settlementType(settlement.getSettlementType())
                .amount(settlement.getAmount().toPlainString())
                .currency(settlement.getCurrency())
                .fromWalletId(settlement.getFromWalletId())
                .fromBankId(settlement.getFromBankId())
                .toWalletId(settlement.getToWalletId())
                .toBankId(settlement.getToBankId())
                .metadata(settlement.getMetadata())
                .createdAt(settlement.getCreatedAt())
                .completedAt(settlement.getCompletedAt())
                .error(failed && settlement.getErrorCode() != null ? settlement.getErrorCode().name() : null)
                .errorMessage(failed ? settlement.getStatusMessage() : null)
                .build();
    }

    static SettlementResultResponse toResult(Settlement settlement) {
        boolean failed = settlement.getStatus() == SettlementStatus.FAILED;

        return SettlementResultResponse.builder()
                .settlementId(settlement.getSettlementId())
                .transferId(settlement.getTransferId())
                .status(statusValue(settlement))
                .amount(settlement.getAmount().toPlainString())
                .fromWalletId(settlement.getFromWalletId())
                .toWalletId(settlement.getToWalletId())
                .completedAt(settlement.getCompletedAt())
                .error(failed && settlement.getErrorCode() != null ? settlement.getErrorCode().name() : null)
                .errorMessage(failed ? settlement.getStatusMessage() : null)
                .build();
    }

    private static String statusValue(Settlement settlement) {
        return settlement.getStatus().name().toLowerCase(Locale.ROOT);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
