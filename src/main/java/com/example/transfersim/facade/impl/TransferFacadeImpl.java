package com.example.transfersim.facade.impl;

import com.example.transfersim.alias.AliasNormalizer;
import com.example.transfersim.config.TransferProperties;
import com.example.transfersim.entity.AliasType;
import com.example.transfersim.entity.Transfer;
import com.example.transfersim.entity.TransferStatus;
import com.example.transfersim.exception.AliasTypeUndeterminedException;
import com.example.transfersim.exception.TransferLimitExceededException;
import com.example.transfersim.exception.TransferNotFoundException;
import com.example.transfersim.facade.TransferFacade;
import com.example.transfersim.facade.dto.*;
import com.example.transfersim.mq.msg.TransferSagaMsg;
import com.example.transfersim.mq.producer.TransferSagaProducer;
import com.example.transfersim.saga.TransferSaga;
import com.example.transfersim.service.ParticipantDirectory;
import com.example.transfersim.service.TransferDirection;
import com.example.transfersim.service.TransferService;
import com.example.transfersim.service.command.CreateTransferCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * TransferFacade 實作
 *
 * 協調邏輯：
 * - 建立轉帳只寫入 PENDING，MQ 由 TransferStatusChangedListener 在提交後發送
 * - saga 執行委派給 TransferSaga
 * - 維護排程逐筆處理，單筆失敗不影響其他轉帳
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransferFacadeImpl implements TransferFacade {

    private static final int MAX_PAGE_SIZE = 100;

    private final TransferService transferService;
    private final TransferSaga transferSaga;
    private final TransferSagaProducer transferSagaProducer;
    private final ParticipantDirectory participantDirectory;
    private final TransferProperties transferProperties;

    @Override
    public CreateTransferResponse createTransfer(CreateTransferRequest request) {
        log.info("Processing create transfer request: senderUserId={}, senderBankId={}, amount={}",
                request.getSenderUserId(), request.getSenderBankId(), request.getAmount());

        // 1. 金額上限
        BigDecimal limit = transferProperties.getPerTransferLimit();
        if (request.getAmount().compareTo(limit) > 0) {
            log.warn("Transfer amount exceeds limit: senderUserId={}, amount={}, limit={}",
                    request.getSenderUserId(), request.getAmount(), limit);
            throw new TransferLimitExceededException(limit);
        }

        // 2. 別名類型與正規化
        String rawAlias = request.getRecipientAlias().trim();
        AliasType aliasType = request.getRecipientAliasType() != null
                ? request.getRecipientAliasType()
                : AliasNormalizer.inferType(rawAlias).orElseThrow(AliasTypeUndeterminedException::new);
        String normalizedAlias = AliasNormalizer.normalize(aliasType, rawAlias);

        // 3. 建立 PENDING 轉帳
        Transfer transfer = transferService.createPendingTransfer(CreateTransferCommand.builder()
                .senderUserId(request.getSenderUserId().trim())
                .senderBankId(request.getSenderBankId().trim())
                .senderAccountId(request.getSenderAccountId().trim())
                .recipientAlias(normalizedAlias)
                .recipientAliasType(aliasType)
                .amount(request.getAmount())
                .currency(request.getCurrency() != null ? request.getCurrency() : transferProperties.getDefaultCurrency())
                .description(request.getDescription())
                .build());

        log.info("Transfer created successfully: transferId={}, aliasType={}, amount={} {}, status={}",
                transfer.getTransferId(), aliasType, transfer.getAmount(), transfer.getCurrency(), transfer.getStatus());

        return CreateTransferResponse.builder()
                .transferId(transfer.getTransferId())
                .status(transfer.getStatus())
                .amount(transfer.getAmount().toPlainString())
                .currency(transfer.getCurrency())
                .recipientAlias(transfer.getRecipientAlias())
                .createdAt(transfer.getCreatedAt())
                .build();
    }

    @Override
    public TransferDetailResponse getTransfer(String transferId, String userId, String bankId) {
        Transfer transfer = transferService.findVisibleTransfer(transferId, userId, bankId)
                .orElseThrow(() -> new TransferNotFoundException(transferId));

        return TransferDetailResponse.builder()
                .transferId(transfer.getTransferId())
                .status(transfer.getStatus())
                .statusMessage(transfer.getStatusMessage())
                .amount(transfer.getAmount().toPlainString())
                .currency(transfer.getCurrency())
                .description(transfer.getDescription())
                .recipientAlias(transfer.getRecipientAlias())
                .recipientAliasType(transfer.getRecipientAliasType())
                .direction(directionOf(transfer, userId, bankId).value())
                .createdAt(transfer.getCreatedAt())
                .completedAt(transfer.getCompletedAt())
                .expiresAt(transfer.getExpiresAt())
                .build();
    }

    @Override
    public TransferListResponse listTransfers(String userId, String bankId, String direction, String status,
                                              int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("Page must be >= 0");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("Size must be between 1 and " + MAX_PAGE_SIZE);
        }

        TransferDirection transferDirection = TransferDirection.fromValue(direction);
        TransferStatus statusFilter = parseStatus(status);

        Page<Transfer> transferPage = transferService.findHistory(
                userId, bankId, transferDirection, statusFilter, page, size);

        List<TransferItemDto> transfers = transferPage.getContent().stream()
                .map(transfer -> mapToTransferItemDto(transfer, userId, bankId))
                .toList();

        PaginationMeta pagination = PaginationMeta.builder()
                .currentPage(transferPage.getNumber())
                .pageSize(transferPage.getSize())
                .totalElements(transferPage.getTotalElements())
                .totalPages(transferPage.getTotalPages())
                .hasNext(transferPage.hasNext())
                .hasPrevious(transferPage.hasPrevious())
                .build();

        log.info("Transfer history retrieved: userId={}, bankId={}, direction={}, recordCount={}, totalElements={}",
                userId, bankId, transferDirection.value(), transfers.size(), pagination.getTotalElements());

        return TransferListResponse.builder()
                .transfers(transfers)
                .pagination(pagination)
                .build();
    }

    @Override
    public CancelTransferResponse cancelTransfer(String transferId, String userId, String bankId) {
        log.info("Processing cancel transfer request: transferId={}, userId={}", transferId, userId);

        Transfer transfer = transferService.cancelTransfer(transferId, userId, bankId);

        return CancelTransferResponse.builder()
                .success(true)
                .transferId(transfer.getTransferId())
                .status(transfer.getStatus())
                .statusMessage(transfer.getStatusMessage())
                .build();
    }

    @Override
    public void handleSagaRequest(TransferSagaMsg msg) {
        log.info("Processing transfer saga request: id={}, transferId={}", msg.getId(), msg.getTransferId());
        transferSaga.execute(msg.getId());
    }

    @Override
    public int redispatchStalePendingTransfers(int delaySeconds, int batchSize) {
        log.info("Redispatching stale PENDING transfers: delaySeconds={}, batchSize={}", delaySeconds, batchSize);

        List<Transfer> staleTransfers = transferService.findStalePendingTransfers(delaySeconds, batchSize);

        int processedCount = 0;
        for (Transfer transfer : staleTransfers) {
            try {
                transferSagaProducer.sendSagaRequest(transfer.getId(), transfer.getTransferId());
                processedCount++;
            } catch (Exception e) {
                log.error("Failed to redispatch transfer {}: {}", transfer.getTransferId(), e.getMessage(), e);
                // Continue processing other transfers
            }
        }

        log.info("Redispatched {} of {} stale PENDING transfers", processedCount, staleTransfers.size());
        return processedCount;
    }

    @Override
    public int expireOverdueTransfers(int batchSize) {
        List<Transfer> expiredTransfers = transferService.findExpiredTransfers(batchSize);

        int processedCount = 0;
        for (Transfer transfer : expiredTransfers) {
            try {
                if (transferService.expireTransfer(transfer.getId())) {
                    processedCount++;
                }
            } catch (Exception e) {
                log.error("Failed to expire transfer {}: {}", transfer.getTransferId(), e.getMessage(), e);
            }
        }

        log.info("Expired {} of {} overdue transfers", processedCount, expiredTransfers.size());
        return processedCount;
    }

    private TransferItemDto mapToTransferItemDto(Transfer transfer, String userId, String bankId) {
        TransferDirection direction = directionOf(transfer, userId, bankId);

        TransferItemDto.TransferItemDtoBuilder item = TransferItemDto.builder()
                .transferId(transfer.getTransferId())
                .status(transfer.getStatus())
                .amount(transfer.getAmount().toPlainString())
                .currency(transfer.getCurrency())
                .description(transfer.getDescription())
                .recipientAlias(transfer.getRecipientAlias())
                .recipientAliasType(transfer.getRecipientAliasType())
                .direction(direction.value())
                .createdAt(transfer.getCreatedAt())
                .completedAt(transfer.getCompletedAt())
                .senderProfileImageUrl(transfer.getSenderProfileImageUrl())
                .recipientProfileImageUrl(transfer.getRecipientProfileImageUrl());

        if (direction == TransferDirection.RECEIVED) {
            item.senderAlias(participantDirectory.primaryAlias(transfer.getSenderUserId(), transfer.getSenderBankId()))
                .senderDisplayName(participantDirectory.displayName(transfer.getSenderUserId(), transfer.getSenderBankId()))
                .senderBankName(participantDirectory.bankName(transfer.getSenderBankId()));
        }

        return item.build();
    }

    private static TransferDirection directionOf(Transfer transfer, String userId, String bankId) {
        return transfer.isSentBy(userId, bankId) ? TransferDirection.SENT : TransferDirection.RECEIVED;
    }

    private static TransferStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return TransferStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid status: " + status);
        }
    }
}
