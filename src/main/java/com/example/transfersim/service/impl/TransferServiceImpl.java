package com.example.transfersim.service.impl;

import com.example.transfersim.alias.ResolvedAlias;
import com.example.transfersim.config.TransferProperties;
import com.example.transfersim.entity.AliasType;
import com.example.transfersim.entity.RecipientType;
import com.example.transfersim.entity.Transfer;
import com.example.transfersim.entity.TransferStatus;
import com.example.transfersim.entity.TransferType;
import com.example.transfersim.event.TransferStatusChangedEvent;
import com.example.transfersim.exception.InvalidTransferStateException;
import com.example.transfersim.exception.TransferNotFoundException;
import com.example.transfersim.merchant.MerchantFeeCalculator;
import com.example.transfersim.merchant.MerchantInfo;
import com.example.transfersim.repository.TransferRepository;
import com.example.transfersim.service.PublicIdGenerator;
import com.example.transfersim.service.TransferDirection;
import com.example.transfersim.service.TransferService;
import com.example.transfersim.service.command.CreateTransferCommand;
import com.example.transfersim.service.command.SettlementTransferCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * TransferService 實作類別
 *
 * 實作重點：
 * 1. 使用 @Transactional 確保每次狀態推進是原子操作
 * 2. 使用悲觀鎖（findByIdForUpdate）讓 saga 與寄件人取消互斥
 * 3. 狀態轉換驗證：使用 TransferStateTransitionValidator 驗證所有狀態轉換
 * 4. 事件發布：所有狀態變更後發布 TransferStatusChangedEvent
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransferServiceImpl implements TransferService {

    private static final int MAX_STATUS_MESSAGE_LENGTH = 255;

    private final TransferRepository transferRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final TransferProperties transferProperties;

    @Override
    @Transactional
    public Transfer createPendingTransfer(CreateTransferCommand command) {
        LocalDateTime now = LocalDateTime.now();

        Transfer transfer = Transfer.builder()
            .transferId(PublicIdGenerator.transferId())
            .senderUserId(command.getSenderUserId())
            .senderBankId(command.getSenderBankId())
            .senderAccountId(command.getSenderAccountId())
            .recipientAlias(command.getRecipientAlias())
            .recipientAliasType(command.getRecipientAliasType())
            .amount(command.getAmount())
            .currency(command.getCurrency())
            .description(command.getDescription())
            .transferType(TransferType.P2P)
            .recipientType(RecipientType.INDIVIDUAL)
            .status(TransferStatus.PENDING)
            .createdAt(now)
            .expiresAt(now.plus(transferProperties.getPendingExpiry()))
            .build();

        Transfer savedTransfer = transferRepository.save(transfer);

        // 發布狀態變更事件（oldStatus = null 表示新建）
        eventPublisher.publishEvent(new TransferStatusChangedEvent(this, savedTransfer, null));

        log.info("Created pending transfer: id={}, transferId={}, sender={}@{}, alias={}, amount={} {}",
            savedTransfer.getId(), savedTransfer.getTransferId(), command.getSenderUserId(),
            command.getSenderBankId(), command.getRecipientAlias(), command.getAmount(), command.getCurrency());

        return savedTransfer;
    }

    @Override
    @Transactional
    public Transfer createSettlementTransfer(SettlementTransferCommand command) {
        Transfer transfer = Transfer.builder()
            .transferId(PublicIdGenerator.transferId())
            .senderUserId(command.getSenderUserId())
            .senderBankId(command.getSenderBankId())
            .senderAccountId("default")
            .recipientAlias(command.getRecipientUserId())
            .recipientAliasType(AliasType.USERNAME)
            .recipientUserId(command.getRecipientUserId())
            .recipientBankId(command.getRecipientBankId())
            .amount(command.getAmount())
            .currency(command.getCurrency())
            .description(command.getDescription())
            .transferType(TransferType.CONTRACT_SETTLEMENT)
            .recipientType(RecipientType.INDIVIDUAL)
            .contractId(command.getContractId())
            .settlementId(command.getSettlementId())
            .status(TransferStatus.DEBITING)
            .createdAt(LocalDateTime.now())
            .build();

        Transfer savedTransfer = transferRepository.save(transfer);
        eventPublisher.publishEvent(new TransferStatusChangedEvent(this, savedTransfer, null));

        log.info("Created settlement transfer: id={}, transferId={}, settlementId={}, amount={} {}",
            savedTransfer.getId(), savedTransfer.getTransferId(), command.getSettlementId(),
            command.getAmount(), command.getCurrency());

        return savedTransfer;
    }

    /**
     * 內部輔助方法：使用悲觀鎖更新狀態（含完整驗證和事件發布）
     *
     * 所有 public 狀態更新方法都調用此方法
     *
     * @param id 轉帳內部 ID
     * @param newStatus 新狀態
     * @param mutator 在同一事務內套用的欄位更新（例如交易 ID、狀態訊息）
     * @return Optional<Transfer> 成功更新則返回 Transfer，若狀態轉換不合法則返回 Optional.empty()
     * @throws TransferNotFoundException 轉帳不存在
     */
    private Optional<Transfer> transitionStatusWithLock(Long id, TransferStatus newStatus, Consumer<Transfer> mutator) {
        Transfer transfer = transferRepository.findByIdForUpdate(id)
            .orElseThrow(() -> new TransferNotFoundException(id));

        TransferStatus oldStatus = transfer.getStatus();

        if (!TransferStateTransitionValidator.isTransitionAllowed(oldStatus, newStatus)) {
            log.warn("Invalid state transition: id={}, from={}, to={}, allowed={}", id, oldStatus, newStatus,
                TransferStateTransitionValidator.getAllowedTransitions(oldStatus));
            return Optional.empty();
        }

        transfer.setStatus(newStatus);
        mutator.accept(transfer);
        Transfer savedTransfer = transferRepository.save(transfer);

        eventPublisher.publishEvent(new TransferStatusChangedEvent(this, savedTransfer, oldStatus));

        log.info("Updated transfer status: id={}, transferId={}, {} -> {}",
            id, savedTransfer.getTransferId(), oldStatus, newStatus);

        return Optional.of(savedTransfer);
    }

    /**
     * 狀態轉換必須成功，否則拋出 InvalidTransferStateException
     */
    private Transfer requireTransition(Long id, TransferStatus newStatus, Consumer<Transfer> mutator) {
        return transitionStatusWithLock(id, newStatus, mutator)
            .orElseThrow(() -> {
                Transfer current = transferRepository.findById(id)
                    .orElseThrow(() -> new TransferNotFoundException(id));
                return new InvalidTransferStateException(
                    String.format("Cannot move transfer to %s: id=%d, current status=%s",
                        newStatus, id, current.getStatus()));
            });
    }

    @Override
    @Transactional
    public Optional<Transfer> claimForResolution(Long id) {
        Optional<Transfer> claimed = transitionStatusWithLock(id, TransferStatus.RESOLVING, transfer -> { });
        if (claimed.isEmpty()) {
            log.info("Transfer not claimable for resolution, skipping: id={}", id);
        }
        return claimed;
    }

    @Override
    @Transactional
    public Transfer markRecipientNotFound(Long id, String message) {
        return requireTransition(id, TransferStatus.RECIPIENT_NOT_FOUND,
            transfer -> transfer.setStatusMessage(truncate(message)));
    }

    @Override
    @Transactional
    public Transfer markSelfTransfer(Long id, ResolvedAlias recipient) {
        return requireTransition(id, TransferStatus.DEBIT_FAILED, transfer -> {
            applyRecipient(transfer, recipient);
            transfer.setStatusMessage("Cannot transfer to yourself");
        });
    }

    @Override
    @Transactional
    public Transfer markResolved(Long id, ResolvedAlias recipient, MerchantInfo merchant) {
        return requireTransition(id, TransferStatus.DEBITING, transfer -> {
            applyRecipient(transfer, recipient);
            if (merchant != null) {
                transfer.setRecipientType(RecipientType.MICRO_MERCHANT);
                transfer.setTransferType(TransferType.MERCHANT);
                transfer.setMerchantId(merchant.getMerchantId());
                transfer.setFeeAmount(MerchantFeeCalculator.calculateFee(transfer.getAmount()));
            } else {
                transfer.setRecipientType(RecipientType.INDIVIDUAL);
            }
        });
    }

    @Override
    @Transactional
    public Transfer markDebitFailed(Long id, String message) {
        return requireTransition(id, TransferStatus.DEBIT_FAILED,
            transfer -> transfer.setStatusMessage(truncate(message)));
    }

    @Override
    @Transactional
    public Transfer markCrediting(Long id, String debitTransactionId) {
        return requireTransition(id, TransferStatus.CREDITING,
            transfer -> transfer.setDebitTransactionId(debitTransactionId));
    }

    @Override
    @Transactional
    public Transfer markCreditFailed(Long id, String message) {
        return requireTransition(id, TransferStatus.CREDIT_FAILED,
            transfer -> transfer.setStatusMessage(truncate(message)));
    }

    @Override
    @Transactional
    public Transfer completeTransfer(Long id, String creditTransactionId, String message) {
        return requireTransition(id, TransferStatus.COMPLETED, transfer -> {
            if (transfer.getDebitTransactionId() == null) {
                throw new InvalidTransferStateException(
                    String.format("Cannot complete transfer without debit transaction: id=%d", id));
            }
            transfer.setCreditTransactionId(creditTransactionId);
            transfer.setStatusMessage(truncate(message));
            transfer.setCompletedAt(LocalDateTime.now());
        });
    }

    @Override
    @Transactional
    public void recordProfileImages(Long id, String senderProfileImageUrl, String recipientProfileImageUrl) {
        Transfer transfer = transferRepository.findById(id)
            .orElseThrow(() -> new TransferNotFoundException(id));
        transfer.setSenderProfileImageUrl(senderProfileImageUrl);
        transfer.setRecipientProfileImageUrl(recipientProfileImageUrl);
        transferRepository.save(transfer);
    }

    @Override
    @Transactional
    public Transfer cancelTransfer(String transferId, String userId, String bankId) {
        Transfer transfer = transferRepository.findByTransferId(transferId)
            .filter(t -> t.isSentBy(userId, bankId))
            .orElseThrow(() -> new TransferNotFoundException(transferId));

        if (!TransferStateTransitionValidator.isCancellable(transfer.getStatus())) {
            throw new InvalidTransferStateException(
                String.format("Cannot cancel transfer in %s status", transfer.getStatus()));
        }

        // 讀取後狀態仍可能被 saga 推進，以鎖定後的轉換結果為準
        Optional<Transfer> cancelled = transitionStatusWithLock(transfer.getId(), TransferStatus.CANCELLED,
            t -> t.setStatusMessage("Cancelled by sender"));

        if (cancelled.isEmpty()) {
            Transfer current = transferRepository.findById(transfer.getId())
                .orElseThrow(() -> new TransferNotFoundException(transferId));
            throw new InvalidTransferStateException(
                String.format("Cannot cancel transfer in %s status", current.getStatus()));
        }

        return cancelled.get();
    }

    @Override
    @Transactional
    public boolean expireTransfer(Long id) {
        return transitionStatusWithLock(id, TransferStatus.EXPIRED,
            transfer -> transfer.setStatusMessage("Transfer expired before completion"))
            .isPresent();
    }

    @Override
    @Transactional(readOnly = true)
    public Transfer getTransfer(Long id) {
        return transferRepository.findById(id)
            .orElseThrow(() -> new TransferNotFoundException(id));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Transfer> findByTransferId(String transferId) {
        return transferRepository.findByTransferId(transferId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Transfer> findVisibleTransfer(String transferId, String userId, String bankId) {
        return transferRepository.findByTransferId(transferId)
            .filter(t -> t.isSentBy(userId, bankId) || t.isReceivedBy(userId, bankId));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<Transfer> findHistory(String userId, String bankId, TransferDirection direction,
                                      TransferStatus status, int page, int size) {
        Pageable pageable = PageRequest.of(page, size);
        switch (direction) {
            case SENT:
                return transferRepository.findSentBy(userId, bankId, status, pageable);
            case RECEIVED:
                return transferRepository.findReceivedBy(userId, bankId, status, pageable);
            default:
                return transferRepository.findInvolving(userId, bankId, status, pageable);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Transfer> findStalePendingTransfers(int delaySeconds, int batchSize) {
        LocalDateTime cutoffTime = LocalDateTime.now().minusSeconds(delaySeconds);
        return transferRepository.findPendingTransfers(
            TransferStatus.PENDING, cutoffTime, PageRequest.of(0, batchSize));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Transfer> findExpiredTransfers(int batchSize) {
        return transferRepository.findExpiredTransfers(
            EnumSet.of(TransferStatus.PENDING, TransferStatus.RESOLVING),
            LocalDateTime.now(), PageRequest.of(0, batchSize));
    }

    private static void applyRecipient(Transfer transfer, ResolvedAlias recipient) {
        transfer.setRecipientUserId(recipient.getUserId());
        transfer.setRecipientBankId(recipient.getBankId());
        transfer.setRecipientAccountId(recipient.getAccountId());
    }

    private static String truncate(String message) {
        if (message != null && message.length() > MAX_STATUS_MESSAGE_LENGTH) {
            return message.substring(0, MAX_STATUS_MESSAGE_LENGTH);
        }
        return message;
    }
}
