package com.example.transfersim.service.impl;

import com.example.transfersim.entity.Settlement;
import com.example.transfersim.entity.SettlementErrorCode;
import com.example.transfersim.entity.SettlementStatus;
import com.example.transfersim.exception.SettlementNotFoundException;
import com.example.transfersim.repository.SettlementRepository;
import com.example.transfersim.service.PublicIdGenerator;
import com.example.transfersim.service.SettlementService;
import com.example.transfersim.service.command.CreateSettlementCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * SettlementService 實作類別
 *
 * 與 TransferServiceImpl 相同：每次狀態推進在單一事務內以悲觀鎖完成
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementServiceImpl implements SettlementService {

    private static final int MAX_STATUS_MESSAGE_LENGTH = 255;

    private final SettlementRepository settlementRepository;

    @Override
    @Transactional
    public Settlement createSettlement(CreateSettlementCommand command) {
        Settlement settlement = Settlement.builder()
            .settlementId(PublicIdGenerator.settlementId())
            .idempotencyKey(command.getIdempotencyKey())
            .contractId(command.getContractId())
            .settlementType(command.getSettlementType())
            .fromWalletId(command.getFromWalletId())
            .fromBankId(command.getFromBankId())
            .fromEscrowId(command.getFromEscrowId())
            .toWalletId(command.getToWalletId())
            .toBankId(command.getToBankId())
            .amount(command.getAmount())
            .currency(command.getCurrency())
            .metadata(command.getMetadata())
            .status(SettlementStatus.PENDING)
            .createdAt(LocalDateTime.now())
            .build();

        Settlement saved = settlementRepository.saveAndFlush(settlement);

        log.info("Created settlement: id={}, settlementId={}, contractId={}, amount={} {}",
            saved.getId(), saved.getSettlementId(), saved.getContractId(), saved.getAmount(), saved.getCurrency());

        return saved;
    }

    private Settlement transition(Long id, SettlementStatus expected, SettlementStatus newStatus,
                                  Consumer<Settlement> mutator) {
        Settlement settlement = settlementRepository.findByIdForUpdate(id)
            .orElseThrow(() -> new SettlementNotFoundException(String.valueOf(id)));

        if (settlement.getStatus() != expected) {
            throw new IllegalStateException(String.format(
                "Cannot move settlement to %s: id=%d, current status=%s", newStatus, id, settlement.getStatus()));
        }

        settlement.setStatus(newStatus);
        mutator.accept(settlement);
        Settlement saved = settlementRepository.save(settlement);

        log.info("Updated settlement status: id={}, settlementId={}, {} -> {}",
            id, saved.getSettlementId(), expected, newStatus);
        return saved;
    }

    @Override
    @Transactional
    public Settlement markProcessing(Long id, String fromUserId, String toUserId) {
        return transition(id, SettlementStatus.PENDING, SettlementStatus.PROCESSING, settlement -> {
            settlement.setFromUserId(fromUserId);
            settlement.setToUserId(toUserId);
        });
    }

    @Override
    @Transactional
    public Settlement completeSettlement(Long id, String transferId) {
        return transition(id, SettlementStatus.PROCESSING, SettlementStatus.COMPLETED, settlement -> {
            settlement.setTransferId(transferId);
            settlement.setStatusMessage("Settlement completed successfully");
            settlement.setCompletedAt(LocalDateTime.now());
        });
    }

    @Override
    @Transactional
    public Settlement failSettlement(Long id, SettlementErrorCode errorCode, String message, String transferId) {
        Settlement failed = transition(id, SettlementStatus.PROCESSING, SettlementStatus.FAILED, settlement -> {
            settlement.setErrorCode(errorCode);
            settlement.setStatusMessage(message != null && message.length() > MAX_STATUS_MESSAGE_LENGTH
                ? message.substring(0, MAX_STATUS_MESSAGE_LENGTH) : message);
            settlement.setTransferId(transferId);
        });
        log.warn("Settlement failed: settlementId={}, errorCode={}, message={}",
            failed.getSettlementId(), errorCode, message);
        return failed;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Settlement> findByIdempotencyKey(String idempotencyKey) {
        return settlementRepository.findByIdempotencyKey(idempotencyKey);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Settlement> findSettlement(String settlementIdOrId) {
        Optional<Settlement> byPublicId = settlementRepository.findBySettlementId(settlementIdOrId);
        if (byPublicId.isPresent()) {
            return byPublicId;
        }
        try {
            return settlementRepository.findById(Long.valueOf(settlementIdOrId));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
