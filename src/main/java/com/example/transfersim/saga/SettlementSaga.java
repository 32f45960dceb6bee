package com.example.transfersim.saga;

import com.example.transfersim.bank.BankConnector;
import com.example.transfersim.bank.BankConnectorRegistry;
import com.example.transfersim.bank.BankOperationResult;
import com.example.transfersim.entity.Settlement;
import com.example.transfersim.entity.SettlementErrorCode;
import com.example.transfersim.entity.SettlementMetadata;
import com.example.transfersim.entity.Transfer;
import com.example.transfersim.service.SettlementService;
import com.example.transfersim.service.TransferService;
import com.example.transfersim.service.command.SettlementTransferCommand;
import com.example.transfersim.webhook.SettlementWebhookService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Settlement Saga（同步執行，呼叫端等待最終結果）
 *
 * 流程：
 * 1. PENDING → PROCESSING，由錢包 ID 解析雙方 userId
 * 2. 取得來源與目的銀行 connector，任一不存在 → BANK_UNAVAILABLE
 * 3. 建立關聯轉帳（DEBITING）
 * 4. 有託管：escrow release 扣款；無託管：一般扣款
 * 5. 加帳；失敗時資金已離開來源，需人工補償
 * 6. 轉帳 COMPLETED → 結算 COMPLETED → settlement.completed 通知
 *
 * 任何失敗都會把結算標記為 FAILED 並發送 settlement.failed 通知
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SettlementSaga {

    static final String WALLET_PREFIX = "WLLT-";
    static final String DEFAULT_ACCOUNT = "default";

    private final SettlementService settlementService;
    private final TransferService transferService;
    private final BankConnectorRegistry connectorRegistry;
    private final ProfileImageRecorder profileImageRecorder;
    private final SettlementWebhookService webhookService;

    /**
     * 執行結算
     *
     * @param pending 剛建立的 PENDING 結算
     * @return 最終狀態的結算（COMPLETED 或 FAILED）
     */
    public Settlement execute(Settlement pending) {
        Settlement settlement = settlementService.markProcessing(pending.getId(),
            toUserId(pending.getFromWalletId()), toUserId(pending.getToWalletId()));

        Optional<BankConnector> fromBank = connectorRegistry.forBank(settlement.getFromBankId());
        if (fromBank.isEmpty()) {
            return fail(settlement, SettlementErrorCode.BANK_UNAVAILABLE, "Source bank not configured", null);
        }

        Optional<BankConnector> toBank = settlement.isCrossBank()
            ? connectorRegistry.forBank(settlement.getToBankId())
            : fromBank;
        if (toBank.isEmpty()) {
            return fail(settlement, SettlementErrorCode.BANK_UNAVAILABLE, "Destination bank not configured", null);
        }

        String description = describe(settlement.getMetadata());
        Transfer transfer = transferService.createSettlementTransfer(SettlementTransferCommand.builder()
            .senderUserId(settlement.getFromUserId())
            .senderBankId(settlement.getFromBankId())
            .recipientUserId(settlement.getToUserId())
            .recipientBankId(settlement.getToBankId())
            .amount(settlement.getAmount())
            .currency(settlement.getCurrency())
            .description(description)
            .contractId(settlement.getContractId())
            .settlementId(settlement.getSettlementId())
            .build());

        String reference = String.valueOf(transfer.getId());
        BankOperationResult debit;

        if (settlement.hasEscrow()) {
            debit = fromBank.get().escrowRelease(settlement.getFromEscrowId(), settlement.getContractId(),
                reference, description);
            if (!debit.isSuccess()) {
                String message = errorOr(debit, "Escrow release failed");
                transferService.markDebitFailed(transfer.getId(), message);
                return fail(settlement, SettlementErrorCode.ESCROW_RELEASE_FAILED, message, transfer.getTransferId());
            }
        } else {
            debit = fromBank.get().debit(settlement.getFromUserId(), DEFAULT_ACCOUNT, settlement.getAmount(),
                settlement.getCurrency(), reference, description + " - Debit");
            if (!debit.isSuccess()) {
                String message = errorOr(debit, "Debit failed");
                transferService.markDebitFailed(transfer.getId(), message);
                return fail(settlement, SettlementErrorCode.DEBIT_FAILED, message, transfer.getTransferId());
            }
        }

        transferService.markCrediting(transfer.getId(), debit.getTransactionId());

        BankOperationResult credit = toBank.get().credit(settlement.getToUserId(), null, settlement.getAmount(),
            settlement.getCurrency(), reference, description + " - Credit");

        if (!credit.isSuccess()) {
            String base = settlement.hasEscrow()
                ? "Credit failed (escrow released, needs compensation)"
                : "Credit failed (debit may need reversal)";
            String message = TransferSaga.withDetail(base, credit);
            transferService.markCreditFailed(transfer.getId(), message);
            log.error("Settlement credit failed after funds left source, manual compensation required: " +
                    "settlementId={}, transferId={}, debitTransactionId={}, error={}",
                settlement.getSettlementId(), transfer.getTransferId(), debit.getTransactionId(), credit.getError());
            return fail(settlement, SettlementErrorCode.CREDIT_FAILED, message, transfer.getTransferId());
        }

        Transfer completed = transferService.completeTransfer(transfer.getId(), credit.getTransactionId(),
            "Settlement completed successfully");
        profileImageRecorder.record(completed);

        Settlement done = settlementService.completeSettlement(settlement.getId(), completed.getTransferId());
        log.info("Settlement completed: settlementId={}, transferId={}, amount={} {}",
            done.getSettlementId(), done.getTransferId(), done.getAmount(), done.getCurrency());

        webhookService.notifySettlementFinished(done);
        return done;
    }

    private Settlement fail(Settlement settlement, SettlementErrorCode code, String message, String transferId) {
        Settlement failed = settlementService.failSettlement(settlement.getId(), code, message, transferId);
        webhookService.notifySettlementFinished(failed);
        return failed;
    }

    /**
     * WLLT-{userId} 去掉前綴，其餘原樣使用
     */
    static String toUserId(String walletId) {
        if (walletId != null && walletId.startsWith(WALLET_PREFIX)) {
            return walletId.substring(WALLET_PREFIX.length());
        }
        return walletId;
    }

    static String describe(SettlementMetadata metadata) {
        if (metadata != null && metadata.getContractTitle() != null && !metadata.getContractTitle().isBlank()) {
            return "Contract Settlement: " + metadata.getContractTitle();
        }
        return "Contract Settlement";
    }

    private static String errorOr(BankOperationResult result, String fallback) {
        return result.getError() != null ? result.getError() : fallback;
    }
}
