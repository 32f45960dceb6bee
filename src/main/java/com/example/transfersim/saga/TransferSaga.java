package com.example.transfersim.saga;

import com.example.transfersim.alias.AliasResolver;
import com.example.transfersim.alias.ResolvedAlias;
import com.example.transfersim.bank.BankConnector;
import com.example.transfersim.bank.BankConnectorRegistry;
import com.example.transfersim.bank.BankOperationResult;
import com.example.transfersim.entity.RecipientType;
import com.example.transfersim.entity.Transfer;
import com.example.transfersim.exception.InvalidTransferStateException;
import com.example.transfersim.merchant.MerchantInfo;
import com.example.transfersim.merchant.MerchantRegistry;
import com.example.transfersim.service.TransferService;
import com.example.transfersim.webhook.TransferWebhookService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Transfer Saga
 *
 * 流程：
 * 1. 接手：PENDING → RESOLVING（只有 PENDING 會被執行，重複投遞直接略過）
 * 2. 解析別名：找不到 → RECIPIENT_NOT_FOUND；收款人是自己 → DEBIT_FAILED；否則 → DEBITING
 * 3. 扣款：失敗 → DEBIT_FAILED（沒有資金移動）；成功 → CREDITING（先存 debitTransactionId）
 * 4. 加帳：失敗 → CREDIT_FAILED（扣款需人工沖正，不自動補償）；成功 → COMPLETED
 * 5. 完成後的附帶動作（商家統計、頭像、transfer.completed 通知）失敗只記 log
 *
 * 每一步都是獨立事務；銀行呼叫在事務外進行。
 * 同行與跨行只差在加帳使用哪一家銀行的 connector。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransferSaga {

    static final String RECIPIENT_NOT_FOUND_MESSAGE = "Recipient alias not found or not verified";

    private final TransferService transferService;
    private final AliasResolver aliasResolver;
    private final MerchantRegistry merchantRegistry;
    private final BankConnectorRegistry connectorRegistry;
    private final ProfileImageRecorder profileImageRecorder;
    private final TransferWebhookService webhookService;

    /**
     * 執行 saga
     *
     * @param id 轉帳內部 ID
     */
    public void execute(Long id) {
        Optional<Transfer> claimed = transferService.claimForResolution(id);
        if (claimed.isEmpty()) {
            return;
        }

        try {
            Optional<Transfer> debiting = resolveRecipient(claimed.get());
            if (debiting.isEmpty()) {
                return;
            }

            executeMoneyMovement(debiting.get()).ifPresent(this::afterCompletion);
        } catch (InvalidTransferStateException e) {
            // 例如寄件人在解析期間取消
            log.warn("Transfer saga aborted by concurrent state change: id={}, reason={}", id, e.getMessage());
        }
    }

    private Optional<Transfer> resolveRecipient(Transfer transfer) {
        Optional<ResolvedAlias> resolved = aliasResolver.findVerifiedAlias(
            transfer.getRecipientAliasType(), transfer.getRecipientAlias());

        if (resolved.isEmpty()) {
            transferService.markRecipientNotFound(transfer.getId(), RECIPIENT_NOT_FOUND_MESSAGE);
            log.warn("Recipient not found: transferId={}, aliasType={}, alias={}",
                transfer.getTransferId(), transfer.getRecipientAliasType(), transfer.getRecipientAlias());
            return Optional.empty();
        }

        ResolvedAlias recipient = resolved.get();
        if (recipient.getUserId().equals(transfer.getSenderUserId())
            && recipient.getBankId().equals(transfer.getSenderBankId())) {
            transferService.markSelfTransfer(transfer.getId(), recipient);
            log.warn("Self transfer rejected: transferId={}, userId={}", transfer.getTransferId(), recipient.getUserId());
            return Optional.empty();
        }

        MerchantInfo merchant = merchantRegistry
            .findActiveMerchant(recipient.getUserId(), recipient.getBankId())
            .orElse(null);

        return Optional.of(transferService.markResolved(transfer.getId(), recipient, merchant));
    }

    private Optional<Transfer> executeMoneyMovement(Transfer transfer) {
        boolean crossBank = transfer.isCrossBank();

        Optional<BankConnector> senderBank = connectorRegistry.forBank(transfer.getSenderBankId());
        if (senderBank.isEmpty()) {
            transferService.markDebitFailed(transfer.getId(),
                crossBank ? "Sender BSIM connection not configured" : "BSIM connection not configured");
            return Optional.empty();
        }

        BankConnector recipientBank = senderBank.get();
        if (crossBank) {
            Optional<BankConnector> connector = connectorRegistry.forBank(transfer.getRecipientBankId());
            if (connector.isEmpty()) {
                transferService.markCreditFailed(transfer.getId(), "Recipient BSIM connection not configured");
                return Optional.empty();
            }
            recipientBank = connector.get();
        }

        String reference = String.valueOf(transfer.getId());
        String description = transfer.getDescription() != null
            ? transfer.getDescription()
            : crossBank ? "P2P Transfer (Cross-bank)" : "P2P Transfer";

        BankOperationResult debit = senderBank.get().debit(
            transfer.getSenderUserId(), transfer.getSenderAccountId(), transfer.getAmount(),
            transfer.getCurrency(), reference, description);

        if (!debit.isSuccess()) {
            transferService.markDebitFailed(transfer.getId(), debit.describeFailure("Debit failed"));
            log.warn("Transfer debit failed: transferId={}, error={}, message={}",
                transfer.getTransferId(), debit.getError(), debit.getMessage());
            return Optional.empty();
        }

        transferService.markCrediting(transfer.getId(), debit.getTransactionId());

        BankOperationResult credit = recipientBank.credit(
            transfer.getRecipientUserId(), transfer.getRecipientAccountId(), transfer.getAmount(),
            transfer.getCurrency(), reference, description);

        if (!credit.isSuccess()) {
            String base = crossBank
                ? "Credit failed at recipient bank (debit may need reversal)"
                : "Credit failed (debit may need reversal)";
            transferService.markCreditFailed(transfer.getId(), withDetail(base, credit));
            log.error("Transfer credit failed after successful debit, manual reversal required: " +
                    "transferId={}, debitTransactionId={}, error={}, message={}",
                transfer.getTransferId(), debit.getTransactionId(), credit.getError(), credit.getMessage());
            return Optional.empty();
        }

        Transfer completed = transferService.completeTransfer(transfer.getId(), credit.getTransactionId(),
            crossBank ? "Cross-bank transfer completed successfully" : "Transfer completed successfully");

        log.info("Transfer completed: transferId={}, amount={} {}, from={}@{}, to={}@{}",
            completed.getTransferId(), completed.getAmount(), completed.getCurrency(),
            completed.getSenderUserId(), completed.getSenderBankId(),
            completed.getRecipientUserId(), completed.getRecipientBankId());

        return Optional.of(completed);
    }

    private void afterCompletion(Transfer transfer) {
        if (transfer.getRecipientType() == RecipientType.MICRO_MERCHANT && transfer.getMerchantId() != null) {
            try {
                merchantRegistry.incrementStats(transfer.getMerchantId(), transfer.getAmount(), transfer.getFeeAmount());
            } catch (RuntimeException e) {
                log.error("Failed to update merchant stats: transferId={}, merchantId={}",
                    transfer.getTransferId(), transfer.getMerchantId(), e);
            }
        }

        profileImageRecorder.record(transfer);
        webhookService.notifyTransferCompleted(transfer);
    }

    static String withDetail(String base, BankOperationResult result) {
        String detail = result.describeFailure(null);
        return detail != null ? base + ": " + detail : base;
    }
}
