package com.example.transfersim.webhook;

import com.example.transfersim.entity.RecipientType;
import com.example.transfersim.entity.Transfer;
import com.example.transfersim.merchant.MerchantInfo;
import com.example.transfersim.merchant.MerchantRegistry;
import com.example.transfersim.service.ParticipantDirectory;
import com.example.transfersim.webhook.payload.TransferCompletedPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * transfer.completed 通知
 *
 * 組裝 payload 時的查詢失敗只記 log，不影響轉帳結果
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransferWebhookService {

    private final WebhookDispatcher dispatcher;
    private final WebhookProperties properties;
    private final ParticipantDirectory participantDirectory;
    private final MerchantRegistry merchantRegistry;

    public void notifyTransferCompleted(Transfer transfer) {
        try {
            TransferCompletedPayload payload = buildPayload(transfer);
            dispatcher.dispatch(properties.getWallet(), payload,
                    TransferCompletedPayload.EVENT_TYPE + " transferId=" + transfer.getTransferId());
        } catch (RuntimeException e) {
            log.error("Failed to prepare transfer.completed notification: transferId={}",
                    transfer.getTransferId(), e);
        }
    }

    TransferCompletedPayload buildPayload(Transfer transfer) {
        boolean merchant = transfer.getRecipientType() == RecipientType.MICRO_MERCHANT;
        String merchantName = merchant
                ? merchantRegistry.findActiveMerchant(transfer.getRecipientUserId(), transfer.getRecipientBankId())
                        .map(MerchantInfo::getMerchantName)
                        .orElse(null)
                : null;

        TransferCompletedPayload.TransferData data = TransferCompletedPayload.TransferData.builder()
                .transferId(transfer.getTransferId())
                .recipientUserId(transfer.getRecipientUserId())
                .recipientBsimId(transfer.getRecipientBankId())
                .recipientAlias(transfer.getRecipientAlias())
                .recipientAliasType(transfer.getRecipientAliasType().name())
                .recipientType(merchant ? "merchant" : "individual")
                .merchantName(merchantName)
                .senderDisplayName(participantDirectory.displayName(transfer.getSenderUserId(), transfer.getSenderBankId()))
                .senderAlias(participantDirectory.primaryAlias(transfer.getSenderUserId(), transfer.getSenderBankId()))
                .senderProfileImageUrl(transfer.getSenderProfileImageUrl())
                .recipientProfileImageUrl(transfer.getRecipientProfileImageUrl())
                .senderBankName(participantDirectory.bankName(transfer.getSenderBankId()))
                .recipientBankName(participantDirectory.bankName(transfer.getRecipientBankId()))
                .amount(transfer.getAmount().toPlainString())
                .currency(transfer.getCurrency())
                .description(transfer.getDescription())
                .crossBank(transfer.isCrossBank())
                .build();

        return TransferCompletedPayload.builder()
                .eventType(TransferCompletedPayload.EVENT_TYPE)
                .timestamp(Instant.now().toString())
                .idempotencyKey(transfer.getTransferId())
                .data(data)
                .build();
    }
}
