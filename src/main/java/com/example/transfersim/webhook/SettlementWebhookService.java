package com.example.transfersim.webhook;

import com.example.transfersim.entity.Settlement;
import com.example.transfersim.entity.SettlementStatus;
import com.example.transfersim.webhook.payload.SettlementWebhookPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * settlement.completed / settlement.failed 通知
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementWebhookService {

    private final WebhookDispatcher dispatcher;
    private final WebhookProperties properties;

    public void notifySettlementFinished(Settlement settlement) {
        try {
            SettlementWebhookPayload payload = buildPayload(settlement);
            dispatcher.dispatch(properties.getContract(), payload,
                    payload.getEventType() + " settlementId=" + settlement.getSettlementId());
        } catch (RuntimeException e) {
            log.error("Failed to prepare settlement notification: settlementId={}",
                    settlement.getSettlementId(), e);
        }
    }

    SettlementWebhookPayload buildPayload(Settlement settlement) {
        boolean completed = settlement.getStatus() == SettlementStatus.COMPLETED;

        SettlementWebhookPayload.SettlementData.SettlementDataBuilder data = SettlementWebhookPayload.SettlementData.builder()
                .settlementId(settlement.getSettlementId())
                .transferId(settlement.getTransferId())
                .contractId(settlement.getContractId())
                .status(completed ? "completed" : "failed")
                .amount(settlement.getAmount().toPlainString())
                .fromWalletId(settlement.getFromWalletId())
                .toWalletId(settlement.getToWalletId());

        if (!completed) {
            data.error(settlement.getErrorCode() != null ? settlement.getErrorCode().name() : "UNKNOWN_ERROR")
                .errorMessage(settlement.getStatusMessage() != null ? settlement.getStatusMessage() : "Settlement failed");
        }

        return SettlementWebhookPayload.builder()
                .eventId(generateEventId())
                .eventType(completed ? SettlementWebhookPayload.EVENT_COMPLETED : SettlementWebhookPayload.EVENT_FAILED)
                .timestamp(Instant.now().toString())
                .data(data.build())
                .build();
    }

    private static String generateEventId() {
        String random = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return "evt_" + Long.toString(System.currentTimeMillis(), 36) + random.substring(0, Math.min(6, random.length()));
    }
}
