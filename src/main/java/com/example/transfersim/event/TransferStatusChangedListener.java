package com.example.transfersim.event;

import com.example.transfersim.mq.producer.TransferSagaProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 轉帳狀態變更事件監聽器
 *
 * 關鍵設定：
 * - @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
 * - 只有 PENDING 記錄確實寫入後才派送 saga，若事務 rollback 不會送出
 *
 * MQ 發送失敗時不重拋：PENDING 轉帳會由 TransferMaintenanceJob 重新派送
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransferStatusChangedListener {

    private final TransferSagaProducer sagaProducer;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleTransferStatusChanged(TransferStatusChangedEvent event) {
        log.info("Transfer status changed: id={}, transferId={}, {} -> {}, terminal={}",
            event.getId(),
            event.getTransferId(),
            event.getOldStatus(),
            event.getNewStatus(),
            event.isTerminalState());

        if (!event.isNewPendingTransfer()) {
            return;
        }

        try {
            sagaProducer.sendSagaRequest(event.getId(), event.getTransferId());
        } catch (Exception e) {
            log.error("Failed to dispatch transfer saga, will be redispatched by maintenance job: id={}, transferId={}",
                event.getId(), event.getTransferId(), e);
        }
    }
}
