package com.example.transfersim.event;

import com.example.transfersim.entity.Transfer;
import com.example.transfersim.entity.TransferStatus;
import com.example.transfersim.service.impl.TransferStateTransitionValidator;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * 轉帳狀態變更事件
 *
 * 事件流程：
 * 1. TransferService 更新狀態並發布事件（在事務中）
 * 2. 事務提交
 * 3. @TransactionalEventListener 接收事件（在事務提交後）
 * 4. 新建的 PENDING 轉帳 → 發送 saga 執行請求到 MQ
 */
@Getter
public class TransferStatusChangedEvent extends ApplicationEvent {

    /**
     * 內部 ID
     */
    private final Long id;

    /**
     * 對外轉帳 ID
     */
    private final String transferId;

    /**
     * 舊狀態（null 表示新建）
     */
    private final TransferStatus oldStatus;

    private final TransferStatus newStatus;

    private final String statusMessage;

    public TransferStatusChangedEvent(Object source, Transfer transfer, TransferStatus oldStatus) {
        super(source);
        this.id = transfer.getId();
        this.transferId = transfer.getTransferId();
        this.oldStatus = oldStatus;
        this.newStatus = transfer.getStatus();
        this.statusMessage = transfer.getStatusMessage();
    }

    /**
     * 新建且需要 saga 接手（結算產生的轉帳直接從 DEBITING 開始，不在此列）
     */
    public boolean isNewPendingTransfer() {
        return oldStatus == null && newStatus == TransferStatus.PENDING;
    }

    public boolean isTerminalState() {
        return TransferStateTransitionValidator.isTerminalState(newStatus);
    }
}
