package com.example.transfersim.schedule;

import com.example.transfersim.config.SchedulerProperties;
import com.example.transfersim.facade.TransferFacade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Transfer Maintenance Scheduled Job
 *
 * 定時任務：
 * 1. 重送卡在 PENDING 的 saga 請求（提交後 MQ 發送失敗）
 * 2. 將超過 expiresAt 的 PENDING / RESOLVING 轉帳標記為 EXPIRED
 *
 * 不處理 DEBITING / CREDITING：已有資金移動的轉帳不自動重試，由人工處理
 *
 * 配置：scheduler.transfer-maintenance.*
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransferMaintenanceJob {

    private final TransferFacade transferFacade;
    private final SchedulerProperties schedulerProperties;

    /**
     * 觸發時機：根據 scheduler.transfer-maintenance.redispatch-cron 配置
     */
    @Scheduled(cron = "${scheduler.transfer-maintenance.redispatch-cron}")
    @SchedulerLock(
        name = "redispatchStalePendingTransfers",
        lockAtMostFor = "${scheduler.transfer-maintenance.redispatch-lock-at-most-seconds}s",
        lockAtLeastFor = "${scheduler.transfer-maintenance.redispatch-lock-at-least-seconds}s"
    )
    public void redispatchStalePendingTransfers() {
        log.info("Starting scheduled job to redispatch stale PENDING transfers (lock acquired)");

        try {
            int processedCount = transferFacade.redispatchStalePendingTransfers(
                    schedulerProperties.getRedispatchDelaySeconds(),
                    schedulerProperties.getRedispatchBatchSize()
            );

            log.info("Scheduled job completed: redispatched {} PENDING transfers", processedCount);
        } catch (Exception e) {
            log.error("PENDING redispatch scheduled job failed: {}", e.getMessage(), e);
        }
    }

    /**
     * 觸發時機：根據 scheduler.transfer-maintenance.expiry-cron 配置
     */
    @Scheduled(cron = "${scheduler.transfer-maintenance.expiry-cron}")
    @SchedulerLock(
        name = "expireOverdueTransfers",
        lockAtMostFor = "${scheduler.transfer-maintenance.expiry-lock-at-most-seconds}s",
        lockAtLeastFor = "${scheduler.transfer-maintenance.expiry-lock-at-least-seconds}s"
    )
    public void expireOverdueTransfers() {
        log.info("Starting scheduled job to expire overdue transfers (lock acquired)");

        try {
            int expiredCount = transferFacade.expireOverdueTransfers(schedulerProperties.getExpiryBatchSize());

            log.info("Scheduled job completed: expired {} transfers", expiredCount);
        } catch (Exception e) {
            log.error("Transfer expiry scheduled job failed: {}", e.getMessage(), e);
        }
    }
}
