package com.example.transfersim.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.RejectedExecutionException;

/**
 * Webhook 傳送入口：檢查端點設定、序列化後交給 webhookExecutor
 *
 * 簽章與重試由 WebhookDeliveryClient 負責
 */
@Slf4j
@Component
public class WebhookDispatcher {

    private final WebhookDeliveryClient deliveryClient;
    private final ObjectMapper objectMapper;
    private final TaskExecutor executor;

    public WebhookDispatcher(WebhookDeliveryClient deliveryClient,
                             ObjectMapper objectMapper,
                             @Qualifier("webhookExecutor") TaskExecutor executor) {
        this.deliveryClient = deliveryClient;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    /**
     * 非同步傳送（fire-and-forget）
     *
     * @param endpoint 目標端點
     * @param payload  事件內容
     * @param label    log 用的事件描述，例如 "transfer.completed transferId=p2p_x"
     */
    public void dispatch(WebhookProperties.Endpoint endpoint, Object payload, String label) {
        if (endpoint.getUrl() == null || endpoint.getUrl().isBlank()) {
            log.info("Webhook URL not configured, skipping: {}", label);
            return;
        }
        if (endpoint.getSecret() == null || endpoint.getSecret().isBlank()) {
            log.warn("Webhook secret not configured, skipping: {}", label);
            return;
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize webhook payload: {}", label, e);
            return;
        }

        try {
            executor.execute(() -> deliveryClient.deliver(endpoint.getUrl(), endpoint.getSecret(), body, label));
        } catch (RejectedExecutionException e) {
            log.error("Webhook executor rejected delivery, dead-lettered: {}", label, e);
        }
    }
}
