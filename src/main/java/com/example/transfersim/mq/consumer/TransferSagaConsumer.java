package com.example.transfersim.mq.consumer;

import com.example.transfersim.facade.TransferFacade;
import com.example.transfersim.mq.config.RocketMQProperties;
import com.example.transfersim.mq.msg.TransferSagaMsg;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.rocketmq.client.consumer.DefaultMQPushConsumer;
import org.apache.rocketmq.client.consumer.listener.ConsumeConcurrentlyStatus;
import org.apache.rocketmq.client.consumer.listener.MessageListenerConcurrently;
import org.apache.rocketmq.common.message.MessageExt;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

import static com.example.transfersim.mq.constants.MQConstants.*;

/**
 * 轉帳 saga 請求消費者
 *
 * 職責：
 * 1. 監聽 transfer-saga-requests topic
 * 2. 委派給 TransferFacade 執行 saga
 *
 * saga 內部的業務失敗會寫入轉帳狀態，不會拋出；
 * 只有基礎設施錯誤（例如資料庫）才會觸發重試
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TransferSagaConsumer {

    private final TransferFacade transferFacade;
    private final ObjectMapper objectMapper;
    private final RocketMQProperties rocketMQProperties;

    private DefaultMQPushConsumer consumer;

    /**
     * 啟動 Consumer
     */
    @PostConstruct
    public void start() throws Exception {
        RocketMQProperties.Consumer settings = rocketMQProperties.getConsumer();

        consumer = new DefaultMQPushConsumer(GROUP_TRANSFER_SAGA);
        consumer.setNamesrvAddr(rocketMQProperties.getNameServer());
        consumer.subscribe(TOPIC_TRANSFER_SAGA_REQUESTS, "*");
        consumer.setConsumeThreadMin(settings.getConsumeThreadMin());
        consumer.setConsumeThreadMax(settings.getConsumeThreadMax());
        consumer.setMaxReconsumeTimes(settings.getMaxReconsumeTimes());

        consumer.registerMessageListener((MessageListenerConcurrently) (msgs, context) -> {
            for (MessageExt msg : msgs) {
                try {
                    String json = new String(msg.getBody(), StandardCharsets.UTF_8);
                    TransferSagaMsg request = objectMapper.readValue(json, TransferSagaMsg.class);
                    transferFacade.handleSagaRequest(request);
                } catch (Exception e) {
                    log.error("Failed to process msgId={}, reconsumeTimes={}", msg.getMsgId(), msg.getReconsumeTimes(), e);
                    return ConsumeConcurrentlyStatus.RECONSUME_LATER;
                }
            }
            return ConsumeConcurrentlyStatus.CONSUME_SUCCESS;
        });

        consumer.start();
        log.info("TransferSagaConsumer started: group={}, topic={}", GROUP_TRANSFER_SAGA, TOPIC_TRANSFER_SAGA_REQUESTS);
    }

    @PreDestroy
    public void shutdown() {
        if (consumer != null) {
            consumer.shutdown();
        }
    }
}
