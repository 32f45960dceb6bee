package com.example.transfersim.mq.producer;

import com.example.transfersim.mq.msg.TransferSagaMsg;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.rocketmq.client.producer.DefaultMQProducer;
import org.apache.rocketmq.client.producer.SendResult;
import org.apache.rocketmq.common.message.Message;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

import static com.example.transfersim.mq.constants.MQConstants.*;

/**
 * 轉帳 saga 請求 Producer
 *
 * 錯誤處理：
 * - 使用同步發送（fail-fast 策略）
 * - 發送失敗時拋出異常，由呼叫端決定如何處理（轉帳仍為 PENDING，維護排程會重送）
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TransferSagaProducer {

    private final DefaultMQProducer producer;
    private final ObjectMapper objectMapper;

    /**
     * 發送 saga 請求
     *
     * @param id 轉帳內部 ID
     * @param transferId 對外轉帳 ID
     */
    public void sendSagaRequest(Long id, String transferId) {
        TransferSagaMsg msg = TransferSagaMsg.builder()
                .id(id)
                .transferId(transferId)
                .timestamp(System.currentTimeMillis())
                .build();

        try {
            String json = objectMapper.writeValueAsString(msg);
            Message message = new Message(TOPIC_TRANSFER_SAGA_REQUESTS, null, transferId,
                    json.getBytes(StandardCharsets.UTF_8));
            message.putUserProperty(SHARDING_KEY_PROPERTY, transferId);
            SendResult result = producer.send(message, (mqs, m, arg) -> {
                String key = (String) arg;
                int index = Math.floorMod(key.hashCode(), mqs.size());
                return mqs.get(index);
            }, transferId);

            log.info("Sent transfer saga request: id={}, transferId={}, msgId={}", id, transferId, result.getMsgId());
        } catch (Exception e) {
            log.error("Failed to send MQ message: topic={}, transferId={}", TOPIC_TRANSFER_SAGA_REQUESTS, transferId, e);
            throw new RuntimeException("Failed to send MQ message", e);
        }
    }
}
