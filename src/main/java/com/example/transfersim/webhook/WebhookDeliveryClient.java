package com.example.transfersim.webhook;

import com.example.transfersim.exception.RetryableWebhookException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * 單一 webhook 的簽章傳送與重試
 *
 * 重試策略（webhook.retry.*，預設 6 次、1s 起每次加倍、上限 16s）：
 * - 2xx → 成功
 * - 429、5xx、連線錯誤 → 拋出 RetryableWebhookException 觸發重試
 * - 其他 4xx → 不重試
 * - 全部失敗 → @Recover 記錄 ERROR log（Dead-lettered）
 */
@Slf4j
@Component
public class WebhookDeliveryClient {

    private final RestClient restClient;

    public WebhookDeliveryClient(RestClient.Builder restClientBuilder) {
        this.restClient = restClientBuilder.clone().build();
    }

    /**
     * @return true 表示送達；false 表示接收端以 4xx 拒絕
     * @throws RetryableWebhookException 暫時性失敗
     */
    @Retryable(
        retryFor = RetryableWebhookException.class,
        maxAttemptsExpression = "#{@webhookProperties.retry.maxAttempts}",
        backoff = @Backoff(
            delayExpression = "#{@webhookProperties.retry.initialDelay.toMillis()}",
            multiplierExpression = "#{@webhookProperties.retry.multiplier}",
            maxDelayExpression = "#{@webhookProperties.retry.maxDelay.toMillis()}"
        )
    )
    public boolean deliver(String url, String secret, String body, String label) {
        HttpStatusCode status;
        try {
            status = restClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(WebhookSigner.SIGNATURE_HEADER, WebhookSigner.sign(body, secret))
                    .body(body)
                    .exchange((req, resp) -> resp.getStatusCode());
        } catch (RestClientException e) {
            log.warn("Webhook attempt failed: {}, error={}", label, e.getMessage());
            throw new RetryableWebhookException("Webhook transport error: " + e.getMessage(), e);
        }

        if (status.is2xxSuccessful()) {
            log.info("Webhook delivered: {}", label);
            return true;
        }

        if (status.is5xxServerError() || status.value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            log.warn("Webhook attempt failed: {}, status={}", label, status.value());
            throw new RetryableWebhookException("Webhook returned HTTP " + status.value());
        }

        log.error("Webhook rejected with client error, not retrying: {}, status={}", label, status.value());
        return false;
    }

    @Recover
    public boolean recover(RetryableWebhookException e, String url, String secret, String body, String label) {
        log.error("All webhook attempts failed: {}, lastError={}. Dead-lettered.", label, e.getMessage());
        return false;
    }
}
