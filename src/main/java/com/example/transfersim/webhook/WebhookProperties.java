package com.example.transfersim.webhook;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Outbound webhook settings.
 *
 * An endpoint with a blank URL or secret is treated as disabled.
 */
@Data
@Component
@ConfigurationProperties(prefix = "webhook")
public class WebhookProperties {

    /**
     * Wallet push-notification endpoint (transfer.completed).
     */
    private Endpoint wallet = new Endpoint();

    /**
     * Contract service endpoint (settlement.completed / settlement.failed).
     */
    private Endpoint contract = new Endpoint();

    /**
     * Delivery retry, read by WebhookDeliveryClient's @Retryable.
     */
    private Retry retry = new Retry();

    /**
     * Delivery thread pool.
     */
    private int corePoolSize = 2;
    private int maxPoolSize = 8;
    private int queueCapacity = 500;

    @Data
    public static class Endpoint {
        private String url;
        private String secret;

        public boolean isConfigured() {
            return url != null && !url.isBlank() && secret != null && !secret.isBlank();
        }
    }

    /**
     * Exponential backoff: 1s, 2s, 4s, 8s, 16s between six attempts by default.
     */
    @Data
    public static class Retry {
        private int maxAttempts = 6;
        private Duration initialDelay = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(16);
    }
}
