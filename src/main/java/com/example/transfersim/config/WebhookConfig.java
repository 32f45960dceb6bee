package com.example.transfersim.config;

import com.example.transfersim.webhook.WebhookProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Webhook 投遞執行緒池與重試（@EnableRetry）
 *
 * 投遞含重試等待，不能佔用 saga 或 HTTP 請求執行緒
 */
@Configuration
@EnableRetry
public class WebhookConfig {

    @Bean(name = "webhookExecutor")
    public ThreadPoolTaskExecutor webhookExecutor(WebhookProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCorePoolSize());
        executor.setMaxPoolSize(properties.getMaxPoolSize());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("webhook-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
