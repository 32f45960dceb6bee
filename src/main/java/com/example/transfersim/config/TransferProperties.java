package com.example.transfersim.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "transfer")
public class TransferProperties {

    /**
     * Upper bound for a single transfer amount (inclusive).
     */
    private BigDecimal perTransferLimit = new BigDecimal("10000");

    /**
     * Currency used when the request does not specify one.
     */
    private String defaultCurrency = "CAD";

    /**
     * How long a transfer may stay before money movement starts.
     */
    private Duration pendingExpiry = Duration.ofHours(24);
}
