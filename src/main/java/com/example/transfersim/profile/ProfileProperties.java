package com.example.transfersim.profile;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Wallet profile service settings.
 * Lookups are disabled when either value is blank.
 */
@Data
@Component
@ConfigurationProperties(prefix = "profile")
public class ProfileProperties {

    /**
     * Base URL of the wallet internal API, e.g. http://wsim:3003
     */
    private String baseUrl;

    /**
     * Sent as X-Internal-Api-Key.
     */
    private String internalApiKey;

    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isBlank()
            && internalApiKey != null && !internalApiKey.isBlank();
    }
}
