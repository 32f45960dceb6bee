package com.example.transfersim.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Optional;

/**
 * WSIM 內部 API：GET /api/internal/profile?bsimUserId=&bsimId=
 *
 * 404 代表使用者沒有 profile，視為正常的 empty
 */
@Slf4j
@Component
public class WsimProfileClient implements ProfileClient {

    static final String API_KEY_HEADER = "X-Internal-Api-Key";

    private final ProfileProperties properties;
    private final RestClient restClient;

    public WsimProfileClient(ProfileProperties properties, RestClient.Builder restClientBuilder) {
        this.properties = properties;
        this.restClient = restClientBuilder.clone().build();
    }

    @Override
    public Optional<String> getProfileImage(String userId, String bankId) {
        if (!properties.isConfigured()) {
            log.warn("Profile service not configured, skipping profile lookup: userId={}", userId);
            return Optional.empty();
        }

        try {
            ProfileResponse response = restClient.get()
                    .uri(properties.getBaseUrl() + "/api/internal/profile?bsimUserId={userId}&bsimId={bankId}",
                            userId, bankId)
                    .header(API_KEY_HEADER, properties.getInternalApiKey())
                    .exchange((req, resp) -> {
                        if (resp.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                            log.debug("No profile found: userId={}, bankId={}", userId, bankId);
                            return null;
                        }
                        if (!resp.getStatusCode().is2xxSuccessful()) {
                            log.warn("Profile lookup failed: userId={}, status={}", userId, resp.getStatusCode().value());
                            return null;
                        }
                        return resp.bodyTo(ProfileResponse.class);
                    });

            return Optional.ofNullable(response)
                    .map(ProfileResponse::getProfile)
                    .map(Profile::getProfileImageUrl);
        } catch (RestClientException e) {
            log.warn("Profile lookup error: userId={}, bankId={}, error={}", userId, bankId, e.getMessage());
            return Optional.empty();
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ProfileResponse {
        private Boolean success;
        private Profile profile;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Profile {
        private String profileImageUrl;
    }
}
