package com.example.transfersim.bank;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.util.Map;

/**
 * BSIM（銀行模擬器）HTTP connector
 *
 * 端點：
 * - POST /api/p2p/transfer/debit
 * - POST /api/p2p/transfer/credit
 * - POST /api/p2p/user/verify
 * - POST /api/escrow/{escrowId}/release
 *
 * 認證：X-API-Key header
 */
@Slf4j
public class BsimBankConnector implements BankConnector {

    static final String API_KEY_HEADER = "X-API-Key";
    static final String CONNECTION_FAILED = "Connection failed";

    private final String bankId;
    private final RestClient restClient;

    public BsimBankConnector(BankConnectionInfo connection, RestClient.Builder restClientBuilder) {
        this.bankId = connection.getBankId();
        this.restClient = restClientBuilder
                .baseUrl(stripTrailingSlash(connection.getBaseUrl()))
                .defaultHeader(API_KEY_HEADER, connection.getApiKey())
                .build();
    }

    @Override
    public BankOperationResult debit(String userId, String accountId, BigDecimal amount, String currency,
                                     String referenceId, String description) {
        TransferLegRequest request = TransferLegRequest.builder()
                .userId(userId)
                .accountId(accountId)
                .amount(amount)
                .currency(currency)
                .transferId(referenceId)
                .description(description != null ? description : "P2P Transfer")
                .build();
        return postTransaction("/api/p2p/transfer/debit", request, referenceId, "Debit failed");
    }

    @Override
    public BankOperationResult credit(String userId, String accountId, BigDecimal amount, String currency,
                                      String referenceId, String description) {
        TransferLegRequest request = TransferLegRequest.builder()
                .userId(userId)
                .accountId(accountId)
                .amount(amount)
                .currency(currency)
                .transferId(referenceId)
                .description(description != null ? description : "P2P Transfer")
                .build();
        return postTransaction("/api/p2p/transfer/credit", request, referenceId, "Credit failed");
    }

    @Override
    public BankOperationResult escrowRelease(String escrowId, String contractId, String referenceId, String reason) {
        EscrowReleaseRequest request = EscrowReleaseRequest.builder()
                .contractId(contractId)
                .reason(reason != null ? reason : "Contract Settlement")
                .transferReference(referenceId)
                .build();

        log.info("Releasing escrow: bankId={}, escrowId={}, contractId={}", bankId, escrowId, contractId);
        try {
            return restClient.post()
                    .uri("/api/escrow/{escrowId}/release", escrowId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .exchange((req, resp) -> toResult(resp.getStatusCode(),
                            resp.bodyTo(TransactionResponse.class), referenceId, "Escrow release failed"));
        } catch (RestClientException e) {
            log.error("Escrow release request failed: bankId={}, escrowId={}", bankId, escrowId, e);
            return BankOperationResult.failure(CONNECTION_FAILED, e.getMessage());
        }
    }

    @Override
    public UserVerification verifyUser(String userId) {
        try {
            return restClient.post()
                    .uri("/api/p2p/user/verify")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("userId", userId))
                    .exchange((req, resp) -> {
                        VerifyUserResponse body = resp.bodyTo(VerifyUserResponse.class);
                        if (!resp.getStatusCode().is2xxSuccessful()) {
                            String error = body != null && body.getError() != null ? body.getError()
                                    : body != null && body.getMessage() != null ? body.getMessage()
                                    : "HTTP " + resp.getStatusCode().value();
                            return UserVerification.notFound(error);
                        }
                        return UserVerification.builder()
                                .exists(body == null || body.getExists() == null || body.getExists())
                                .displayName(body != null ? body.getDisplayName() : null)
                                .build();
                    });
        } catch (RestClientException e) {
            log.error("Verify user request failed: bankId={}, userId={}", bankId, userId, e);
            return UserVerification.notFound(e.getMessage());
        }
    }

    private BankOperationResult postTransaction(String path, TransferLegRequest request, String referenceId,
                                                String defaultError) {
        try {
            return restClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .exchange((req, resp) -> toResult(resp.getStatusCode(),
                            resp.bodyTo(TransactionResponse.class), referenceId, defaultError));
        } catch (RestClientException e) {
            log.error("Bank request failed: bankId={}, path={}, reference={}", bankId, path, referenceId, e);
            return BankOperationResult.failure(CONNECTION_FAILED, e.getMessage());
        }
    }

    private BankOperationResult toResult(HttpStatusCode status, TransactionResponse body, String referenceId,
                                         String defaultError) {
        if (!status.is2xxSuccessful()) {
            String error = body != null && body.getError() != null ? body.getError() : defaultError;
            String message = body != null && body.getMessage() != null ? body.getMessage() : "HTTP " + status.value();
            log.warn("Bank rejected request: bankId={}, reference={}, status={}, error={}",
                    bankId, referenceId, status.value(), error);
            return BankOperationResult.failure(error, message);
        }

        String transactionId = body != null ? body.resolveTransactionId() : null;
        if (transactionId == null) {
            // 部分 BSIM 版本成功時不回傳交易 ID，以 reference 代替
            log.warn("Bank response missing transaction id, using reference: bankId={}, reference={}",
                    bankId, referenceId);
            transactionId = referenceId;
        }
        return BankOperationResult.success(transactionId);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class TransferLegRequest {
        private String userId;
        private String accountId;
        private BigDecimal amount;
        private String currency;
        private String transferId;
        private String description;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class EscrowReleaseRequest {
        @JsonProperty("contract_id")
        private String contractId;
        private String reason;
        @JsonProperty("transfer_reference")
        private String transferReference;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TransactionResponse {
        private String transactionId;
        @JsonProperty("transaction_id")
        private String transactionIdSnake;
        private String error;
        private String message;

        String resolveTransactionId() {
            return transactionId != null ? transactionId : transactionIdSnake;
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class VerifyUserResponse {
        private Boolean exists;
        private String userId;
        private String displayName;
        private String error;
        private String message;
    }
}
