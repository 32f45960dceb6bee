package com.example.transfersim.bank;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * BsimBankConnector 測試
 *
 * 使用 MockRestServiceServer 模擬 BSIM 回應，驗證請求格式與結果對應
 */
@DisplayName("BsimBankConnector Tests")
class BsimBankConnectorTest {

    private static final String BASE_URL = "http://bsim.test";

    private MockRestServiceServer server;
    private BsimBankConnector connector;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();

        BankConnectionInfo info = BankConnectionInfo.builder()
            .bankId("bank-x")
            .name("Bank X")
            .baseUrl(BASE_URL + "/")
            .apiKey("key-123")
            .build();
        connector = new BsimBankConnector(info, builder);
    }

    // ===== debit / credit =====

    @Test
    @DisplayName("debit - With 200 response - Returns success with transaction id")
    void debit_With200Response_ReturnsSuccess() {
        // Given
        server.expect(requestTo(BASE_URL + "/api/p2p/transfer/debit"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("X-API-Key", "key-123"))
            .andExpect(jsonPath("$.userId").value("alice"))
            .andExpect(jsonPath("$.accountId").value("acct-a"))
            .andExpect(jsonPath("$.amount").value(25.00))
            .andExpect(jsonPath("$.transferId").value("17"))
            .andExpect(jsonPath("$.description").value("P2P Transfer"))
            .andRespond(withSuccess("{\"transactionId\":\"dbt_1\"}", MediaType.APPLICATION_JSON));

        // When
        BankOperationResult result = connector.debit("alice", "acct-a", new BigDecimal("25.00"), "CAD", "17", null);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTransactionId()).isEqualTo("dbt_1");
        server.verify();
    }

    @Test
    @DisplayName("debit - With 400 insufficient funds - Returns failure with bank error")
    void debit_With400InsufficientFunds_ReturnsFailure() {
        server.expect(requestTo(BASE_URL + "/api/p2p/transfer/debit"))
            .andRespond(withBadRequest()
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":\"INSUFFICIENT_FUNDS\",\"message\":\"Insufficient funds\"}"));

        BankOperationResult result = connector.debit("alice", "acct-a", new BigDecimal("25.00"), "CAD", "17", "Rent");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("INSUFFICIENT_FUNDS");
        assertThat(result.getMessage()).isEqualTo("Insufficient funds");
    }

    @Test
    @DisplayName("credit - With success but no transaction id - Falls back to reference")
    void credit_WithSuccessButNoTransactionId_FallsBackToReference() {
        server.expect(requestTo(BASE_URL + "/api/p2p/transfer/credit"))
            .andExpect(jsonPath("$.accountId").doesNotExist())
            .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        BankOperationResult result = connector.credit("bob", null, new BigDecimal("25.00"), "CAD", "17", "Rent");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTransactionId()).isEqualTo("17");
    }

    @Test
    @DisplayName("credit - With 500 and empty body - Returns default error and HTTP status message")
    void credit_With500EmptyBody_ReturnsDefaultError() {
        server.expect(requestTo(BASE_URL + "/api/p2p/transfer/credit"))
            .andRespond(withServerError());

        BankOperationResult result = connector.credit("bob", null, new BigDecimal("25.00"), "CAD", "17", "Rent");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Credit failed");
        assertThat(result.getMessage()).isEqualTo("HTTP 500");
    }

    @Test
    @DisplayName("credit - With connection error - Returns Connection failed")
    void credit_WithConnectionError_ReturnsConnectionFailed() {
        server.expect(requestTo(BASE_URL + "/api/p2p/transfer/credit"))
            .andRespond(withException(new IOException("Connection refused")));

        BankOperationResult result = connector.credit("bob", null, new BigDecimal("25.00"), "CAD", "17", "Rent");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Connection failed");
    }

    // ===== escrow release =====

    @Test
    @DisplayName("escrowRelease - With snake_case transaction id - Returns success")
    void escrowRelease_WithSnakeCaseTransactionId_ReturnsSuccess() {
        server.expect(requestTo(BASE_URL + "/api/escrow/esc_1/release"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.contract_id").value("ctr_1"))
            .andExpect(jsonPath("$.transfer_reference").value("7"))
            .andExpect(jsonPath("$.reason").value("Contract Settlement: Game 7"))
            .andRespond(withSuccess("{\"transaction_id\":\"esc_tx_1\"}", MediaType.APPLICATION_JSON));

        BankOperationResult result = connector.escrowRelease("esc_1", "ctr_1", "7", "Contract Settlement: Game 7");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTransactionId()).isEqualTo("esc_tx_1");
        server.verify();
    }

    // ===== verify user =====

    @Test
    @DisplayName("verifyUser - With existing user - Returns display name")
    void verifyUser_WithExistingUser_ReturnsDisplayName() {
        server.expect(requestTo(BASE_URL + "/api/p2p/user/verify"))
            .andExpect(jsonPath("$.userId").value("alice"))
            .andRespond(withSuccess("{\"exists\":true,\"displayName\":\"Alice A\"}", MediaType.APPLICATION_JSON));

        UserVerification verification = connector.verifyUser("alice");

        assertThat(verification.isExists()).isTrue();
        assertThat(verification.getDisplayName()).isEqualTo("Alice A");
    }

    @Test
    @DisplayName("verifyUser - With 404 - Returns not found")
    void verifyUser_With404_ReturnsNotFound() {
        server.expect(requestTo(BASE_URL + "/api/p2p/user/verify"))
            .andRespond(withStatus(HttpStatus.NOT_FOUND)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":\"USER_NOT_FOUND\"}"));

        UserVerification verification = connector.verifyUser("ghost");

        assertThat(verification.isExists()).isFalse();
        assertThat(verification.getError()).isEqualTo("USER_NOT_FOUND");
    }
}
