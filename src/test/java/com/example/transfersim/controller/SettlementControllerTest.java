package com.example.transfersim.controller;

import com.example.transfersim.exception.MissingIdempotencyKeyException;
import com.example.transfersim.exception.SettlementNotFoundException;
import com.example.transfersim.facade.SettlementFacade;
import com.example.transfersim.facade.dto.CreateSettlementRequest;
import com.example.transfersim.facade.dto.SettlementResultResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = {SettlementController.class})
@AutoConfigureMockMvc
@DisplayName("SettlementController Tests")
class SettlementControllerTest {

    private static final String VALID_BODY = "{"
        + "\"contract_id\":\"ctr_1\","
        + "\"settlement_type\":\"winner_payout\","
        + "\"from\":{\"wallet_id\":\"WLLT-loser\",\"bank_id\":\"bank-x\",\"escrow_id\":\"esc_1\"},"
        + "\"to\":{\"wallet_id\":\"WLLT-winner\",\"bank_id\":\"bank-y\"},"
        + "\"amount\":50.00,"
        + "\"currency\":\"CAD\","
        + "\"metadata\":{\"contract_title\":\"Game 7\"}"
        + "}";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SettlementFacade settlementFacade;

    // ===== POST /api/v1/settlements Tests =====

    @Test
    @DisplayName("createSettlement - With completed result - Returns 200 OK")
    void createSettlement_WithCompletedResult_Returns200() throws Exception {
        // Given
        when(settlementFacade.createSettlement(eq("key-1"), any(CreateSettlementRequest.class)))
            .thenReturn(result("completed"));

        // When & Then
        mockMvc.perform(post("/api/v1/settlements")
                .header("Idempotency-Key", "key-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(VALID_BODY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.settlement_id").value("stl_1"))
            .andExpect(jsonPath("$.transfer_id").value("p2p_s1"))
            .andExpect(jsonPath("$.status").value("completed"))
            .andExpect(jsonPath("$.amount").value("50.00"))
            .andExpect(jsonPath("$.from_wallet_id").value("WLLT-loser"))
            .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    @DisplayName("createSettlement - With failed result - Returns 422 with error code")
    void createSettlement_WithFailedResult_Returns422() throws Exception {
        // Given
        SettlementResultResponse failed = result("failed");
        failed.setError("CREDIT_FAILED");
        failed.setErrorMessage("Credit failed (escrow released, needs compensation)");
        when(settlementFacade.createSettlement(eq("key-1"), any(CreateSettlementRequest.class))).thenReturn(failed);

        // When & Then
        mockMvc.perform(post("/api/v1/settlements")
                .header("Idempotency-Key", "key-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(VALID_BODY))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.status").value("failed"))
            .andExpect(jsonPath("$.error").value("CREDIT_FAILED"))
            .andExpect(jsonPath("$.error_message").value("Credit failed (escrow released, needs compensation)"));
    }

    @Test
    @DisplayName("createSettlement - With replay of in-flight settlement - Returns 202 ACCEPTED")
    void createSettlement_WithInFlightReplay_Returns202() throws Exception {
        when(settlementFacade.createSettlement(eq("key-1"), any(CreateSettlementRequest.class)))
            .thenReturn(result("processing"));

        mockMvc.perform(post("/api/v1/settlements")
                .header("Idempotency-Key", "key-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(VALID_BODY))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("processing"));
    }

    @Test
    @DisplayName("createSettlement - Without Idempotency-Key - Returns 400 BAD_REQUEST")
    void createSettlement_WithoutIdempotencyKey_Returns400() throws Exception {
        when(settlementFacade.createSettlement(isNull(), any(CreateSettlementRequest.class)))
            .thenThrow(new MissingIdempotencyKeyException());

        mockMvc.perform(post("/api/v1/settlements")
                .contentType(MediaType.APPLICATION_JSON)
                .content(VALID_BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Bad Request"))
            .andExpect(jsonPath("$.message").value("Idempotency-Key header is required"));
    }

    @Test
    @DisplayName("createSettlement - Without destination - Returns 400 Validation Failed")
    void createSettlement_WithoutDestination_Returns400() throws Exception {
        String body = "{\"contract_id\":\"ctr_1\",\"settlement_type\":\"refund\","
            + "\"from\":{\"wallet_id\":\"WLLT-loser\",\"bank_id\":\"bank-x\"},\"amount\":50.00}";

        mockMvc.perform(post("/api/v1/settlements")
                .header("Idempotency-Key", "key-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.message").value(containsString("to cannot be null")));

        verifyNoInteractions(settlementFacade);
    }

    @Test
    @DisplayName("createSettlement - With unsupported settlement type - Returns 400 Malformed Request")
    void createSettlement_WithUnsupportedType_Returns400() throws Exception {
        String body = VALID_BODY.replace("winner_payout", "jackpot");

        mockMvc.perform(post("/api/v1/settlements")
                .header("Idempotency-Key", "key-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Malformed Request"));
    }

    // ===== GET /api/v1/settlements/{settlementId} Tests =====

    @Test
    @DisplayName("getSettlement - With unknown id - Returns 404 NOT_FOUND")
    void getSettlement_WithUnknownId_Returns404() throws Exception {
        when(settlementFacade.getSettlement("stl_x")).thenThrow(new SettlementNotFoundException("stl_x"));

        mockMvc.perform(get("/api/v1/settlements/stl_x"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Settlement Not Found"));
    }

    // ===== Helper Methods =====

    private SettlementResultResponse result(String status) {
        return SettlementResultResponse.builder()
            .settlementId("stl_1")
            .transferId("p2p_s1")
            .status(status)
            .amount("50.00")
            .fromWalletId("WLLT-loser")
            .toWalletId("WLLT-winner")
            .completedAt("completed".equals(status) ? LocalDateTime.now() : null)
            .build();
    }
}
