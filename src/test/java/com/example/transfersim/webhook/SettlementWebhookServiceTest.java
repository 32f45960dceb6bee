package com.example.transfersim.webhook;

import com.example.transfersim.entity.Settlement;
import com.example.transfersim.entity.SettlementErrorCode;
import com.example.transfersim.entity.SettlementStatus;
import com.example.transfersim.webhook.payload.SettlementWebhookPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

/**
 * SettlementWebhookService 測試
 *
 * 測試策略：completed 不帶錯誤欄位，failed 帶錯誤碼或預設值
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("SettlementWebhookService Tests")
class SettlementWebhookServiceTest {

    @Mock
    private WebhookDispatcher dispatcher;

    private WebhookProperties properties;
    private SettlementWebhookService service;

    @BeforeEach
    void setUp() {
        properties = new WebhookProperties();
        service = new SettlementWebhookService(dispatcher, properties);
    }

    private Settlement settlement(SettlementStatus status) {
        return Settlement.builder()
            .id(7L)
            .settlementId("stl_0123456789abcdef01234567")
            .contractId("game-7")
            .fromWalletId("w-escrow")
            .toWalletId("w-winner")
            .amount(new BigDecimal("100.00"))
            .transferId("p2p_0123456789abcdef01234567")
            .status(status)
            .build();
    }

    @Test
    @DisplayName("buildPayload - With Completed Settlement - Omits Error Fields")
    void buildPayload_WithCompletedSettlement_OmitsErrorFields() {
        // When
        SettlementWebhookPayload payload = service.buildPayload(settlement(SettlementStatus.COMPLETED));

        // Then
        assertThat(payload.getEventType()).isEqualTo("settlement.completed");
        assertThat(payload.getEventId()).startsWith("evt_");
        assertThat(payload.getData().getStatus()).isEqualTo("completed");
        assertThat(payload.getData().getAmount()).isEqualTo("100.00");
        assertThat(payload.getData().getError()).isNull();
        assertThat(payload.getData().getErrorMessage()).isNull();
    }

    @Test
    @DisplayName("buildPayload - With Failed Settlement - Includes Error Code And Message")
    void buildPayload_WithFailedSettlement_IncludesError() {
        // Given
        Settlement failed = settlement(SettlementStatus.FAILED);
        failed.setErrorCode(SettlementErrorCode.ESCROW_RELEASE_FAILED);
        failed.setStatusMessage("Escrow release failed");

        // When
        SettlementWebhookPayload payload = service.buildPayload(failed);

        // Then
        assertThat(payload.getEventType()).isEqualTo("settlement.failed");
        assertThat(payload.getData().getStatus()).isEqualTo("failed");
        assertThat(payload.getData().getError()).isEqualTo("ESCROW_RELEASE_FAILED");
        assertThat(payload.getData().getErrorMessage()).isEqualTo("Escrow release failed");
    }

    @Test
    @DisplayName("buildPayload - With Failed Settlement Without Details - Uses Defaults")
    void buildPayload_WithFailedWithoutDetails_UsesDefaults() {
        // When
        SettlementWebhookPayload payload = service.buildPayload(settlement(SettlementStatus.FAILED));

        // Then
        assertThat(payload.getData().getError()).isEqualTo("UNKNOWN_ERROR");
        assertThat(payload.getData().getErrorMessage()).isEqualTo("Settlement failed");
    }

    @Test
    @DisplayName("notifySettlementFinished - With Settlement - Dispatches To Contract Endpoint")
    void notifySettlementFinished_WithSettlement_DispatchesToContract() {
        // Given
        ArgumentCaptor<Object> payloadCaptor = ArgumentCaptor.forClass(Object.class);

        // When
        service.notifySettlementFinished(settlement(SettlementStatus.COMPLETED));

        // Then
        verify(dispatcher).dispatch(eq(properties.getContract()), payloadCaptor.capture(), anyString());
        assertThat(payloadCaptor.getValue()).isInstanceOf(SettlementWebhookPayload.class);
    }
}
