package com.example.transfersim.service;

import com.example.transfersim.entity.Settlement;
import com.example.transfersim.entity.SettlementErrorCode;
import com.example.transfersim.entity.SettlementStatus;
import com.example.transfersim.entity.SettlementType;
import com.example.transfersim.exception.SettlementNotFoundException;
import com.example.transfersim.repository.SettlementRepository;
import com.example.transfersim.service.command.CreateSettlementCommand;
import com.example.transfersim.service.impl.SettlementServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SettlementService 單元測試
 *
 * 測試策略：
 * 1. Mock SettlementRepository，驗證狀態推進的前置條件
 * 2. findSettlement 先查對外 ID，再退回數字主鍵
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("SettlementService Tests")
class SettlementServiceTest {

    @Mock
    private SettlementRepository settlementRepository;

    private SettlementServiceImpl settlementService;

    @BeforeEach
    void setUp() {
        settlementService = new SettlementServiceImpl(settlementRepository);
    }

    private Settlement settlement(SettlementStatus status) {
        return Settlement.builder()
            .id(7L)
            .settlementId("stl_0123456789abcdef01234567")
            .idempotencyKey("key-1")
            .contractId("game-7")
            .settlementType(SettlementType.WINNER_PAYOUT)
            .fromWalletId("w-escrow")
            .fromBankId("bsim-a")
            .toWalletId("w-winner")
            .toBankId("bsim-b")
            .amount(new BigDecimal("50.00"))
            .currency("CAD")
            .status(status)
            .build();
    }

    // ===== createSettlement =====

    @Test
    @DisplayName("createSettlement - With Command - Saves Pending Settlement With Public Id")
    void createSettlement_WithCommand_SavesPendingSettlement() {
        // Given
        CreateSettlementCommand command = CreateSettlementCommand.builder()
            .idempotencyKey("key-1")
            .contractId("game-7")
            .settlementType(SettlementType.WINNER_PAYOUT)
            .fromWalletId("w-escrow")
            .fromBankId("bsim-a")
            .toWalletId("w-winner")
            .toBankId("bsim-b")
            .amount(new BigDecimal("50.00"))
            .currency("CAD")
            .build();
        when(settlementRepository.saveAndFlush(any(Settlement.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        Settlement created = settlementService.createSettlement(command);

        // Then
        assertThat(created.getStatus()).isEqualTo(SettlementStatus.PENDING);
        assertThat(created.getSettlementId()).startsWith("stl_");
        assertThat(created.getIdempotencyKey()).isEqualTo("key-1");
        assertThat(created.getCreatedAt()).isNotNull();
    }

    // ===== 狀態推進 =====

    @Test
    @DisplayName("markProcessing - With Pending Settlement - Records Resolved Users")
    void markProcessing_WithPendingSettlement_RecordsUsers() {
        // Given
        when(settlementRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(settlement(SettlementStatus.PENDING)));
        when(settlementRepository.save(any(Settlement.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        Settlement processing = settlementService.markProcessing(7L, "user-a", "user-b");

        // Then
        assertThat(processing.getStatus()).isEqualTo(SettlementStatus.PROCESSING);
        assertThat(processing.getFromUserId()).isEqualTo("user-a");
        assertThat(processing.getToUserId()).isEqualTo("user-b");
    }

    @Test
    @DisplayName("completeSettlement - With Pending Settlement - Throws IllegalStateException")
    void completeSettlement_WithPendingSettlement_Throws() {
        // Given
        when(settlementRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(settlement(SettlementStatus.PENDING)));

        // When & Then
        assertThatThrownBy(() -> settlementService.completeSettlement(7L, "p2p_x"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("current status=PENDING");
        verify(settlementRepository, never()).save(any());
    }

    @Test
    @DisplayName("completeSettlement - With Unknown Id - Throws SettlementNotFoundException")
    void completeSettlement_WithUnknownId_Throws() {
        // Given
        when(settlementRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        // When & Then
        assertThatThrownBy(() -> settlementService.completeSettlement(99L, "p2p_x"))
            .isInstanceOf(SettlementNotFoundException.class);
    }

    @Test
    @DisplayName("failSettlement - With Long Message - Truncates To Column Length")
    void failSettlement_WithLongMessage_Truncates() {
        // Given
        when(settlementRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(settlement(SettlementStatus.PROCESSING)));
        when(settlementRepository.save(any(Settlement.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        Settlement failed = settlementService.failSettlement(7L, SettlementErrorCode.CREDIT_FAILED, "x".repeat(400), "p2p_x");

        // Then
        assertThat(failed.getStatus()).isEqualTo(SettlementStatus.FAILED);
        assertThat(failed.getErrorCode()).isEqualTo(SettlementErrorCode.CREDIT_FAILED);
        assertThat(failed.getStatusMessage()).hasSize(255);
        assertThat(failed.getTransferId()).isEqualTo("p2p_x");
    }

    // ===== findSettlement =====

    @Test
    @DisplayName("findSettlement - With Numeric Id - Falls Back To Primary Key")
    void findSettlement_WithNumericId_FallsBackToPrimaryKey() {
        // Given
        when(settlementRepository.findBySettlementId("7")).thenReturn(Optional.empty());
        when(settlementRepository.findById(7L)).thenReturn(Optional.of(settlement(SettlementStatus.COMPLETED)));

        // When
        Optional<Settlement> found = settlementService.findSettlement("7");

        // Then
        assertThat(found).isPresent();
        assertThat(found.get().getId()).isEqualTo(7L);
    }

    @Test
    @DisplayName("findSettlement - With Unknown Non-Numeric Id - Returns Empty")
    void findSettlement_WithUnknownNonNumericId_ReturnsEmpty() {
        // Given
        when(settlementRepository.findBySettlementId("stl_missing")).thenReturn(Optional.empty());

        // When
        Optional<Settlement> found = settlementService.findSettlement("stl_missing");

        // Then
        assertThat(found).isEmpty();
        verify(settlementRepository, never()).findById(any());
    }
}
