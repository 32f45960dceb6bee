package com.example.transfersim.service;

import com.example.transfersim.alias.ResolvedAlias;
import com.example.transfersim.config.TransferProperties;
import com.example.transfersim.entity.AliasType;
import com.example.transfersim.entity.RecipientType;
import com.example.transfersim.entity.Transfer;
import com.example.transfersim.entity.TransferStatus;
import com.example.transfersim.entity.TransferType;
import com.example.transfersim.event.TransferStatusChangedEvent;
import com.example.transfersim.exception.InvalidTransferStateException;
import com.example.transfersim.exception.TransferNotFoundException;
import com.example.transfersim.merchant.MerchantInfo;
import com.example.transfersim.repository.TransferRepository;
import com.example.transfersim.service.command.CreateTransferCommand;
import com.example.transfersim.service.command.SettlementTransferCommand;
import com.example.transfersim.service.impl.TransferServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * TransferServiceImpl 單元測試
 *
 * 測試策略：
 * 1. Mockito mock TransferRepository 與 ApplicationEventPublisher
 * 2. save() 直接回傳傳入的實體
 * 3. 專注於狀態轉換、欄位更新與事件發布
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("TransferService Unit Tests")
class TransferServiceTest {

    @Mock
    private TransferRepository transferRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private TransferServiceImpl transferService;

    @BeforeEach
    void setUp() {
        TransferProperties properties = new TransferProperties();
        properties.setPendingExpiry(Duration.ofHours(24));
        transferService = new TransferServiceImpl(transferRepository, eventPublisher, properties);
    }

    // ===== createPendingTransfer =====

    @Test
    @DisplayName("createPendingTransfer - With valid command - Persists PENDING with 24h expiry and publishes event")
    void createPendingTransfer_WithValidCommand_PersistsPendingAndPublishesEvent() {
        // Given
        when(transferRepository.save(any(Transfer.class))).thenAnswer(invocation -> {
            Transfer t = invocation.getArgument(0);
            t.setId(1L);
            return t;
        });

        // When
        Transfer result = transferService.createPendingTransfer(CreateTransferCommand.builder()
            .senderUserId("user-a")
            .senderBankId("bank-x")
            .senderAccountId("acct-1")
            .recipientAlias("@bob")
            .recipientAliasType(AliasType.USERNAME)
            .amount(new BigDecimal("25.00"))
            .currency("CAD")
            .build());

        // Then
        assertThat(result.getStatus()).isEqualTo(TransferStatus.PENDING);
        assertThat(result.getTransferId()).startsWith("p2p_");
        assertThat(result.getTransferType()).isEqualTo(TransferType.P2P);
        assertThat(result.getRecipientType()).isEqualTo(RecipientType.INDIVIDUAL);
        assertThat(result.getExpiresAt()).isEqualTo(result.getCreatedAt().plusHours(24));
        assertThat(result.getRecipientUserId()).isNull();

        ArgumentCaptor<TransferStatusChangedEvent> captor = ArgumentCaptor.forClass(TransferStatusChangedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().isNewPendingTransfer()).isTrue();
    }

    @Test
    @DisplayName("createSettlementTransfer - With known recipient - Starts in DEBITING without saga dispatch")
    void createSettlementTransfer_WithKnownRecipient_StartsInDebiting() {
        // Given
        when(transferRepository.save(any(Transfer.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        Transfer result = transferService.createSettlementTransfer(SettlementTransferCommand.builder()
            .senderUserId("loser")
            .senderBankId("bank-x")
            .recipientUserId("winner")
            .recipientBankId("bank-y")
            .amount(new BigDecimal("50.00"))
            .currency("CAD")
            .description("Contract Settlement")
            .contractId("ctr_1")
            .settlementId("stl_1")
            .build());

        // Then
        assertThat(result.getStatus()).isEqualTo(TransferStatus.DEBITING);
        assertThat(result.getTransferType()).isEqualTo(TransferType.CONTRACT_SETTLEMENT);
        assertThat(result.getSenderAccountId()).isEqualTo("default");
        assertThat(result.getRecipientAlias()).isEqualTo("winner");
        assertThat(result.getRecipientAliasType()).isEqualTo(AliasType.USERNAME);
        assertThat(result.getSettlementId()).isEqualTo("stl_1");

        ArgumentCaptor<TransferStatusChangedEvent> captor = ArgumentCaptor.forClass(TransferStatusChangedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().isNewPendingTransfer()).isFalse();
    }

    // ===== claimForResolution =====

    @Test
    @DisplayName("claimForResolution - With PENDING transfer - Moves to RESOLVING")
    void claimForResolution_WithPendingTransfer_MovesToResolving() {
        // Given
        Transfer transfer = createTransfer(1L, TransferStatus.PENDING);
        when(transferRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(transfer));
        when(transferRepository.save(any(Transfer.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        Optional<Transfer> result = transferService.claimForResolution(1L);

        // Then
        assertThat(result).isPresent();
        assertThat(result.get().getStatus()).isEqualTo(TransferStatus.RESOLVING);
        verify(eventPublisher).publishEvent(any(TransferStatusChangedEvent.class));
    }

    @Test
    @DisplayName("claimForResolution - With transfer already claimed - Returns empty without saving")
    void claimForResolution_WithTransferAlreadyClaimed_ReturnsEmpty() {
        // Given
        Transfer transfer = createTransfer(1L, TransferStatus.DEBITING);
        when(transferRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(transfer));

        // When
        Optional<Transfer> result = transferService.claimForResolution(1L);

        // Then
        assertThat(result).isEmpty();
        verify(transferRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("claimForResolution - With unknown id - Throws TransferNotFoundException")
    void claimForResolution_WithUnknownId_Throws() {
        when(transferRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> transferService.claimForResolution(99L))
            .isInstanceOf(TransferNotFoundException.class);
    }

    // ===== markResolved / markSelfTransfer =====

    @Test
    @DisplayName("markResolved - With merchant recipient - Classifies as merchant payment with fee")
    void markResolved_WithMerchantRecipient_ClassifiesAsMerchantPayment() {
        // Given
        Transfer transfer = createTransfer(1L, TransferStatus.RESOLVING);
        transfer.setAmount(new BigDecimal("250.00"));
        when(transferRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(transfer));
        when(transferRepository.save(any(Transfer.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ResolvedAlias recipient = ResolvedAlias.builder().userId("shop").bankId("bank-y").accountId("acct-9").build();
        MerchantInfo merchant = MerchantInfo.builder().merchantId("mm_1").merchantName("Corner Cafe").build();

        // When
        Transfer result = transferService.markResolved(1L, recipient, merchant);

        // Then
        assertThat(result.getStatus()).isEqualTo(TransferStatus.DEBITING);
        assertThat(result.getRecipientUserId()).isEqualTo("shop");
        assertThat(result.getRecipientBankId()).isEqualTo("bank-y");
        assertThat(result.getRecipientAccountId()).isEqualTo("acct-9");
        assertThat(result.getRecipientType()).isEqualTo(RecipientType.MICRO_MERCHANT);
        assertThat(result.getTransferType()).isEqualTo(TransferType.MERCHANT);
        assertThat(result.getMerchantId()).isEqualTo("mm_1");
        assertThat(result.getFeeAmount()).isEqualByComparingTo("0.50");
        assertThat(result.getAmount()).isEqualByComparingTo("250.00");
    }

    @Test
    @DisplayName("markSelfTransfer - With own alias - DEBIT_FAILED with recipient recorded")
    void markSelfTransfer_WithOwnAlias_DebitFailedWithRecipientRecorded() {
        // Given
        Transfer transfer = createTransfer(1L, TransferStatus.RESOLVING);
        when(transferRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(transfer));
        when(transferRepository.save(any(Transfer.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ResolvedAlias self = ResolvedAlias.builder().userId("user-a").bankId("bank-x").accountId("acct-1").build();

        // When
        Transfer result = transferService.markSelfTransfer(1L, self);

        // Then
        assertThat(result.getStatus()).isEqualTo(TransferStatus.DEBIT_FAILED);
        assertThat(result.getStatusMessage()).isEqualTo("Cannot transfer to yourself");
        assertThat(result.getRecipientUserId()).isEqualTo("user-a");
    }

    @Test
    @DisplayName("markResolved - With cancelled transfer - Throws InvalidTransferStateException")
    void markResolved_WithCancelledTransfer_Throws() {
        // Given
        Transfer transfer = createTransfer(1L, TransferStatus.CANCELLED);
        when(transferRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(transfer));
        when(transferRepository.findById(1L)).thenReturn(Optional.of(transfer));

        ResolvedAlias recipient = ResolvedAlias.builder().userId("bob").bankId("bank-x").build();

        // When & Then
        assertThatThrownBy(() -> transferService.markResolved(1L, recipient, null))
            .isInstanceOf(InvalidTransferStateException.class)
            .hasMessageContaining("CANCELLED");
        verify(transferRepository, never()).save(any());
    }

    // ===== money movement =====

    @Test
    @DisplayName("markCrediting - With DEBITING transfer - Stores debit transaction id")
    void markCrediting_WithDebitingTransfer_StoresDebitTransactionId() {
        Transfer transfer = createTransfer(1L, TransferStatus.DEBITING);
        when(transferRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(transfer));
        when(transferRepository.save(any(Transfer.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Transfer result = transferService.markCrediting(1L, "dbt_1");

        assertThat(result.getStatus()).isEqualTo(TransferStatus.CREDITING);
        assertThat(result.getDebitTransactionId()).isEqualTo("dbt_1");
        assertThat(result.getCreditTransactionId()).isNull();
    }

    @Test
    @DisplayName("completeTransfer - With CREDITING transfer - Sets credit id and completedAt")
    void completeTransfer_WithCreditingTransfer_SetsCreditIdAndCompletedAt() {
        Transfer transfer = createTransfer(1L, TransferStatus.CREDITING);
        transfer.setDebitTransactionId("dbt_1");
        when(transferRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(transfer));
        when(transferRepository.save(any(Transfer.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Transfer result = transferService.completeTransfer(1L, "crd_1", "Transfer completed successfully");

        assertThat(result.getStatus()).isEqualTo(TransferStatus.COMPLETED);
        assertThat(result.getDebitTransactionId()).isEqualTo("dbt_1");
        assertThat(result.getCreditTransactionId()).isEqualTo("crd_1");
        assertThat(result.getCompletedAt()).isNotNull();
    }

    @Test
    @DisplayName("completeTransfer - Without debit transaction id - Throws")
    void completeTransfer_WithoutDebitTransactionId_Throws() {
        Transfer transfer = createTransfer(1L, TransferStatus.CREDITING);
        when(transferRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(transfer));

        assertThatThrownBy(() -> transferService.completeTransfer(1L, "crd_1", "done"))
            .isInstanceOf(InvalidTransferStateException.class);
        verify(transferRepository, never()).save(any());
    }

    @Test
    @DisplayName("markCreditFailed - With overly long message - Truncates and keeps debit transaction id")
    void markCreditFailed_WithLongMessage_Truncates() {
        Transfer transfer = createTransfer(1L, TransferStatus.CREDITING);
        transfer.setDebitTransactionId("dbt_1");
        when(transferRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(transfer));
        when(transferRepository.save(any(Transfer.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Transfer result = transferService.markCreditFailed(1L, "x".repeat(400));

        assertThat(result.getStatus()).isEqualTo(TransferStatus.CREDIT_FAILED);
        assertThat(result.getStatusMessage()).hasSize(255);
        assertThat(result.getDebitTransactionId()).isEqualTo("dbt_1");
        assertThat(result.getCreditTransactionId()).isNull();
    }

    // ===== cancelTransfer =====

    @Test
    @DisplayName("cancelTransfer - By sender while PENDING - Cancelled by sender")
    void cancelTransfer_BySenderWhilePending_Cancelled() {
        // Given
        Transfer transfer = createTransfer(1L, TransferStatus.PENDING);
        when(transferRepository.findByTransferId("p2p_abc")).thenReturn(Optional.of(transfer));
        when(transferRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(transfer));
        when(transferRepository.save(any(Transfer.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        Transfer result = transferService.cancelTransfer("p2p_abc", "user-a", "bank-x");

        // Then
        assertThat(result.getStatus()).isEqualTo(TransferStatus.CANCELLED);
        assertThat(result.getStatusMessage()).isEqualTo("Cancelled by sender");
    }

    @Test
    @DisplayName("cancelTransfer - By someone other than the sender - Not found")
    void cancelTransfer_ByNonSender_NotFound() {
        Transfer transfer = createTransfer(1L, TransferStatus.PENDING);
        when(transferRepository.findByTransferId("p2p_abc")).thenReturn(Optional.of(transfer));

        assertThatThrownBy(() -> transferService.cancelTransfer("p2p_abc", "user-b", "bank-x"))
            .isInstanceOf(TransferNotFoundException.class);
        verify(transferRepository, never()).findByIdForUpdate(any());
    }

    @Test
    @DisplayName("cancelTransfer - After debit started - Throws with current status")
    void cancelTransfer_AfterDebitStarted_Throws() {
        Transfer transfer = createTransfer(1L, TransferStatus.DEBITING);
        when(transferRepository.findByTransferId("p2p_abc")).thenReturn(Optional.of(transfer));

        assertThatThrownBy(() -> transferService.cancelTransfer("p2p_abc", "user-a", "bank-x"))
            .isInstanceOf(InvalidTransferStateException.class)
            .hasMessage("Cannot cancel transfer in DEBITING status");
        verify(transferRepository, never()).findByIdForUpdate(any());
    }

    @Test
    @DisplayName("cancelTransfer - When saga starts debit before lock - Throws with locked status")
    void cancelTransfer_WhenDebitStartsBeforeLock_Throws() {
        // Given
        Transfer snapshot = createTransfer(1L, TransferStatus.RESOLVING);
        Transfer locked = createTransfer(1L, TransferStatus.DEBITING);
        when(transferRepository.findByTransferId("p2p_abc")).thenReturn(Optional.of(snapshot));
        when(transferRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(locked));
        when(transferRepository.findById(1L)).thenReturn(Optional.of(locked));

        // When & Then
        assertThatThrownBy(() -> transferService.cancelTransfer("p2p_abc", "user-a", "bank-x"))
            .isInstanceOf(InvalidTransferStateException.class)
            .hasMessage("Cannot cancel transfer in DEBITING status");
        verify(transferRepository, never()).save(any());
    }

    // ===== expireTransfer =====

    @Test
    @DisplayName("expireTransfer - With RESOLVING transfer - Returns true")
    void expireTransfer_WithResolvingTransfer_ReturnsTrue() {
        Transfer transfer = createTransfer(1L, TransferStatus.RESOLVING);
        when(transferRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(transfer));
        when(transferRepository.save(any(Transfer.class))).thenAnswer(invocation -> invocation.getArgument(0));

        assertThat(transferService.expireTransfer(1L)).isTrue();
        assertThat(transfer.getStatus()).isEqualTo(TransferStatus.EXPIRED);
        assertThat(transfer.getStatusMessage()).isEqualTo("Transfer expired before completion");
    }

    @Test
    @DisplayName("expireTransfer - With transfer that moved on to DEBITING - Returns false")
    void expireTransfer_WithDebitingTransfer_ReturnsFalse() {
        Transfer transfer = createTransfer(1L, TransferStatus.DEBITING);
        when(transferRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(transfer));

        assertThat(transferService.expireTransfer(1L)).isFalse();
        assertThat(transfer.getStatus()).isEqualTo(TransferStatus.DEBITING);
    }

    // ===== findVisibleTransfer =====

    @Test
    @DisplayName("findVisibleTransfer - For recipient and stranger - Visible only to participants")
    void findVisibleTransfer_ForRecipientAndStranger_VisibleOnlyToParticipants() {
        Transfer transfer = createTransfer(1L, TransferStatus.COMPLETED);
        transfer.setRecipientUserId("user-b");
        transfer.setRecipientBankId("bank-y");
        when(transferRepository.findByTransferId("p2p_abc")).thenReturn(Optional.of(transfer));

        assertThat(transferService.findVisibleTransfer("p2p_abc", "user-b", "bank-y")).isPresent();
        assertThat(transferService.findVisibleTransfer("p2p_abc", "user-b", "bank-x")).isEmpty();
        assertThat(transferService.findVisibleTransfer("p2p_abc", "user-c", "bank-y")).isEmpty();
    }

    // ===== Helper Methods =====

    private Transfer createTransfer(Long id, TransferStatus status) {
        return Transfer.builder()
            .id(id)
            .transferId("p2p_abc")
            .senderUserId("user-a")
            .senderBankId("bank-x")
            .senderAccountId("acct-1")
            .recipientAlias("@bob")
            .recipientAliasType(AliasType.USERNAME)
            .amount(new BigDecimal("25.00"))
            .currency("CAD")
            .transferType(TransferType.P2P)
            .recipientType(RecipientType.INDIVIDUAL)
            .status(status)
            .createdAt(LocalDateTime.now())
            .build();
    }
}
