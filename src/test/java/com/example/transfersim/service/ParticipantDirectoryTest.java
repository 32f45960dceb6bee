package com.example.transfersim.service;

import com.example.transfersim.alias.AliasResolver;
import com.example.transfersim.bank.BankConnector;
import com.example.transfersim.bank.BankConnectorRegistry;
import com.example.transfersim.bank.UserVerification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ParticipantDirectory 單元測試
 *
 * 測試策略：查詢失敗回傳預設值，且走 best-effort 查詢（不觸發 saga 用的 ERROR log）
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ParticipantDirectory Tests")
class ParticipantDirectoryTest {

    @Mock
    private BankConnectorRegistry connectorRegistry;

    @Mock
    private AliasResolver aliasResolver;

    @Mock
    private BankConnector bank;

    @InjectMocks
    private ParticipantDirectory participantDirectory;

    @Test
    @DisplayName("displayName - With verified user - Returns bank display name")
    void displayName_WithVerifiedUser_ReturnsName() {
        // Given
        when(connectorRegistry.findConnector("bsim-a")).thenReturn(Optional.of(bank));
        when(bank.verifyUser("alice")).thenReturn(UserVerification.builder().exists(true).displayName("Alice").build());

        // When & Then
        assertThat(participantDirectory.displayName("alice", "bsim-a")).isEqualTo("Alice");
    }

    @Test
    @DisplayName("displayName - With unknown bank - Returns Unknown via quiet lookup")
    void displayName_WithUnknownBank_ReturnsUnknown() {
        // Given
        when(connectorRegistry.findConnector("bsim-z")).thenReturn(Optional.empty());

        // When
        String name = participantDirectory.displayName("alice", "bsim-z");

        // Then
        assertThat(name).isEqualTo(ParticipantDirectory.UNKNOWN_USER);
        verify(connectorRegistry, never()).forBank(anyString());
    }

    @Test
    @DisplayName("displayName - With user not found - Returns Unknown")
    void displayName_WithUserNotFound_ReturnsUnknown() {
        // Given
        when(connectorRegistry.findConnector("bsim-a")).thenReturn(Optional.of(bank));
        when(bank.verifyUser("ghost")).thenReturn(UserVerification.notFound("USER_NOT_FOUND"));

        // When & Then
        assertThat(participantDirectory.displayName("ghost", "bsim-a")).isEqualTo(ParticipantDirectory.UNKNOWN_USER);
    }

    @Test
    @DisplayName("bankName - With unknown bank - Returns Unknown Bank")
    void bankName_WithUnknownBank_ReturnsUnknownBank() {
        // Given
        when(connectorRegistry.bankName("bsim-z")).thenReturn(Optional.empty());

        // When & Then
        assertThat(participantDirectory.bankName("bsim-z")).isEqualTo(ParticipantDirectory.UNKNOWN_BANK);
    }
}
