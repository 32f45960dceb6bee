package com.example.transfersim.saga;

import com.example.transfersim.entity.Transfer;
import com.example.transfersim.profile.ProfileClient;
import com.example.transfersim.service.TransferService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 完成後把雙方頭像 URL 存到轉帳上，讓列表與通知不必再查 profile 服務
 *
 * best-effort：失敗只記 log
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProfileImageRecorder {

    private final ProfileClient profileClient;
    private final TransferService transferService;

    public void record(Transfer transfer) {
        try {
            String senderImage = profileClient
                .getProfileImage(transfer.getSenderUserId(), transfer.getSenderBankId())
                .orElse(null);
            String recipientImage = profileClient
                .getProfileImage(transfer.getRecipientUserId(), transfer.getRecipientBankId())
                .orElse(null);

            transferService.recordProfileImages(transfer.getId(), senderImage, recipientImage);
            transfer.setSenderProfileImageUrl(senderImage);
            transfer.setRecipientProfileImageUrl(recipientImage);
        } catch (RuntimeException e) {
            log.warn("Failed to record profile images: transferId={}, error={}",
                transfer.getTransferId(), e.getMessage());
        }
    }
}
