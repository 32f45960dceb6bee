package com.example.transfersim.profile;

import java.util.Optional;

/**
 * 使用者頭像查詢（best-effort）
 */
public interface ProfileClient {

    /**
     * @return 頭像 URL；沒有頭像、服務未設定或查詢失敗時為 empty
     */
    Optional<String> getProfileImage(String userId, String bankId);
}
