package com.example.transfersim.repository;

import com.example.transfersim.entity.Alias;
import com.example.transfersim.entity.AliasType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * AliasRepository（唯讀查詢）
 */
@Repository
public interface AliasRepository extends JpaRepository<Alias, Long> {

    /**
     * 查詢已啟用且已驗證的別名
     */
    Optional<Alias> findFirstByTypeAndNormalizedValueAndActiveTrueAndVerifiedTrue(AliasType type, String normalizedValue);

    /**
     * 查詢使用者的主要別名（通知顯示用）
     */
    Optional<Alias> findFirstByUserIdAndBankIdAndPrimaryTrueAndActiveTrue(String userId, String bankId);
}
