package com.example.transfersim.repository;

import com.example.transfersim.entity.MicroMerchant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Optional;

@Repository
public interface MicroMerchantRepository extends JpaRepository<MicroMerchant, Long> {

    Optional<MicroMerchant> findByUserIdAndBankIdAndActiveTrue(String userId, String bankId);

    /**
     * 原子性累加商家統計（避免讀-改-寫競爭）
     *
     * @return 受影響的行數
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE MicroMerchant m SET " +
           "m.totalReceived = m.totalReceived + :amount, " +
           "m.totalTransactions = m.totalTransactions + 1, " +
           "m.totalFees = m.totalFees + :fee, " +
           "m.updatedAt = CURRENT_TIMESTAMP " +
           "WHERE m.merchantId = :merchantId")
    int incrementStats(@Param("merchantId") String merchantId,
                       @Param("amount") BigDecimal amount,
                       @Param("fee") BigDecimal fee);
}
