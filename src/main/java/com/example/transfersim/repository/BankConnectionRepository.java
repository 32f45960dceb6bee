package com.example.transfersim.repository;

import com.example.transfersim.entity.BankConnection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BankConnectionRepository extends JpaRepository<BankConnection, Long> {

    Optional<BankConnection> findByBankIdAndActiveTrue(String bankId);
}
