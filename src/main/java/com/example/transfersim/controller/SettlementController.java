package com.example.transfersim.controller;

import com.example.transfersim.facade.SettlementFacade;
import com.example.transfersim.facade.dto.CreateSettlementRequest;
import com.example.transfersim.facade.dto.SettlementDetailResponse;
import com.example.transfersim.facade.dto.SettlementResultResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 合約結算撥款 API
 *
 * 回應狀態碼依結算狀態決定：completed → 200，failed → 422，其餘 → 202
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/settlements")
@RequiredArgsConstructor
public class SettlementController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final SettlementFacade settlementFacade;

    @PostMapping
    public ResponseEntity<SettlementResultResponse> createSettlement(
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody CreateSettlementRequest request) {
        log.info("POST /api/v1/settlements - contractId={}, type={}, amount={}, idempotencyKey={}",
                request.getContractId(), request.getSettlementType(), request.getAmount(), idempotencyKey);

        SettlementResultResponse response = settlementFacade.createSettlement(idempotencyKey, request);

        return ResponseEntity.status(statusFor(response.getStatus())).body(response);
    }

    @GetMapping("/{settlementId}")
    public ResponseEntity<SettlementDetailResponse> getSettlement(@PathVariable String settlementId) {
        log.info("GET /api/v1/settlements/{}", settlementId);

        return ResponseEntity.ok(settlementFacade.getSettlement(settlementId));
    }

    private static HttpStatus statusFor(String settlementStatus) {
        switch (settlementStatus) {
            case "completed":
                return HttpStatus.OK;
            case "failed":
                return HttpStatus.UNPROCESSABLE_ENTITY;
            default:
                return HttpStatus.ACCEPTED;
        }
    }
}
