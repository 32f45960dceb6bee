package com.example.transfersim.controller;

import com.example.transfersim.facade.TransferFacade;
import com.example.transfersim.facade.dto.CancelTransferResponse;
import com.example.transfersim.facade.dto.CreateTransferRequest;
import com.example.transfersim.facade.dto.CreateTransferResponse;
import com.example.transfersim.facade.dto.TransferDetailResponse;
import com.example.transfersim.facade.dto.TransferListResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * 呼叫端身分（userId / bankId）由上游驗證後以參數帶入
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/transfers")
@RequiredArgsConstructor
public class TransferController {

    private final TransferFacade transferFacade;

    @PostMapping
    public ResponseEntity<CreateTransferResponse> createTransfer(
            @Valid @RequestBody CreateTransferRequest request) {
        log.info("POST /api/v1/transfers - senderUserId={}, senderBankId={}, amount={}",
                request.getSenderUserId(), request.getSenderBankId(), request.getAmount());

        CreateTransferResponse response = transferFacade.createTransfer(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<TransferListResponse> listTransfers(
            @RequestParam
            @NotBlank(message = "UserId cannot be null or blank")
            String userId,

            @RequestParam
            @NotBlank(message = "BankId cannot be null or blank")
            String bankId,

            @RequestParam(required = false) String direction,

            @RequestParam(required = false) String status,

            @RequestParam(defaultValue = "0")
            @Min(value = 0, message = "Page number must be >= 0")
            int page,

            @RequestParam(defaultValue = "20")
            @Min(value = 1, message = "Page size must be >= 1")
            @Max(value = 100, message = "Page size must be <= 100")
            int size) {
        log.info("GET /api/v1/transfers?userId={}&bankId={}&direction={}&status={}&page={}&size={}",
                userId, bankId, direction, status, page, size);

        return ResponseEntity.ok(transferFacade.listTransfers(userId, bankId, direction, status, page, size));
    }

    @GetMapping("/{transferId}")
    public ResponseEntity<TransferDetailResponse> getTransfer(
            @PathVariable String transferId,
            @RequestParam @NotBlank(message = "UserId cannot be null or blank") String userId,
            @RequestParam @NotBlank(message = "BankId cannot be null or blank") String bankId) {
        log.info("GET /api/v1/transfers/{}", transferId);

        return ResponseEntity.ok(transferFacade.getTransfer(transferId, userId, bankId));
    }

    @PostMapping("/{transferId}/cancel")
    public ResponseEntity<CancelTransferResponse> cancelTransfer(
            @PathVariable String transferId,
            @RequestParam @NotBlank(message = "UserId cannot be null or blank") String userId,
            @RequestParam @NotBlank(message = "BankId cannot be null or blank") String bankId) {
        log.info("POST /api/v1/transfers/{}/cancel", transferId);

        return ResponseEntity.ok(transferFacade.cancelTransfer(transferId, userId, bankId));
    }
}
