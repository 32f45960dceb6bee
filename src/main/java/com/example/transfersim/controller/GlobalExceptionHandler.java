package com.example.transfersim.controller;

import com.example.transfersim.exception.AliasTypeUndeterminedException;
import com.example.transfersim.exception.InvalidTransferStateException;
import com.example.transfersim.exception.MissingIdempotencyKeyException;
import com.example.transfersim.exception.SettlementNotFoundException;
import com.example.transfersim.exception.TransferLimitExceededException;
import com.example.transfersim.exception.TransferNotFoundException;
import com.example.transfersim.facade.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.time.LocalDateTime;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(TransferNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleTransferNotFound(
            TransferNotFoundException ex, HttpServletRequest request) {
        log.warn("TransferNotFoundException: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "Transfer Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(SettlementNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSettlementNotFound(
            SettlementNotFoundException ex, HttpServletRequest request) {
        log.warn("SettlementNotFoundException: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "Settlement Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidTransferStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransferState(
            InvalidTransferStateException ex, HttpServletRequest request) {
        log.warn("InvalidTransferStateException: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Transfer State", ex.getMessage(), request);
    }

    @ExceptionHandler(TransferLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleTransferLimitExceeded(
            TransferLimitExceededException ex, HttpServletRequest request) {
        log.warn("TransferLimitExceededException: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Transfer Limit Exceeded", ex.getMessage(), request);
    }

    @ExceptionHandler(AliasTypeUndeterminedException.class)
    public ResponseEntity<ErrorResponse> handleAliasTypeUndetermined(
            AliasTypeUndeterminedException ex, HttpServletRequest request) {
        log.warn("AliasTypeUndeterminedException: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Alias", ex.getMessage(), request);
    }

    @ExceptionHandler(MissingIdempotencyKeyException.class)
    public ResponseEntity<ErrorResponse> handleMissingIdempotencyKey(
            MissingIdempotencyKeyException ex, HttpServletRequest request) {
        log.warn("MissingIdempotencyKeyException: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("IllegalArgumentException: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage(), request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        log.warn("MissingServletRequestParameterException: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("HttpMessageNotReadableException: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Malformed Request", "Invalid request body", request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        log.warn("MethodArgumentNotValidException: validation failed for @RequestBody");

        String message = ex.getBindingResult().getAllErrors().stream()
                .map(error -> {
                    if (error instanceof FieldError fieldError) {
                        return fieldError.getField() + ": " + error.getDefaultMessage();
                    } else {
                        return error.getDefaultMessage();
                    }
                })
                .collect(Collectors.joining("; "));

        return build(HttpStatus.BAD_REQUEST, "Validation Failed", message, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {

        log.warn("ConstraintViolationException: validation failed for @PathVariable or @RequestParam");

        String message = ex.getConstraintViolations().stream()
                .map(violation -> {
                    String propertyPath = violation.getPropertyPath().toString();
                    String paramName = propertyPath.substring(propertyPath.lastIndexOf('.') + 1);
                    return paramName + ": " + violation.getMessage();
                })
                .collect(Collectors.joining("; "));

        return build(HttpStatus.BAD_REQUEST, "Validation Failed", message, request);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleHandlerMethodValidation(
            HandlerMethodValidationException ex, HttpServletRequest request) {

        log.warn("HandlerMethodValidationException: validation failed for @PathVariable or @RequestParam");

        String message = ex.getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining("; "));

        return build(HttpStatus.BAD_REQUEST, "Validation Failed", message, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        log.error("Unexpected exception: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", request);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message,
                                                       HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.builder()
                .status(status.value())
                .error(error)
                .message(message)
                .timestamp(LocalDateTime.now())
                .path(request.getRequestURI())
                .build();

        return ResponseEntity.status(status).body(body);
    }
}
