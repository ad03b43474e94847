package com.nosota.mvault.exception;

import com.nosota.mvault.config.CorrelationIdFilter;
import com.nosota.mvault.dto.ErrorResponse;
import com.nosota.mvault.error.InsufficientApprovalsException;
import com.nosota.mvault.error.InsufficientFundsException;
import com.nosota.mvault.error.NotParticipantException;
import com.nosota.mvault.error.ProposalNotFoundException;
import com.nosota.mvault.error.ProposalStateException;
import com.nosota.mvault.error.ValueTransferException;
import com.nosota.mvault.error.VaultValidationException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(NotParticipantException.class)
    public ResponseEntity<ErrorResponse> handleNotParticipant(
            NotParticipantException ex, HttpServletRequest request) {
        log.warn("Unauthorized caller [correlationId={}]: {}", correlationId(), ex.getMessage());
        return error(HttpStatus.FORBIDDEN, "Not a Participant", ex.getMessage(), request);
    }

    @ExceptionHandler(ProposalNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleProposalNotFound(
            ProposalNotFoundException ex, HttpServletRequest request) {
        log.warn("Proposal not found [correlationId={}]: {}", correlationId(), ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "Proposal Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(ProposalStateException.class)
    public ResponseEntity<ErrorResponse> handleProposalState(
            ProposalStateException ex, HttpServletRequest request) {
        log.warn("Invalid proposal state [correlationId={}]: {}", correlationId(), ex.getMessage());
        return error(HttpStatus.CONFLICT, "Invalid Proposal State", ex.getMessage(), request);
    }

    @ExceptionHandler(InsufficientApprovalsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientApprovals(
            InsufficientApprovalsException ex, HttpServletRequest request) {
        log.warn("Insufficient approvals [correlationId={}]: {}", correlationId(), ex.getMessage());
        return error(HttpStatus.CONFLICT, "Insufficient Approvals", ex.getMessage(), request);
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientFunds(
            InsufficientFundsException ex, HttpServletRequest request) {
        log.error("Insufficient funds error [correlationId={}]: {}", correlationId(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Insufficient Funds", ex.getMessage(), request);
    }

    @ExceptionHandler(VaultValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            VaultValidationException ex, HttpServletRequest request) {
        log.warn("Validation failed [correlationId={}]: {}", correlationId(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), request);
    }

    @ExceptionHandler(ValueTransferException.class)
    public ResponseEntity<ErrorResponse> handleValueTransfer(
            ValueTransferException ex, HttpServletRequest request) {
        log.error("Value transfer failed [correlationId={}]: {}", correlationId(), ex.getMessage(), ex);
        return error(HttpStatus.BAD_GATEWAY, "Value Transfer Failed", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("Invalid request body [correlationId={}]: {}", correlationId(), message);
        return error(HttpStatus.BAD_REQUEST, "Invalid Request", message, request);
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            HandlerMethodValidationException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex, HttpServletRequest request) {
        log.warn("Malformed request [correlationId={}]: {}", correlationId(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage(), request);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(
            MissingRequestHeaderException ex, HttpServletRequest request) {
        log.warn("Missing header [correlationId={}]: {}", correlationId(), ex.getHeaderName());
        return error(HttpStatus.BAD_REQUEST, "Missing Header",
                "Required header is missing: " + ex.getHeaderName(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        log.error("Illegal argument [correlationId={}]: {}", correlationId(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(
            IllegalStateException ex, HttpServletRequest request) {
        log.error("Illegal state [correlationId={}]: {}", correlationId(), ex.getMessage());
        return error(HttpStatus.CONFLICT, "Invalid State", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = correlationId();
        log.error("Unexpected error [correlationId={}]", correlationId, ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support with correlation ID: " + correlationId,
                request);
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String title, String message,
                                                HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.of(status.value(), title, message, request.getRequestURI(), correlationId());
        return ResponseEntity.status(status).body(body);
    }

    private static String correlationId() {
        return MDC.get(CorrelationIdFilter.MDC_KEY);
    }
}
