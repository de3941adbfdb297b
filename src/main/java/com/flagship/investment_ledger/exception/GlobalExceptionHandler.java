package com.flagship.investment_ledger.exception;

import com.flagship.investment_ledger.inventory.OutOfStockException;
import com.flagship.investment_ledger.inventory.SlotContentionException;
import com.flagship.investment_ledger.payment.gateway.GatewayUnavailableException;
import com.flagship.investment_ledger.payment.webhook.InvalidSignatureException;
import com.flagship.investment_ledger.withdrawal.NoEligibleInvestmentsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain and framework exceptions to a consistent JSON error body.
 *
 * - 400: malformed or invalid requests, disallowed transitions, nothing to withdraw
 * - 404: unknown resources
 * - 409: inventory exhausted or contended, other state conflicts
 * - 503: payment gateway unreachable
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header",
            "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());
        Map<String, Object> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Bad parameter {}: {}", e.getName(), e.getValue());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request",
            "Parameter '" + e.getName() + "' has an invalid value", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "Request body could not be read", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidTransitionException e) {
        log.warn("Transition rejected: {}", e.getMessage());
        Map<String, Object> details = e.getCurrentStatus() != null
            ? Map.of("current_status", e.getCurrentStatus())
            : null;
        return respond(HttpStatus.BAD_REQUEST, "Invalid Transition", e.getMessage(), details);
    }

    @ExceptionHandler(InvalidSignatureException.class)
    public ResponseEntity<Map<String, String>> handleInvalidSignature(InvalidSignatureException e) {
        log.warn("Signature rejected: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", "Invalid signature"));
    }

    @ExceptionHandler(NoEligibleInvestmentsException.class)
    public ResponseEntity<ErrorResponse> handleNoEligible(NoEligibleInvestmentsException e) {
        log.warn("Withdrawal rejected: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "No Eligible Investments", e.getMessage(), null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.info("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(OutOfStockException.class)
    public ResponseEntity<ErrorResponse> handleOutOfStock(OutOfStockException e) {
        log.warn("Out of stock: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Out Of Stock", e.getMessage(),
            Map.of("package_id", e.getPackageId()));
    }

    @ExceptionHandler(SlotContentionException.class)
    public ResponseEntity<ErrorResponse> handleSlotContention(SlotContentionException e) {
        log.warn("Inventory contention: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Inventory Busy", "Please retry shortly", null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(DataIntegrityViolationException e) {
        log.warn("Constraint violation: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", "The request conflicts with existing data", null);
    }

    @ExceptionHandler(GatewayUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleGatewayUnavailable(GatewayUnavailableException e) {
        log.error("Payment gateway unavailable: {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Payment Gateway Unavailable",
            "The payment provider could not be reached, please retry", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, Object> details) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build());
    }

    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, Object> details;
        Instant timestamp;
    }
}
