package com.clapgrow.outreach.engine.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.TransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(CampaignNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(CampaignNotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler({CampaignStateException.class, SendingIdentityBusyException.class,
        ConcurrentCampaignUpdateException.class})
    public ResponseEntity<ErrorResponse> handleConflict(CampaignPreconditionException e) {
        log.warn("Conflict ({}): {}", e.getErrorCode(), e.getMessage());
        return respond(HttpStatus.CONFLICT, e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(CampaignValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(CampaignValidationException e) {
        log.warn("Campaign validation failed: {}", e.getErrors());
        return respond(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage(), e.getErrors());
    }

    @ExceptionHandler({NoEligibleTargetsException.class, SendingIdentityException.class})
    public ResponseEntity<ErrorResponse> handleUnprocessable(CampaignPreconditionException e) {
        log.warn("Precondition failed ({}): {}", e.getErrorCode(), e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(
            MethodArgumentNotValidException e) {
        Map<String, String> errors = new HashMap<>();
        e.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("errorCode", "VALIDATION_ERROR");
        response.put("message", "Validation failed");
        response.put("errors", errors);
        response.put("timestamp", LocalDateTime.now());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Malformed request", null);
    }

    @ExceptionHandler(CampaignStoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreException(CampaignStoreException e) {
        log.error("Campaign store error: {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE",
            "Campaign storage is unavailable. Please try again.", null);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentModification(ObjectOptimisticLockingFailureException e) {
        log.warn("Concurrent modification: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "CONCURRENT_MODIFICATION",
            "The campaign was modified concurrently. Please retry.", null);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(DataAccessException e) {
        log.error("Database access error: {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "DATABASE_ERROR",
            "Database error occurred. Please try again.", null);
    }

    @ExceptionHandler(TransactionException.class)
    public ResponseEntity<ErrorResponse> handleTransactionException(TransactionException e) {
        log.error("Transaction error: {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "TRANSACTION_ERROR",
            "Transaction error occurred. Please try again.", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR",
            e.getMessage() != null ? e.getMessage() : "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message,
                                                  List<String> details) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, details, LocalDateTime.now()));
    }

    /**
     * Error body returned by every handler except bean validation, which adds per-field errors.
     */
    public static class ErrorResponse {
        private final boolean success = false;
        private final String errorCode;
        private final String message;
        private final List<String> details;
        private final LocalDateTime timestamp;

        public ErrorResponse(String errorCode, String message, List<String> details, LocalDateTime timestamp) {
            this.errorCode = errorCode;
            this.message = message;
            this.details = details;
            this.timestamp = timestamp;
        }

        public boolean isSuccess() { return success; }
        public String getErrorCode() { return errorCode; }
        public String getMessage() { return message; }
        public List<String> getDetails() { return details; }
        public LocalDateTime getTimestamp() { return timestamp; }
    }
}
