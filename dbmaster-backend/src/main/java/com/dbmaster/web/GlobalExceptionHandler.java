package com.dbmaster.web;

import com.dbmaster.api.ErrorResponse;
import com.dbmaster.crypto.EncryptionException;
import com.dbmaster.pool.ConnectivityException;
import com.dbmaster.pool.CredentialException;
import com.dbmaster.pool.QueryExecutionException;
import com.dbmaster.scheduler.RetentionSweepException;
import com.dbmaster.service.AccessDeniedException;
import com.dbmaster.service.AuthenticationException;
import com.dbmaster.service.NotFoundException;
import com.dbmaster.service.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String TRACE_ID = "trace_id";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Input validation failed", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getMostSpecificCause();
        return respond(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body could not be read",
                cause != null ? cause.getMessage() : ex.getMessage());
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", ex.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), null);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthentication(AuthenticationException ex) {
        return respond(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED", ex.getMessage(), null);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccessDeniedException ex) {
        log.warn("Access denied: user_id={}, reason={}", MDC.get("user_id"), ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, "PERMISSION_DENIED", ex.getMessage(), null);
    }

    @ExceptionHandler({NotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), null);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNoHandler(Exception ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not found", ex.getMessage());
    }

    @ExceptionHandler(CredentialException.class)
    public ResponseEntity<ErrorResponse> handleCredential(CredentialException ex) {
        log.warn("Credential failure: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "CREDENTIAL_ERROR", ex.getMessage(), null);
    }

    @ExceptionHandler(ConnectivityException.class)
    public ResponseEntity<ErrorResponse> handleConnectivity(ConnectivityException ex) {
        log.warn("Database unreachable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "CONNECTIVITY_ERROR", ex.getMessage(), null);
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<ErrorResponse> handleQueryExecution(QueryExecutionException ex) {
        String details = ex.getSqlState() != null
                ? "sql_state=" + ex.getSqlState() + ", error_code=" + ex.getErrorCode()
                : null;
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "QUERY_FAILED", ex.getMessage(), details);
    }

    @ExceptionHandler(EncryptionException.class)
    public ResponseEntity<ErrorResponse> handleEncryption(EncryptionException ex) {
        log.error("Credential decryption failed: type={}", ex.getClass().getSimpleName());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "ENCRYPTION_ERROR", "Stored credential could not be decrypted", null);
    }

    @ExceptionHandler(RetentionSweepException.class)
    public ResponseEntity<ErrorResponse> handleSweep(RetentionSweepException ex) {
        log.error("Retention sweep failed", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "SWEEP_FAILED", ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "An unexpected error occurred", ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, String details) {
        ErrorResponse error = ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .traceId(MDC.get(TRACE_ID))
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
