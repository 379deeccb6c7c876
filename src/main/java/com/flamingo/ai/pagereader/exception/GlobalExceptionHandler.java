package com.flamingo.ai.pagereader.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * Maps domain exceptions to {@link ApiError} responses. Entitlement and quota failures get their
 * own status codes so clients can offer an upgrade instead of a generic error page.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ApiError> handleInvalidRequest(
      InvalidRequestException ex, HttpServletRequest request) {
    String errorId = record("validation_error");
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getUserMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    String errorId = record("validation_error");
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");
    log.warn("Validation error [{}]: {}", errorId, message);
    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiError> handleMissingHeader(
      MissingRequestHeaderException ex, HttpServletRequest request) {
    String errorId = record("missing_header");
    log.warn("Missing header [{}]: {}", errorId, ex.getHeaderName());
    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Missing required header: " + ex.getHeaderName(),
        request);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ApiError> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    String errorId = record("access_denied");
    log.warn(
        "Access denied [{}]: {} {} for owner {}",
        errorId,
        ex.getResourceType(),
        ex.getResourceId(),
        ex.getOwnerId());
    return respond(
        HttpStatus.FORBIDDEN,
        errorId,
        ApiError.ACCESS_DENIED,
        "You do not have access to this " + ex.getResourceType(),
        request);
  }

  @ExceptionHandler(AccountDisabledException.class)
  public ResponseEntity<ApiError> handleAccountDisabled(
      AccountDisabledException ex, HttpServletRequest request) {
    String errorId = record("account_disabled");
    log.warn("Disabled account [{}]: {}", errorId, ex.getOwnerId());
    return respond(
        HttpStatus.FORBIDDEN,
        errorId,
        ApiError.ACCOUNT_DISABLED,
        "This account has been disabled",
        request);
  }

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {
    String errorId = record("document_not_found");
    log.warn("Document not found [{}]: {}", errorId, ex.getDocumentId());
    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.DOCUMENT_NOT_FOUND, "Document not found", request);
  }

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ApiError> handleSessionNotFound(
      SessionNotFoundException ex, HttpServletRequest request) {
    String errorId = record("session_not_found");
    log.warn("Session not found [{}]: {}", errorId, ex.getSessionId());
    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.SESSION_NOT_FOUND, "Session not found", request);
  }

  @ExceptionHandler(UpgradeRequiredException.class)
  public ResponseEntity<ApiError> handleUpgradeRequired(
      UpgradeRequiredException ex, HttpServletRequest request) {
    String errorId = record("upgrade_required");
    log.info("Upgrade required [{}]: owner={}, plan={}", errorId, ex.getOwnerId(), ex.getPlan());
    return respond(
        HttpStatus.PAYMENT_REQUIRED,
        errorId,
        ApiError.UPGRADE_REQUIRED,
        "The reading assistant requires a Pro subscription",
        request);
  }

  @ExceptionHandler(QuotaExhaustedException.class)
  public ResponseEntity<ApiError> handleQuotaExhausted(
      QuotaExhaustedException ex, HttpServletRequest request) {
    String errorId = record("quota_exhausted");
    log.info(
        "Quota exhausted [{}]: owner={}, used={}, budget={}",
        errorId,
        ex.getOwnerId(),
        ex.getUsed(),
        ex.getBudget());
    return respond(
        HttpStatus.TOO_MANY_REQUESTS,
        errorId,
        ApiError.QUOTA_EXHAUSTED,
        "Monthly assistant usage limit reached",
        request);
  }

  @ExceptionHandler(StorageLimitExceededException.class)
  public ResponseEntity<ApiError> handleStorageLimit(
      StorageLimitExceededException ex, HttpServletRequest request) {
    String errorId = record("storage_limit");
    log.info("Storage limit exceeded [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.STORAGE_LIMIT_EXCEEDED,
        "Storage limit exceeded. Delete documents or upgrade your plan.",
        request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleMaxUploadSize(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {
    String errorId = record("upload_too_large");
    log.warn("Upload too large [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Maximum file size is 50MB",
        request);
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiError> handleDocumentProcessing(
      DocumentProcessingException ex, HttpServletRequest request) {
    String errorId = record("document_processing");
    log.error("Document processing error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DOCUMENT_PROCESSING_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {
    String errorId = record("llm_error");
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.LLM_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(IngestionInterruptedException.class)
  public ResponseEntity<ApiError> handleIngestionInterrupted(
      IngestionInterruptedException ex, HttpServletRequest request) {
    String errorId = record("ingestion_interrupted");
    log.error("Ingestion interrupted [{}]: {}", errorId, ex.getDocumentId());
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.INGESTION_INTERRUPTED,
        "Indexing was interrupted. Please try again.",
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    String errorId = record("internal_error");
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  /** Counts the error and returns a short id for log correlation. */
  private String record(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
