package com.flamingo.ai.pagereader.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String ACCESS_DENIED = "ACCESS_001";
  public static final String ACCOUNT_DISABLED = "ACCESS_002";
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String DOCUMENT_PROCESSING_ERROR = "DOCUMENT_003";
  public static final String STORAGE_LIMIT_EXCEEDED = "DOCUMENT_004";
  public static final String SESSION_NOT_FOUND = "SESSION_001";
  public static final String UPGRADE_REQUIRED = "PLAN_001";
  public static final String QUOTA_EXHAUSTED = "PLAN_002";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String INGESTION_INTERRUPTED = "INGEST_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
