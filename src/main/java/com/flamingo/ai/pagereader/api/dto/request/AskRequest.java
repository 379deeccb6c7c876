package com.flamingo.ai.pagereader.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for one question to the reading assistant. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskRequest {

  /** Existing session to continue. A new session is created when null. */
  private UUID sessionId;

  @NotNull(message = "Document is required")
  private UUID documentId;

  @NotBlank(message = "Prompt is required")
  @Size(max = 2000, message = "Prompt must not exceed 2000 characters")
  private String prompt;

  /** Page the reader is looking at, 1-based. */
  private Integer currentPage;

  private Integer totalPages;
}
