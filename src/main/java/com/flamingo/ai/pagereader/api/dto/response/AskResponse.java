package com.flamingo.ai.pagereader.api.dto.response;

import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an assistant answer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskResponse {

  private UUID sessionId;
  private String message;

  /** Page numbers the answer was grounded on; the viewed page comes first. */
  private List<Integer> citations;
}
