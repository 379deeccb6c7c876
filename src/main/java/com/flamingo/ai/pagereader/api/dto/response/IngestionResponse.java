package com.flamingo.ai.pagereader.api.dto.response;

import com.flamingo.ai.pagereader.service.ingestion.IngestionReport;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an ingestion run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResponse {

  private UUID documentId;
  private int pagesSubmitted;
  private int pagesPersisted;
  private int embeddingsStored;

  public static IngestionResponse from(UUID documentId, IngestionReport report) {
    return IngestionResponse.builder()
        .documentId(documentId)
        .pagesSubmitted(report.pagesSubmitted())
        .pagesPersisted(report.pagesPersisted())
        .embeddingsStored(report.embeddingsStored())
        .build();
  }
}
