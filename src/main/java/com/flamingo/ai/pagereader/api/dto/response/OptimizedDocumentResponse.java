package com.flamingo.ai.pagereader.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.pagereader.domain.entity.Document;
import com.flamingo.ai.pagereader.domain.enums.ProcessingStatus;
import com.flamingo.ai.pagereader.service.document.OptimizedDocumentView;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the lightweight page read. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OptimizedDocumentResponse {

  private UUID id;
  private String title;
  private ProcessingStatus status;
  private Integer pageCount;
  private boolean partial;
  private String checksum;
  private Integer version;

  /** Present only when pages were requested. */
  private List<String> pages;

  public static OptimizedDocumentResponse fromView(OptimizedDocumentView view) {
    Document document = view.document();
    return OptimizedDocumentResponse.builder()
        .id(document.getId())
        .title(document.getTitle())
        .status(document.getProcessingStatus())
        .pageCount(document.getOptimizedPages() == null ? 0 : document.getOptimizedPages().size())
        .partial(view.state() == OptimizedDocumentView.ReadState.PARTIAL)
        .checksum(document.getOptimizedChecksumSha256())
        .version(document.getOptimizedVersion())
        .pages(view.includePages() ? document.getOptimizedPages() : null)
        .build();
  }
}
