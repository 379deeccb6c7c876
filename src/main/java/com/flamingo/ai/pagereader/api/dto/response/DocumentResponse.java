package com.flamingo.ai.pagereader.api.dto.response;

import com.flamingo.ai.pagereader.domain.entity.Document;
import com.flamingo.ai.pagereader.domain.enums.DocumentFormat;
import com.flamingo.ai.pagereader.domain.enums.ProcessingStatus;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document metadata. Page content is served by the optimized endpoint. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private String title;
  private String author;
  private DocumentFormat format;
  private String originalFileName;
  private Long originalSizeBytes;
  private Integer pageCount;
  private Integer wordCount;
  private boolean hasPassword;
  private ProcessingStatus status;
  private String processingError;
  private LocalDateTime createdAt;
  private LocalDateTime processedAt;

  public static DocumentResponse fromEntity(Document document) {
    return DocumentResponse.builder()
        .id(document.getId())
        .title(document.getTitle())
        .author(document.getAuthor())
        .format(document.getFormat())
        .originalFileName(document.getOriginalFileName())
        .originalSizeBytes(document.getOriginalSizeBytes())
        .pageCount(document.getPageCount())
        .wordCount(document.getWordCount())
        .hasPassword(document.isHasPassword())
        .status(document.getProcessingStatus())
        .processingError(document.getProcessingError())
        .createdAt(document.getCreatedAt())
        .processedAt(document.getProcessedAt())
        .build();
  }
}
