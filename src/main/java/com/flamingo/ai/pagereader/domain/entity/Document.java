package com.flamingo.ai.pagereader.domain.entity;

import com.flamingo.ai.pagereader.domain.converter.StringListConverter;
import com.flamingo.ai.pagereader.domain.converter.TextBlockListConverter;
import com.flamingo.ai.pagereader.domain.enums.DocumentFormat;
import com.flamingo.ai.pagereader.domain.enums.ProcessingStatus;
import com.flamingo.ai.pagereader.domain.model.ContentFingerprint;
import com.flamingo.ai.pagereader.domain.model.TextBlock;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * An uploaded document with two parallel text representations: the rich block list and the
 * optimized per-page strings. Each representation carries its own checksum, size and version.
 *
 * <p>Status changes go through {@link #applyPartialPages}, {@link #markReady} and {@link
 * #markFailed}, which reject any transition out of a terminal state.
 */
@Entity
@Table(name = "documents", indexes = @Index(name = "idx_documents_owner", columnList = "ownerId"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Document {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private String ownerId;

  @Column(nullable = false)
  private String title;

  private String author;

  @Column(columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private DocumentFormat format;

  // Original upload
  @Column(nullable = false)
  private String originalFileName;

  private String originalMimeType;

  private long originalSizeBytes;

  private String originalChecksumSha256;

  /** Object storage key of the original bytes. */
  private String storagePath;

  private Integer pageCount;

  private Integer wordCount;

  @Builder.Default private boolean hasPassword = false;

  // Rich representation
  @Convert(converter = TextBlockListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<TextBlock> richBlocks = new ArrayList<>();

  private String richChecksumSha256;

  private Long richSizeBytes;

  @Builder.Default private int richVersion = 1;

  // Optimized representation
  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> optimizedPages = new ArrayList<>();

  private String optimizedChecksumSha256;

  private Long optimizedSizeBytes;

  @Builder.Default private int optimizedVersion = 1;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private ProcessingStatus processingStatus = ProcessingStatus.PROCESSING;

  @Column(columnDefinition = "TEXT")
  private String processingError;

  private LocalDateTime processedAt;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  public boolean isReady() {
    return processingStatus == ProcessingStatus.READY;
  }

  public boolean hasPages() {
    return optimizedPages != null && !optimizedPages.isEmpty();
  }

  /** Stores a snapshot of the pages extracted so far. Only legal while processing. */
  public void applyPartialPages(List<String> pages, ContentFingerprint fingerprint) {
    requireProcessing("apply partial pages");
    this.optimizedPages = new ArrayList<>(pages);
    this.optimizedChecksumSha256 = fingerprint.checksumSha256();
    this.optimizedSizeBytes = fingerprint.sizeBytes();
  }

  /** Stores both final representations and stamps {@code processedAt}. */
  public void markReady(
      List<TextBlock> blocks,
      ContentFingerprint richFingerprint,
      List<String> pages,
      ContentFingerprint optimizedFingerprint) {
    requireProcessing("mark ready");
    this.richBlocks = new ArrayList<>(blocks);
    this.richChecksumSha256 = richFingerprint.checksumSha256();
    this.richSizeBytes = richFingerprint.sizeBytes();
    this.optimizedPages = new ArrayList<>(pages);
    this.optimizedChecksumSha256 = optimizedFingerprint.checksumSha256();
    this.optimizedSizeBytes = optimizedFingerprint.sizeBytes();
    this.processingStatus = ProcessingStatus.READY;
    this.processingError = null;
    this.processedAt = LocalDateTime.now();
  }

  /** Marks the document as failed, keeping the cause for later retrieval. */
  public void markFailed(String errorMessage) {
    requireProcessing("mark failed");
    this.processingStatus = ProcessingStatus.FAILED;
    this.processingError = errorMessage;
  }

  private void requireProcessing(String action) {
    if (processingStatus != ProcessingStatus.PROCESSING) {
      throw new IllegalStateException(
          "Cannot " + action + " for document " + id + " in status " + processingStatus);
    }
  }
}
