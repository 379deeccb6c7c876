package com.flamingo.ai.pagereader.domain.entity;

import com.flamingo.ai.pagereader.domain.converter.FloatArrayConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Embedding vector of one page chunk. */
@Entity
@Table(
    name = "page_embeddings",
    indexes = @Index(name = "idx_page_embeddings_document", columnList = "documentId"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PageEmbedding {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private UUID documentId;

  @Column(nullable = false)
  private UUID pageId;

  @Column(nullable = false)
  private int pageNumber;

  /** Chunk within the page. Always 0 while one chunk covers one page. */
  @Builder.Default private int chunkIndex = 0;

  @Convert(converter = FloatArrayConverter.class)
  @Column(columnDefinition = "TEXT", nullable = false)
  private float[] vector;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}
