package com.flamingo.ai.pagereader.domain.repository;

import com.flamingo.ai.pagereader.domain.entity.PageEmbedding;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for page embeddings. */
@Repository
public interface PageEmbeddingRepository extends JpaRepository<PageEmbedding, UUID> {

  /** All embeddings of one document; similarity search never looks beyond this set. */
  List<PageEmbedding> findByDocumentId(UUID documentId);

  long countByDocumentId(UUID documentId);

  @Modifying
  @Query("DELETE FROM PageEmbedding e WHERE e.documentId = :documentId")
  int deleteAllByDocumentId(@Param("documentId") UUID documentId);
}
