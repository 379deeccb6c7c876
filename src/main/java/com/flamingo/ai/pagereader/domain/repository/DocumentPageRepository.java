package com.flamingo.ai.pagereader.domain.repository;

import com.flamingo.ai.pagereader.domain.entity.DocumentPage;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for page retrieval rows. */
@Repository
public interface DocumentPageRepository extends JpaRepository<DocumentPage, UUID> {

  Optional<DocumentPage> findByDocumentIdAndPageNumber(UUID documentId, int pageNumber);

  long countByDocumentId(UUID documentId);

  @Modifying
  @Query("DELETE FROM DocumentPage p WHERE p.documentId = :documentId")
  int deleteAllByDocumentId(@Param("documentId") UUID documentId);
}
