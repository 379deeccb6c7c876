package com.flamingo.ai.pagereader.domain.repository;

import com.flamingo.ai.pagereader.domain.entity.Document;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Document entities. */
@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

  List<Document> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

  /** Sums the original upload sizes of all documents of an owner. */
  @Query(
      "SELECT COALESCE(SUM(d.originalSizeBytes), 0) FROM Document d WHERE d.ownerId = :ownerId")
  long sumOriginalSizeBytesByOwnerId(@Param("ownerId") String ownerId);
}
