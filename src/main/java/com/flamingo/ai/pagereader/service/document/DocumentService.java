package com.flamingo.ai.pagereader.service.document;

import com.flamingo.ai.pagereader.domain.entity.Document;
import java.util.List;
import java.util.UUID;
import org.springframework.web.multipart.MultipartFile;

/** Upload, read and delete operations for documents. */
public interface DocumentService {

  /**
   * Stores the upload, creates the document in PROCESSING and starts extraction. Uploads below the
   * inline threshold are processed before this returns; larger ones are handed to the background
   * executor and the PROCESSING document is returned at once.
   *
   * @param ownerId authenticated owner
   * @param file uploaded file
   * @return the document as of return time
   */
  Document uploadDocument(String ownerId, MultipartFile file);

  /**
   * Loads a document owned by the caller.
   *
   * @throws com.flamingo.ai.pagereader.exception.DocumentNotFoundException if it does not exist
   * @throws com.flamingo.ai.pagereader.exception.AccessDeniedException if another owner has it
   */
  Document getDocument(String ownerId, UUID documentId);

  /** Loads the optimized pages of a document owned by the caller, with its read state. */
  OptimizedDocumentView getOptimizedDocument(String ownerId, UUID documentId, boolean includePages);

  /** Lists the caller's documents, newest first. */
  List<Document> listDocuments(String ownerId);

  /**
   * Deletes a document owned by the caller together with its pages, embeddings and stored
   * original. The freed bytes count against the storage allowance again at once.
   *
   * @throws com.flamingo.ai.pagereader.exception.DocumentNotFoundException if it does not exist
   * @throws com.flamingo.ai.pagereader.exception.AccessDeniedException if another owner has it
   */
  void deleteDocument(String ownerId, UUID documentId);
}
