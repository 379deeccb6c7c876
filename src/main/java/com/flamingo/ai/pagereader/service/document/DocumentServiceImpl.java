package com.flamingo.ai.pagereader.service.document;

import com.flamingo.ai.pagereader.config.ReaderConfig;
import com.flamingo.ai.pagereader.domain.entity.Document;
import com.flamingo.ai.pagereader.domain.enums.DocumentFormat;
import com.flamingo.ai.pagereader.domain.repository.DocumentRepository;
import com.flamingo.ai.pagereader.exception.AccessDeniedException;
import com.flamingo.ai.pagereader.exception.DocumentNotFoundException;
import com.flamingo.ai.pagereader.exception.InvalidRequestException;
import com.flamingo.ai.pagereader.service.extraction.RawUpload;
import com.flamingo.ai.pagereader.service.ingestion.DocumentPageWriter;
import com.flamingo.ai.pagereader.service.quota.StorageQuotaService;
import com.flamingo.ai.pagereader.service.storage.ObjectStorageService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the DocumentService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  private final DocumentRepository documentRepository;
  private final DocumentStateWriter stateWriter;
  private final ObjectStorageService objectStorageService;
  private final StorageQuotaService storageQuotaService;
  private final DocumentProcessingService documentProcessingService;
  private final DocumentPageWriter pageWriter;
  private final ReaderConfig readerConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "document.upload", description = "Time to upload a document")
  public Document uploadDocument(String ownerId, MultipartFile file) {
    validateFile(file);
    log.info("Uploading document {} for owner {}", file.getOriginalFilename(), ownerId);

    RawUpload upload;
    try {
      upload = RawUpload.of(file.getOriginalFilename(), file.getBytes());
    } catch (IOException e) {
      throw new InvalidRequestException(
          "Failed to read upload: " + e.getMessage(), "Please upload a valid file");
    }
    DocumentFormat format = upload.format();
    storageQuotaService.ensureCapacity(ownerId, upload.size());

    String storagePath = ownerId + "/" + UUID.randomUUID() + "." + format.getExtension();
    objectStorageService.put(storagePath, upload.bytes());

    Document document =
        stateWriter.create(
            Document.builder()
                .ownerId(ownerId)
                .title(upload.fileName())
                .format(format)
                .originalFileName(upload.fileName())
                .originalMimeType(upload.mimeType())
                .originalSizeBytes(upload.size())
                .originalChecksumSha256(upload.checksumSha256())
                .storagePath(storagePath)
                .build());
    UUID documentId = document.getId();
    meterRegistry.counter("document.uploaded", "format", format.getExtension()).increment();

    if (upload.size() < readerConfig.getProcessing().getAsyncThresholdBytes()) {
      log.debug("Processing document {} inline ({} bytes)", documentId, upload.size());
      documentProcessingService.processDocument(documentId, upload);
      return documentRepository
          .findById(documentId)
          .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    log.debug("Processing document {} in background ({} bytes)", documentId, upload.size());
    try {
      documentProcessingService.processDocumentAsync(documentId, upload);
    } catch (TaskRejectedException e) {
      log.error("Background processing rejected for document {}: {}", documentId, e.getMessage());
      meterRegistry.counter("document.processing.rejected").increment();
      return stateWriter.markFailed(documentId, "Processing queue is full, please retry later");
    }
    return document;
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "document.list", description = "Time to list documents")
  public List<Document> listDocuments(String ownerId) {
    List<Document> documents = documentRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
    log.debug("Listed {} documents for owner {}", documents.size(), ownerId);
    return documents;
  }

  @Override
  @Timed(value = "document.delete", description = "Time to delete a document")
  public void deleteDocument(String ownerId, UUID documentId) {
    Document document = getDocument(ownerId, documentId);
    log.info("Deleting document {} for owner {}", documentId, ownerId);
    pageWriter.deleteRetrievalRows(documentId);
    documentRepository.delete(document);
    objectStorageService.delete(document.getStoragePath());
    meterRegistry.counter("document.deleted").increment();
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "document.get", description = "Time to get a document")
  public Document getDocument(String ownerId, UUID documentId) {
    Document document =
        documentRepository
            .findById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    if (!ownerId.equals(document.getOwnerId())) {
      throw new AccessDeniedException("document", documentId, ownerId);
    }
    return document;
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "document.getOptimized", description = "Time to get optimized pages")
  public OptimizedDocumentView getOptimizedDocument(
      String ownerId, UUID documentId, boolean includePages) {
    OptimizedDocumentView view =
        OptimizedDocumentView.of(getDocument(ownerId, documentId), includePages);
    log.debug(
        "Optimized read of document {}: status={}, state={}",
        documentId,
        view.document().getProcessingStatus(),
        view.state());
    return view;
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new InvalidRequestException("File is empty", "Please upload a valid file");
    }
    long maxBytes = readerConfig.getProcessing().getMaxUploadBytes();
    if (file.getSize() > maxBytes) {
      throw new InvalidRequestException(
          "File too large: " + file.getSize(),
          "Maximum file size is " + (maxBytes / (1024 * 1024)) + "MB");
    }
  }
}
