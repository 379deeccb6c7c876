package com.flamingo.ai.pagereader.api.rest;

import static com.flamingo.ai.pagereader.api.interceptor.AccountStatusInterceptor.OWNER_HEADER;

import com.flamingo.ai.pagereader.api.dto.response.DocumentResponse;
import com.flamingo.ai.pagereader.api.dto.response.OptimizedDocumentResponse;
import com.flamingo.ai.pagereader.domain.entity.Document;
import com.flamingo.ai.pagereader.service.document.DocumentService;
import com.flamingo.ai.pagereader.service.document.OptimizedDocumentView;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for document upload, reading and deletion. */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentService documentService;

  /** Uploads a document. 201 when it is already readable, 202 while it is still processing. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<DocumentResponse> uploadDocument(
      @RequestHeader(OWNER_HEADER) String ownerId, @RequestParam("file") MultipartFile file) {
    Document document = documentService.uploadDocument(ownerId, file);
    HttpStatus status = document.isReady() ? HttpStatus.CREATED : HttpStatus.ACCEPTED;
    return ResponseEntity.status(status).body(DocumentResponse.fromEntity(document));
  }

  @GetMapping
  public ResponseEntity<List<DocumentResponse>> listDocuments(
      @RequestHeader(OWNER_HEADER) String ownerId) {
    return ResponseEntity.ok(
        documentService.listDocuments(ownerId).stream().map(DocumentResponse::fromEntity).toList());
  }

  @GetMapping("/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(
      @RequestHeader(OWNER_HEADER) String ownerId, @PathVariable UUID documentId) {
    return ResponseEntity.ok(
        DocumentResponse.fromEntity(documentService.getDocument(ownerId, documentId)));
  }

  @DeleteMapping("/{documentId}")
  public ResponseEntity<Void> deleteDocument(
      @RequestHeader(OWNER_HEADER) String ownerId, @PathVariable UUID documentId) {
    documentService.deleteDocument(ownerId, documentId);
    return ResponseEntity.noContent().build();
  }

  /**
   * Lightweight page read for the reader.
   *
   * <p>304 when {@code If-None-Match} names the current page checksum, 202 while nothing can be
   * shown yet, 200 with partial pages while processing, 200 once ready.
   */
  @GetMapping("/{documentId}/optimized")
  public ResponseEntity<OptimizedDocumentResponse> getOptimizedDocument(
      @RequestHeader(OWNER_HEADER) String ownerId,
      @PathVariable UUID documentId,
      @RequestParam(name = "include_pages", required = false) String includePages,
      @RequestHeader(name = HttpHeaders.IF_NONE_MATCH, required = false) String ifNoneMatch) {
    OptimizedDocumentView view =
        documentService.getOptimizedDocument(ownerId, documentId, parseIncludePages(includePages));

    HttpHeaders headers = new HttpHeaders();
    String etag = view.etag();
    if (etag != null) {
      headers.set(HttpHeaders.ETAG, etag);
      if (view.matches(ifNoneMatch)) {
        return ResponseEntity.status(HttpStatus.NOT_MODIFIED).headers(headers).build();
      }
    }

    HttpStatus status =
        view.state() == OptimizedDocumentView.ReadState.NOT_READY
            ? HttpStatus.ACCEPTED
            : HttpStatus.OK;
    return ResponseEntity.status(status)
        .headers(headers)
        .body(OptimizedDocumentResponse.fromView(view));
  }

  /** Pages are included unless the parameter is "0" or "false". */
  static boolean parseIncludePages(String value) {
    if (value == null) {
      return true;
    }
    String normalized = value.strip();
    return !("0".equals(normalized) || "false".equalsIgnoreCase(normalized));
  }
}
