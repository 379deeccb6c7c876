package com.flamingo.ai.pagereader.api.rest;

import static com.flamingo.ai.pagereader.api.interceptor.AccountStatusInterceptor.OWNER_HEADER;

import com.flamingo.ai.pagereader.api.dto.request.AskRequest;
import com.flamingo.ai.pagereader.api.dto.response.AskResponse;
import com.flamingo.ai.pagereader.api.dto.response.ChatHistoryResponse;
import com.flamingo.ai.pagereader.api.dto.response.IngestionResponse;
import com.flamingo.ai.pagereader.service.chat.AssistantChatService;
import com.flamingo.ai.pagereader.service.ingestion.IngestionReport;
import com.flamingo.ai.pagereader.service.ingestion.IngestionService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the reading assistant. */
@RestController
@RequestMapping("/api/ai")
@RequiredArgsConstructor
public class AssistantController {

  private final IngestionService ingestionService;
  private final AssistantChatService assistantChatService;

  /** Builds the retrieval rows of a document so it can be asked about. */
  @PostMapping("/documents/{documentId}/ingest")
  public ResponseEntity<IngestionResponse> ingestDocument(
      @RequestHeader(OWNER_HEADER) String ownerId,
      @PathVariable UUID documentId) {
    IngestionReport report = ingestionService.ingestDocument(ownerId, documentId);
    return ResponseEntity.ok(IngestionResponse.from(documentId, report));
  }

  @PostMapping("/chat")
  public ResponseEntity<AskResponse> ask(
      @RequestHeader(OWNER_HEADER) String ownerId,
      @Valid @RequestBody AskRequest request) {
    return ResponseEntity.ok(assistantChatService.ask(ownerId, request));
  }

  @GetMapping("/sessions/{sessionId}")
  public ResponseEntity<ChatHistoryResponse> getChatHistory(
      @RequestHeader(OWNER_HEADER) String ownerId,
      @PathVariable UUID sessionId) {
    return ResponseEntity.ok(
        ChatHistoryResponse.from(assistantChatService.getChatHistory(ownerId, sessionId)));
  }
}
