package com.flamingo.ai.pagereader.service.chat;

import com.flamingo.ai.pagereader.api.dto.request.AskRequest;
import com.flamingo.ai.pagereader.api.dto.response.AskResponse;
import com.flamingo.ai.pagereader.config.ReaderConfig;
import com.flamingo.ai.pagereader.domain.entity.ChatMessage;
import com.flamingo.ai.pagereader.domain.entity.ChatSession;
import com.flamingo.ai.pagereader.domain.entity.Document;
import com.flamingo.ai.pagereader.domain.entity.DocumentPage;
import com.flamingo.ai.pagereader.domain.enums.MessageRole;
import com.flamingo.ai.pagereader.domain.repository.ChatMessageRepository;
import com.flamingo.ai.pagereader.domain.repository.ChatSessionRepository;
import com.flamingo.ai.pagereader.domain.repository.DocumentPageRepository;
import com.flamingo.ai.pagereader.exception.AccessDeniedException;
import com.flamingo.ai.pagereader.exception.InvalidRequestException;
import com.flamingo.ai.pagereader.exception.SessionNotFoundException;
import com.flamingo.ai.pagereader.service.document.DocumentService;
import com.flamingo.ai.pagereader.service.quota.EntitlementService;
import com.flamingo.ai.pagereader.service.quota.QuotaSnapshot;
import com.flamingo.ai.pagereader.service.quota.UsageLedgerService;
import com.flamingo.ai.pagereader.service.retrieval.EmbeddingService;
import com.flamingo.ai.pagereader.service.retrieval.PageHit;
import com.flamingo.ai.pagereader.service.retrieval.VectorSearchService;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of {@link AssistantChatService}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssistantChatServiceImpl implements AssistantChatService {

  static final String DOCUMENT_SESSION_TITLE = "Chat about document";
  static final String DEFAULT_SESSION_TITLE = "New Chat";
  static final String REFUSAL =
      "I can only answer questions about this document. "
          + "Please ask something related to the text you're reading.";

  private static final String SEPARATOR = "---------------------\n";

  private final EntitlementService entitlementService;
  private final UsageLedgerService usageLedgerService;
  private final DocumentService documentService;
  private final ChatSessionRepository sessionRepository;
  private final ChatMessageRepository messageRepository;
  private final DocumentPageRepository pageRepository;
  private final EmbeddingService embeddingService;
  private final VectorSearchService vectorSearchService;
  private final AnswerGenerator answerGenerator;
  private final ReaderConfig readerConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "assistant.ask", description = "Time to answer a question")
  public AskResponse ask(String ownerId, AskRequest request) {
    QuotaSnapshot quota = entitlementService.ensureWithinQuota(ownerId);
    validate(request);

    Document document = documentService.getDocument(ownerId, request.getDocumentId());
    ChatSession session = resolveSession(ownerId, request);
    ChatMessage userTurn = saveUserTurn(session, request.getPrompt());

    List<PageHit> hits = searchPages(document.getId(), request.getPrompt());
    List<Integer> citations = new ArrayList<>();
    String context = buildContext(document, request, hits, citations);

    List<dev.langchain4j.data.message.ChatMessage> messages =
        buildConversation(session, userTurn, context + "\nQuery: " + request.getPrompt());
    GeneratedAnswer answer = answerGenerator.generate(messages);

    saveModelTurn(session, answer, citations);
    recordUsage(ownerId, quota, answer);
    meterRegistry.counter("assistant.answers").increment();
    log.info(
        "Answered question in session {} with {} cited pages ({} tokens)",
        session.getId(),
        citations.size(),
        answer.totalTokens());

    return AskResponse.builder()
        .sessionId(session.getId())
        .message(answer.text())
        .citations(citations)
        .build();
  }

  @Override
  @Transactional(readOnly = true)
  public ChatHistory getChatHistory(String ownerId, UUID sessionId) {
    entitlementService.ensureEntitled(ownerId);
    ChatSession session = loadOwnedSession(ownerId, sessionId);
    return new ChatHistory(
        session, messageRepository.findBySessionIdOrderByCreatedAtAsc(session.getId()));
  }

  private void validate(AskRequest request) {
    if (request == null || request.getDocumentId() == null) {
      throw new InvalidRequestException("documentId is required", "A document is required");
    }
    String prompt = request.getPrompt();
    if (prompt == null || prompt.isBlank()) {
      throw new InvalidRequestException("prompt is required", "Please enter a question");
    }
    int maxChars = readerConfig.getRetrieval().getMaxPromptChars();
    if (prompt.length() > maxChars) {
      throw new InvalidRequestException(
          "prompt too long: " + prompt.length(),
          "Questions must not exceed " + maxChars + " characters");
    }
  }

  private ChatSession resolveSession(String ownerId, AskRequest request) {
    if (request.getSessionId() != null) {
      return loadOwnedSession(ownerId, request.getSessionId());
    }
    ChatSession created =
        sessionRepository.save(
            ChatSession.builder()
                .ownerId(ownerId)
                .documentId(request.getDocumentId())
                .title(
                    request.getDocumentId() != null
                        ? DOCUMENT_SESSION_TITLE
                        : DEFAULT_SESSION_TITLE)
                .build());
    log.debug("Created chat session {} for owner {}", created.getId(), ownerId);
    return created;
  }

  private ChatSession loadOwnedSession(String ownerId, UUID sessionId) {
    ChatSession session =
        sessionRepository
            .findById(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
    if (!session.isOwnedBy(ownerId)) {
      throw new AccessDeniedException("session", sessionId, ownerId);
    }
    return session;
  }

  /** Returns null when the turn could not be stored; answering goes on without it. */
  private ChatMessage saveUserTurn(ChatSession session, String prompt) {
    try {
      return messageRepository.save(
          ChatMessage.builder().session(session).role(MessageRole.USER).content(prompt).build());
    } catch (RuntimeException e) {
      log.warn("Failed to save user message in session {}: {}", session.getId(), e.getMessage());
      return null;
    }
  }

  /** Best-effort; a failed save never skips usage recording. */
  private void saveModelTurn(ChatSession session, GeneratedAnswer answer, List<Integer> citations) {
    try {
      messageRepository.save(
          ChatMessage.builder()
              .session(session)
              .role(MessageRole.MODEL)
              .content(answer.text())
              .citations(new ArrayList<>(citations))
              .tokenCount((int) Math.min(Integer.MAX_VALUE, answer.totalTokens()))
              .build());
    } catch (RuntimeException e) {
      log.warn("Failed to save model response in session {}: {}", session.getId(), e.getMessage());
    }
  }

  private List<PageHit> searchPages(UUID documentId, String prompt) {
    try {
      float[] queryVector = embeddingService.embedQuery(prompt);
      return vectorSearchService.search(
          documentId,
          queryVector,
          readerConfig.getRetrieval().getTopK(),
          readerConfig.getRetrieval().getMinSimilarity());
    } catch (RuntimeException e) {
      log.warn("Page search for document {} failed: {}", documentId, e.getMessage());
      return List.of();
    }
  }

  /**
   * Builds the grounding context. The viewed page comes first and is cited first; search hits on
   * the same page are not repeated.
   */
  String buildContext(
      Document document, AskRequest request, List<PageHit> hits, List<Integer> citations) {
    StringBuilder context = new StringBuilder();
    Integer currentPage = request.getCurrentPage();
    boolean onPage = currentPage != null && currentPage > 0;

    if (onPage) {
      String pageText = currentPageText(document, currentPage);
      if (pageText != null && !pageText.isBlank()) {
        context
            .append("Current page the user is viewing (page ")
            .append(currentPage)
            .append("):\n")
            .append(pageText)
            .append("\n\n")
            .append(SEPARATOR);
        citations.add(currentPage);
      }
      Integer totalPages = request.getTotalPages();
      if (totalPages != null && totalPages > 0) {
        context.append(
            String.format(
                "The user is currently viewing page %d of %d.\n", currentPage, totalPages));
      } else {
        context.append(String.format("The user is currently viewing page %d.\n", currentPage));
      }
    }

    context.append("Additional context from the document:\n").append(SEPARATOR);
    for (PageHit hit : hits) {
      if (onPage && hit.pageNumber() == currentPage) {
        continue;
      }
      context.append(String.format("Page %d: %s\n\n", hit.pageNumber(), hit.content()));
      citations.add(hit.pageNumber());
    }
    context
        .append(SEPARATOR)
        .append("RULES: Answer the user's question using ONLY the document context above. ")
        .append(
            "Allowed questions include: what the document is about, summary, main topic, "
                + "themes, specific passages, characters, plot, or any question that can be "
                + "answered from the text. ")
        .append(
            "Only refuse if the question is clearly unrelated (e.g. coding, math, other books, "
                + "or topics that cannot be answered from this document). ")
        .append("If you must refuse, say: \"")
        .append(REFUSAL)
        .append("\" ")
        .append(
            "Do not write code, role-play, or use outside knowledge. If the context is empty, "
                + "say you don't have enough of the document to answer.\n");
    return context.toString();
  }

  /** Page row text when ingested, else the optimized page of the document. */
  private String currentPageText(Document document, int pageNumber) {
    String ingested =
        pageRepository
            .findByDocumentIdAndPageNumber(document.getId(), pageNumber)
            .map(DocumentPage::getContent)
            .orElse(null);
    if (ingested != null) {
      return ingested;
    }
    List<String> pages = document.getOptimizedPages();
    if (pages != null && pageNumber <= pages.size()) {
      return pages.get(pageNumber - 1);
    }
    return null;
  }

  private List<dev.langchain4j.data.message.ChatMessage> buildConversation(
      ChatSession session, ChatMessage userTurn, String finalUserMessage) {
    List<dev.langchain4j.data.message.ChatMessage> messages = new ArrayList<>();
    UUID currentTurnId = userTurn != null ? userTurn.getId() : null;

    for (ChatMessage msg : messageRepository.findBySessionIdOrderByCreatedAtAsc(session.getId())) {
      if (currentTurnId != null && Objects.equals(msg.getId(), currentTurnId)) {
        continue;
      }
      if (msg.getRole() == MessageRole.USER) {
        messages.add(UserMessage.from(msg.getContent()));
      } else if (msg.getRole() == MessageRole.MODEL) {
        messages.add(AiMessage.from(msg.getContent()));
      }
    }
    messages.add(UserMessage.from(finalUserMessage));
    return messages;
  }

  private void recordUsage(String ownerId, QuotaSnapshot quota, GeneratedAnswer answer) {
    meterRegistry.counter("assistant.tokens.in").increment(answer.inputTokens());
    meterRegistry.counter("assistant.tokens.out").increment(answer.outputTokens());
    try {
      usageLedgerService.recordUsage(ownerId, answer.inputTokens(), answer.outputTokens());
    } catch (RuntimeException e) {
      log.warn("Failed to record usage for owner {}: {}", ownerId, e.getMessage());
    }
    if (answer.totalTokens() > quota.remaining()) {
      log.warn(
          "Assistant usage exceeded monthly budget after call: owner={}, budget={}, "
              + "usedBefore={}, usedAfter={}",
          ownerId,
          quota.budget(),
          quota.used(),
          quota.used() + answer.totalTokens());
    }
  }
}
